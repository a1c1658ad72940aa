package com.sptjm.core.fs;

import com.sptjm.core.model.LetterRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileNamesTest {

    @Test
    void nameIsSlugPlusId() {
        LetterRecord record = record("197001012000031001", "Dr. Ánna Müller, M.Sc.");

        assertEquals("SPTJM_dr-anna-muller-m-sc_197001012000031001", FileNames.baseName(record));
        assertEquals("SPTJM_dr-anna-muller-m-sc_197001012000031001.pdf", FileNames.documentName(record, ".pdf"));
        assertEquals("SPTJM_dr-anna-muller-m-sc_197001012000031001.docx", FileNames.documentName(record, "docx"));
    }

    @Test
    void sameInputGivesSameName() {
        assertEquals(FileNames.baseName(record("1", "Ana")), FileNames.baseName(record("1", "Ana")));
        assertNotEquals(FileNames.baseName(record("1", "Ana")), FileNames.baseName(record("2", "Ana")));
    }

    @Test
    void longNamesAreCutBeforeTheId() {
        String id = "198501012010121002";
        LetterRecord record = record(id, "Nama Sangat Panjang ".repeat(20));

        String base = FileNames.baseName(record);

        assertTrue(base.length() <= FileNames.MAX_BASE_LENGTH, base);
        assertTrue(base.endsWith("_" + id), base);
        assertTrue(base.startsWith("SPTJM_nama-sangat-panjang"), base);
    }

    @Test
    void unsafeIdCharactersAreReplaced() {
        assertEquals("SPTJM_ana_12-34", FileNames.baseName(record("12/34", "Ana")));
    }

    @Test
    void slugifyKeepsOnlyAsciiWords() {
        assertEquals("t-umar-s-ag", FileNames.slugify("T. 'Umar, S.Ag"));
        assertEquals("", FileNames.slugify("  "));
    }

    private static LetterRecord record(String id, String name) {
        return new LetterRecord(id, name, "FT", "001", "", null, List.of());
    }
}
