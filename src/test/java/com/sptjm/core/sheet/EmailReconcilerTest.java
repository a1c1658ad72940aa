package com.sptjm.core.sheet;

import com.sptjm.core.model.LetterRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class EmailReconcilerTest {

    private final EmailReconciler reconciler = new EmailReconciler();

    @Test
    void fillsOnlyMissingAddresses() throws SchemaException {
        EmailMapping mapping = EmailMapping.read(SheetTable.ofText(
            List.of("NIP", "Email"),
            List.of(List.of("123", "ana@x.com"), List.of("456", "mapped@x.com"))
        ));
        List<LetterRecord> records = List.of(
            record("123", null),
            record("456", "own@x.com"),
            record("999", null)
        );

        List<LetterRecord> reconciled = reconciler.reconcile(records, mapping);

        assertEquals(Optional.of("ana@x.com"), reconciled.get(0).emailAddress());
        assertEquals(Optional.of("own@x.com"), reconciled.get(1).emailAddress());
        assertFalse(reconciled.get(2).hasEmail());
        assertEquals(List.of("123", "456", "999"), reconciled.stream().map(LetterRecord::id).toList());
    }

    @Test
    void emptyMappingChangesNothing() {
        List<LetterRecord> records = List.of(record("1", null), record("2", "b@x.com"));

        assertEquals(records, reconciler.reconcile(records, EmailMapping.empty()));
    }

    private static LetterRecord record(String id, String email) {
        return new LetterRecord(id, "Name " + id, "FT", "00" + id, "", email, List.of());
    }
}
