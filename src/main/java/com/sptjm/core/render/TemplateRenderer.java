package com.sptjm.core.render;

import com.sptjm.core.model.LetterRecord;
import com.sptjm.core.model.Proposal;
import com.sptjm.logging.AppLogger;
import org.apache.poi.xwpf.usermodel.IBody;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRow;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Merges a {@link LetterRecord} into a {@code .docx} template and writes the editable intermediate document.
 * <p>
 * Identity tokens ({@code {{NAMA}}}, {@code {{NIP}}}, ...) are replaced everywhere in the document. Any table row
 * that mentions a proposal token ({@code {{NO_PROP}}}, {@code {{JUDUL}}}, ...) is a template row: it is repeated
 * once per proposal and then dropped, so a record without proposals leaves only the table header.
 */
public class TemplateRenderer {
    private static final Logger LOGGER = AppLogger.get();

    static final List<String> PROPOSAL_KEYS = List.of("NO", "NO_PROP", "JUDUL", "SKEMA", "JUMLAH_DANA");
    private static final Locale INDONESIAN = new Locale("id", "ID");
    private static final DateTimeFormatter LETTER_DATE = DateTimeFormatter.ofPattern("d MMMM yyyy", INDONESIAN);

    private final Path templateFile;
    private final LocalDate letterDate;

    /**
     * @param templateFile custom template, or {@code null} for {@link DefaultLetterTemplate}
     * @param letterDate   date printed in the signature block
     */
    public TemplateRenderer(Path templateFile, LocalDate letterDate) {
        this.templateFile = templateFile;
        this.letterDate = letterDate;
    }

    public Path render(LetterRecord record, Path target) throws IOException {
        try (XWPFDocument document = openTemplate()) {
            Map<String, String> identity = identityValues(record);
            for (XWPFTable table : List.copyOf(document.getTables())) {
                expandProposalRows(table, record.proposals(), identity);
            }
            replaceInBody(document, identity);
            for (XWPFHeader header : document.getHeaderList()) {
                replaceInBody(header, identity);
            }
            for (XWPFFooter footer : document.getFooterList()) {
                replaceInBody(footer, identity);
            }

            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(target)) {
                document.write(out);
            }
        }
        LOGGER.fine(() -> "Rendered %s with %d proposals".formatted(target.getFileName(), record.proposals().size()));
        return target;
    }

    private XWPFDocument openTemplate() throws IOException {
        if (templateFile == null) {
            return DefaultLetterTemplate.create();
        }
        try (InputStream in = Files.newInputStream(templateFile)) {
            return new XWPFDocument(in);
        }
    }

    Map<String, String> identityValues(LetterRecord record) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("NAMA", record.name());
        values.put("NIP", record.id());
        values.put("FAKULTAS", record.unit());
        values.put("NOREK", record.accountNumber());
        values.put("BANK", record.bankName().isBlank() ? "-" : record.bankName());
        values.put("EMAIL", record.emailAddress().orElse(""));
        values.put("TANGGAL", LETTER_DATE.format(letterDate));
        return values;
    }

    static Map<String, String> proposalValues(int index, Proposal proposal) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("NO", String.valueOf(index));
        values.put("NO_PROP", proposal.number());
        values.put("JUDUL", proposal.title());
        values.put("SKEMA", proposal.scheme());
        values.put("JUMLAH_DANA", RupiahFormat.format(proposal));
        return values;
    }

    private void expandProposalRows(XWPFTable table, List<Proposal> proposals, Map<String, String> identity) {
        for (XWPFTableRow row : table.getRows()) {
            for (XWPFTableCell cell : row.getTableCells()) {
                for (XWPFTable nested : List.copyOf(cell.getTables())) {
                    expandProposalRows(nested, proposals, identity);
                }
            }
        }
        List<XWPFTableRow> templateRows = new ArrayList<>();
        for (XWPFTableRow row : table.getRows()) {
            if (rowMentionsProposal(row)) {
                templateRows.add(row);
            }
        }
        for (XWPFTableRow templateRow : templateRows) {
            int position = table.getRows().indexOf(templateRow);
            for (int i = 0; i < proposals.size(); i++) {
                XWPFTableRow copy = cloneRow(templateRow, table);
                Map<String, String> values = new LinkedHashMap<>(identity);
                values.putAll(proposalValues(i + 1, proposals.get(i)));
                for (XWPFTableCell cell : copy.getTableCells()) {
                    replaceInBody(cell, values);
                }
                // addRow copies the row XML, so the copy has to be filled in before it is inserted
                table.addRow(copy, position + i);
            }
            table.removeRow(position + proposals.size());
        }
    }

    private static boolean rowMentionsProposal(XWPFTableRow row) {
        for (XWPFTableCell cell : row.getTableCells()) {
            if (Placeholders.mentionsAny(cell.getText(), Placeholders.DOCUMENT, PROPOSAL_KEYS)) {
                return true;
            }
        }
        return false;
    }

    private static XWPFTableRow cloneRow(XWPFTableRow source, XWPFTable table) {
        CTRow copy = (CTRow) source.getCtRow().copy();
        return new XWPFTableRow(copy, table);
    }

    private static void replaceInBody(IBody body, Map<String, String> values) {
        for (XWPFParagraph paragraph : body.getParagraphs()) {
            replaceInParagraph(paragraph, values);
        }
        for (XWPFTable table : body.getTables()) {
            for (XWPFTableRow row : table.getRows()) {
                for (XWPFTableCell cell : row.getTableCells()) {
                    replaceInBody(cell, values);
                }
            }
        }
    }

    /**
     * Replaces tokens run by run first; a token split across runs is resolved by folding the paragraph text
     * into its first run, which keeps that run's formatting. Values are substituted once, from the template text.
     */
    static void replaceInParagraph(XWPFParagraph paragraph, Map<String, String> values) {
        String text = paragraph.getText();
        if (text == null || !text.contains("{{")) {
            return;
        }
        String resolved = Placeholders.substitute(text, Placeholders.DOCUMENT, values);
        for (XWPFRun run : paragraph.getRuns()) {
            String runText = run.getText(0);
            if (runText != null && runText.contains("{{")) {
                String replaced = Placeholders.substitute(runText, Placeholders.DOCUMENT, values);
                if (!replaced.equals(runText)) {
                    run.setText(replaced, 0);
                }
            }
        }

        List<XWPFRun> runs = paragraph.getRuns();
        if (resolved.equals(paragraph.getText()) || runs.isEmpty()) {
            return;
        }
        runs.get(0).setText(resolved, 0);
        for (int i = runs.size() - 1; i > 0; i--) {
            paragraph.removeRun(i);
        }
    }
}
