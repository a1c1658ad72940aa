package com.sptjm.core.render;

import org.apache.poi.xwpf.usermodel.BreakType;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;

import java.util.List;

/**
 * Built-in SPTJM layout used when no template file is configured.
 * Page one holds the statement and signature block, page two the proposal attachment table.
 */
public final class DefaultLetterTemplate {
    private static final String FONT = "Cambria";
    private static final String MUTED = "A0A0A0";

    static final List<String> STATEMENTS = List.of(
        "Biaya Submit Artikel yang saya ajukan seperti yang tersebut pada lampiran belum pernah saya "
            + "pertanggungjawabkan pada penelitian yang telah dilaksanakan, atau belum pernah menerima bantuan "
            + "publikasi dari pihak/sumber dana lainnya, dan jika di kemudian hari terbukti bahwa biaya submit artikel "
            + "yang saya ajukan telah pernah menerima bantuan publikasi dari pihak/sumber dana lainnya, maka saya akan "
            + "mengembalikan dana insentif yang saya terima ke rekening Universitas Syiah Kuala.",
        "Biaya submit artikel yang saya ajukan seperti yang tersebut pada lampiran belum pernah dipertanggungjawabkan "
            + "pada laporan penelitian dan belum pernah menerima bantuan publikasi dari sumber dana lain. Apabila di "
            + "kemudian hari terbukti sebaliknya, saya bersedia mengembalikan dana yang telah diterima ke rekening "
            + "Universitas Syiah Kuala.",
        "Artikel ilmiah/opini media massa/hak kekayaan intelektual yang diajukan seperti yang tersebut pada lampiran "
            + "bebas plagiarisme dan merupakan karya asli.",
        "Artikel ilmiah/opini media massa/hak kekayaan intelektual yang diajukan seperti yang tersebut pada lampiran "
            + "belum pernah menerima insentif pada periode sebelumnya maupun dari sumber dana lain.",
        "Saya bersedia mengembalikan dana insentif apabila di kemudian hari terbukti bahwa karya yang diajukan bukan "
            + "milik saya, sudah pernah menerima insentif, atau tidak sesuai dengan ketentuan yang berlaku.",
        "Nomor rekening dan nama bank yang saya cantumkan benar dan aktif untuk menerima dana insentif."
    );

    private DefaultLetterTemplate() {
    }

    public static XWPFDocument create() {
        XWPFDocument doc = new XWPFDocument();

        paragraph(doc, ParagraphAlignment.CENTER, 12, true, "SURAT PERNYATAAN TANGGUNGJAWAB MUTLAK (SPTJM)");
        paragraph(doc, ParagraphAlignment.CENTER, 12, true,
            "Biaya Submit Artikel/Insentif Publikasi/Opini Media Massa/Hak Kekayaan Intelektual");
        blank(doc);
        paragraph(doc, ParagraphAlignment.LEFT, 11, false, "Yang bertanda tangan di bawah ini:");

        String[][] identity = {
            {"Nama", ": {{NAMA}}"},
            {"NIP", ": {{NIP}}"},
            {"Fakultas", ": {{FAKULTAS}}"},
            {"Nomor Rekening", ": {{NOREK}}"},
            {"Nama Bank", ": {{BANK}}"}
        };
        XWPFTable identityTable = doc.createTable(identity.length, 2);
        identityTable.removeBorders();
        for (int r = 0; r < identity.length; r++) {
            cellText(identityTable.getRow(r).getCell(0), 11, false, identity[r][0]);
            cellText(identityTable.getRow(r).getCell(1), 11, false, identity[r][1]);
        }

        blank(doc);
        paragraph(doc, ParagraphAlignment.LEFT, 11, false, "Menyatakan dengan sesungguhnya bahwa:");

        XWPFTable statementTable = doc.createTable(STATEMENTS.size(), 2);
        statementTable.removeBorders();
        for (int i = 0; i < STATEMENTS.size(); i++) {
            XWPFTableCell number = statementTable.getRow(i).getCell(0);
            cellText(number, 11, false, String.valueOf(i + 1));
            number.getParagraphs().get(0).setAlignment(ParagraphAlignment.CENTER);
            XWPFTableCell text = statementTable.getRow(i).getCell(1);
            cellText(text, 11, false, STATEMENTS.get(i));
            text.getParagraphs().get(0).setAlignment(ParagraphAlignment.BOTH);
        }

        blank(doc);
        XWPFParagraph place = paragraph(doc, ParagraphAlignment.RIGHT, 11, false, "Banda Aceh,     {{TANGGAL}}");
        XWPFRun declarant = place.createRun();
        style(declarant, 11, false);
        declarant.addBreak();
        declarant.setText("Yang menyatakan,");

        blank(doc);
        XWPFParagraph stamp = paragraph(doc, ParagraphAlignment.RIGHT, 11, false, "Materai 10000");
        stamp.getRuns().get(0).setColor(MUTED);

        blank(doc);
        XWPFParagraph signer = paragraph(doc, ParagraphAlignment.RIGHT, 11, false, "{{NAMA}}");
        XWPFRun signerId = signer.createRun();
        style(signerId, 11, false);
        signerId.addBreak();
        signerId.setText("NIP. {{NIP}}");

        XWPFParagraph pageBreak = doc.createParagraph();
        pageBreak.createRun().addBreak(BreakType.PAGE);

        XWPFParagraph intro = paragraph(doc, ParagraphAlignment.BOTH, 11, false,
            "Lampiran Daftar Biaya Submit Artikel/Insentif Publikasi/Opini Media Massa/Hak Kekayaan Intelektual "
                + "yang didanai atas nama {{NAMA}} sebagai berikut:");
        intro.setSpacingAfter(120);

        String[] headers = {"No. Proposal", "Judul Insentif", "Skema", "Jumlah Dana (Rp)"};
        String[] rowTokens = {"{{NO_PROP}}", "{{JUDUL}}", "{{SKEMA}}", "{{JUMLAH_DANA}}"};
        XWPFTable proposals = doc.createTable(2, headers.length);
        proposals.setWidth("100%");
        for (int c = 0; c < headers.length; c++) {
            cellText(proposals.getRow(0).getCell(c), 10, true, headers[c]);
            cellText(proposals.getRow(1).getCell(c), 10, false, rowTokens[c]);
        }

        blank(doc);
        blank(doc);
        XWPFTable signatureBox = doc.createTable(1, 3);
        signatureBox.removeBorders();
        XWPFTableCell label = signatureBox.getRow(0).getCell(1);
        cellText(label, 9, false, "Tanda");
        XWPFRun second = label.getParagraphs().get(0).createRun();
        style(second, 9, false);
        second.addBreak();
        second.setText("Tangan");
        label.getParagraphs().get(0).setAlignment(ParagraphAlignment.CENTER);
        return doc;
    }

    private static XWPFParagraph paragraph(XWPFDocument doc, ParagraphAlignment alignment, int size, boolean bold, String text) {
        XWPFParagraph p = doc.createParagraph();
        p.setAlignment(alignment);
        p.setSpacingBefore(0);
        p.setSpacingAfter(0);
        XWPFRun run = p.createRun();
        style(run, size, bold);
        run.setText(text);
        return p;
    }

    private static void blank(XWPFDocument doc) {
        doc.createParagraph();
    }

    private static void cellText(XWPFTableCell cell, int size, boolean bold, String text) {
        XWPFParagraph p = cell.getParagraphs().get(0);
        p.setSpacingBefore(0);
        p.setSpacingAfter(0);
        XWPFRun run = p.createRun();
        style(run, size, bold);
        run.setText(text);
    }

    private static void style(XWPFRun run, int size, boolean bold) {
        run.setFontFamily(FONT);
        run.setFontSize(size);
        run.setBold(bold);
    }
}
