package com.sptjm.core.sheet;

import com.sptjm.core.model.LetterRecord;
import com.sptjm.core.model.Proposal;
import com.sptjm.logging.AppLogger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the wide SPTJM sheet into one {@link LetterRecord} per person.
 * <p>
 * Identity columns are {@code NIP}, {@code Nama}, {@code Fakultas} and {@code Norek}; proposals come from
 * the numbered column groups {@code NoProp<i>}, {@code Judul<i>}, {@code Skema<i>} and {@code Jumlah_dana<i>}.
 * The highest {@code NoProp} suffix in the header decides how many slots every row is scanned for, and a slot
 * only becomes a proposal when its {@code NoProp<i>} cell has a value.
 */
public class RecordExtractor {
    private static final Logger LOGGER = AppLogger.get();

    public static final String HEADER_ID = "NIP";
    public static final String HEADER_NAME = "Nama";
    public static final String HEADER_UNIT = "Fakultas";
    public static final String HEADER_ACCOUNT = "Norek";
    static final List<String> BANK_HEADERS = List.of("Nama Bank", "nama_bank");
    static final List<String> EMAIL_HEADERS = List.of("Email", "email");

    static final String PREFIX_NUMBER = "NoProp";
    static final String PREFIX_TITLE = "Judul";
    static final String PREFIX_SCHEME = "Skema";
    static final String PREFIX_AMOUNT = "Jumlah_dana";

    private static final Pattern PROPOSAL_NUMBER_HEADER = Pattern.compile("NoProp(\\d+)");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    public ExtractionResult extract(SheetTable table) throws SchemaException {
        validateRequiredHeaders(table.headers());
        int slots = detectProposalSlots(table.headers());

        int idIdx = table.indexOf(HEADER_ID);
        int nameIdx = table.indexOf(HEADER_NAME);
        int unitIdx = table.indexOf(HEADER_UNIT);
        int accountIdx = table.indexOf(HEADER_ACCOUNT);
        int bankIdx = firstPresent(table, BANK_HEADERS);
        int emailIdx = firstPresent(table, EMAIL_HEADERS);
        SlotColumns[] slotColumns = new SlotColumns[slots];
        for (int i = 1; i <= slots; i++) {
            slotColumns[i - 1] = new SlotColumns(
                table.indexOf(PREFIX_NUMBER + i),
                table.indexOf(PREFIX_TITLE + i),
                table.indexOf(PREFIX_SCHEME + i),
                table.indexOf(PREFIX_AMOUNT + i)
            );
        }

        List<LetterRecord> records = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        int skipped = 0;
        int rowNumber = 1;
        for (List<SheetTable.Cell> row : table.rows()) {
            rowNumber++;
            String id = SheetTable.cell(row, idIdx).text();
            String name = SheetTable.cell(row, nameIdx).text();
            String unit = SheetTable.cell(row, unitIdx).text();
            String account = SheetTable.cell(row, accountIdx).text();
            if (id.isEmpty() || name.isEmpty() || unit.isEmpty() || account.isEmpty()) {
                LOGGER.fine("Skipping row %d: missing identity value".formatted(rowNumber));
                skipped++;
                continue;
            }
            if (!seenIds.add(id)) {
                LOGGER.warning("Skipping row %d: NIP %s already appeared earlier in the sheet".formatted(rowNumber, id));
                skipped++;
                continue;
            }

            List<Proposal> proposals = new ArrayList<>();
            for (SlotColumns columns : slotColumns) {
                String number = SheetTable.cell(row, columns.number()).text();
                if (number.isEmpty()) {
                    continue;
                }
                SheetTable.Cell amountCell = SheetTable.cell(row, columns.amount());
                proposals.add(new Proposal(
                    number,
                    SheetTable.cell(row, columns.title()).text(),
                    SheetTable.cell(row, columns.scheme()).text(),
                    toAmount(amountCell),
                    amountCell.text()
                ));
            }

            String bank = SheetTable.cell(row, bankIdx).text();
            String email = EmailAddresses.normalize(SheetTable.cell(row, emailIdx).text());
            records.add(new LetterRecord(id, name, unit, account, bank, email, proposals));
        }

        int extracted = records.size();
        int skippedRows = skipped;
        LOGGER.info(() -> "Extracted %d records (%d rows skipped, %d proposal slots)".formatted(extracted, skippedRows, slots));
        return new ExtractionResult(records, skipped, table.rowCount(), slots);
    }

    /**
     * Highest {@code NoProp<i>} suffix present in the header.
     */
    static int detectProposalSlots(List<String> headers) throws SchemaException {
        int max = 0;
        for (String header : headers) {
            Matcher matcher = PROPOSAL_NUMBER_HEADER.matcher(header);
            if (matcher.matches()) {
                max = Math.max(max, Integer.parseInt(matcher.group(1)));
            }
        }
        if (max == 0) {
            throw new SchemaException("No proposal columns found (expected NoProp1, NoProp2, ...)");
        }
        return max;
    }

    private static void validateRequiredHeaders(List<String> headers) throws SchemaException {
        List<String> missing = new ArrayList<>();
        for (String required : List.of(HEADER_ID, HEADER_NAME, HEADER_UNIT, HEADER_ACCOUNT)) {
            if (!headers.contains(required)) {
                missing.add(required);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException("Missing required columns: " + missing);
        }
    }

    private static int firstPresent(SheetTable table, List<String> candidates) {
        for (String candidate : candidates) {
            int idx = table.indexOf(candidate);
            if (idx >= 0) {
                return idx;
            }
        }
        return -1;
    }

    private static BigDecimal toAmount(SheetTable.Cell cell) {
        if (cell.number() != null) {
            return cell.number();
        }
        String text = cell.text();
        if (PLAIN_NUMBER.matcher(text).matches()) {
            return new BigDecimal(text);
        }
        return null;
    }

    private record SlotColumns(int number, int title, int scheme, int amount) {
    }
}
