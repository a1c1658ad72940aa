package com.sptjm.core.sheet;

import com.sptjm.logging.AppLogger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * NIP to email lookup loaded from a two-column mapping sheet.
 * A NIP listed more than once keeps the last valid address.
 */
public final class EmailMapping {
    private static final Logger LOGGER = AppLogger.get();

    static final String HEADER_ID = "NIP";
    static final String HEADER_EMAIL = "Email";

    private final Map<String, String> addresses;
    private final int duplicates;

    private EmailMapping(Map<String, String> addresses, int duplicates) {
        this.addresses = Collections.unmodifiableMap(addresses);
        this.duplicates = duplicates;
    }

    public static EmailMapping empty() {
        return new EmailMapping(new LinkedHashMap<>(), 0);
    }

    public static EmailMapping read(SheetTable table) throws SchemaException {
        int idIdx = table.indexOfIgnoreCase(HEADER_ID);
        int emailIdx = table.indexOfIgnoreCase(HEADER_EMAIL);
        if (idIdx < 0 || emailIdx < 0) {
            throw new SchemaException("Email mapping must have the columns NIP and Email");
        }
        Map<String, String> addresses = new LinkedHashMap<>();
        int duplicates = 0;
        for (List<SheetTable.Cell> row : table.rows()) {
            String id = SheetTable.cell(row, idIdx).text();
            String email = EmailAddresses.normalize(SheetTable.cell(row, emailIdx).text());
            if (id.isEmpty() || email == null) {
                continue;
            }
            String previous = addresses.put(id, email);
            if (previous != null) {
                duplicates++;
                LOGGER.warning("Email mapping lists NIP %s more than once; %s replaces %s".formatted(id, email, previous));
            }
        }
        LOGGER.info("Loaded %d email mappings (%d duplicate NIPs)".formatted(addresses.size(), duplicates));
        return new EmailMapping(addresses, duplicates);
    }

    public Optional<String> lookup(String id) {
        return Optional.ofNullable(addresses.get(id));
    }

    public int size() {
        return addresses.size();
    }

    public int duplicates() {
        return duplicates;
    }
}
