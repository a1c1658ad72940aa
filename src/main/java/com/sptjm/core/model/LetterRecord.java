package com.sptjm.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One person from the input sheet together with the proposals their letter covers.
 * The email address is the only field that may change after extraction, through {@link #withEmail(String)}.
 */
public record LetterRecord(String id,
                           String name,
                           String unit,
                           String accountNumber,
                           String bankName,
                           String email,
                           List<Proposal> proposals) {

    public LetterRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        unit = unit == null ? "" : unit;
        accountNumber = accountNumber == null ? "" : accountNumber;
        bankName = bankName == null ? "" : bankName;
        email = email == null || email.isBlank() ? null : email.trim();
        proposals = proposals == null ? List.of() : List.copyOf(proposals);
    }

    public Optional<String> emailAddress() {
        return Optional.ofNullable(email);
    }

    public boolean hasEmail() {
        return email != null;
    }

    public LetterRecord withEmail(String address) {
        return new LetterRecord(id, name, unit, accountNumber, bankName, address, proposals);
    }
}
