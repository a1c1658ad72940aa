package com.sptjm.core.model;

import java.math.BigDecimal;

/**
 * One funding proposal listed in a letter's attachment table.
 *
 * @param number     proposal number, never blank
 * @param title      proposal title, may be empty
 * @param scheme     funding scheme, may be empty
 * @param amount     numeric funding amount, {@code null} when the cell was blank or not numeric
 * @param amountText trimmed cell text, used for display when {@code amount} is {@code null}
 */
public record Proposal(String number, String title, String scheme, BigDecimal amount, String amountText) {

    public Proposal {
        if (number == null || number.isBlank()) {
            throw new IllegalArgumentException("Proposal number must not be blank");
        }
        number = number.trim();
        title = title == null ? "" : title.trim();
        scheme = scheme == null ? "" : scheme.trim();
        amountText = amountText == null ? "" : amountText.trim();
    }
}
