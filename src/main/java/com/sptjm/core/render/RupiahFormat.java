package com.sptjm.core.render;

import com.sptjm.core.model.Proposal;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Formats funding amounts the way the letters print them: whole rupiah, {@code .} as the grouping separator.
 */
public final class RupiahFormat {

    private RupiahFormat() {
    }

    public static String format(Proposal proposal) {
        if (proposal.amount() == null) {
            return proposal.amountText();
        }
        DecimalFormatSymbols symbols = new DecimalFormatSymbols(Locale.ROOT);
        symbols.setGroupingSeparator('.');
        DecimalFormat format = new DecimalFormat("#,##0", symbols);
        format.setRoundingMode(RoundingMode.DOWN);
        return format.format(proposal.amount());
    }
}
