package org.querydump.file;

import org.apache.commons.csv.QuoteMode;

import java.util.Locale;

/**
 * When CSV fields are enclosed in quote characters.
 */
public enum CsvQuoting {
    MINIMAL(0, QuoteMode.MINIMAL),
    ALL(1, QuoteMode.ALL),
    NONNUMERIC(2, QuoteMode.NON_NUMERIC),
    NONE(3, QuoteMode.NONE);

    private final int code;
    private final QuoteMode quoteMode;

    CsvQuoting(int code, QuoteMode quoteMode) {
        this.code = code;
        this.quoteMode = quoteMode;
    }

    public QuoteMode getQuoteMode() {
        return quoteMode;
    }

    /**
     * Accepts "ALL", "QUOTE_ALL", "csv.QUOTE_ALL" (any case) and the numeric codes 0 to 3.
     *
     * @return the quoting policy, or null if the value names none
     */
    public static CsvQuoting parse(String value) {
        if (value == null) {
            return null;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        if (name.startsWith("CSV.")) name = name.substring("CSV.".length());
        if (name.startsWith("QUOTE_")) name = name.substring("QUOTE_".length());

        for (CsvQuoting quoting : values()) {
            if (quoting.name().equals(name) || String.valueOf(quoting.code).equals(name)) {
                return quoting;
            }
        }
        return null;
    }
}
