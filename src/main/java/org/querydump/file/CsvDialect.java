package org.querydump.file;

import lombok.Value;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.lang3.StringUtils;
import org.querydump.exception.ConfigurationException;

import java.util.Locale;

/**
 * A resolved set of CSV formatting rules. Resolved once per export and shared by every file of it.
 */
@Value
public class CsvDialect {

    public static final CsvDialect EXCEL = new CsvDialect(',', true, null, "\r\n", '"', CsvQuoting.MINIMAL);
    public static final CsvDialect EXCEL_TAB = new CsvDialect('\t', true, null, "\r\n", '"', CsvQuoting.MINIMAL);
    public static final CsvDialect UNIX = new CsvDialect(',', true, null, "\n", '"', CsvQuoting.ALL);

    char delimiter;
    boolean doublequote;
    Character escapechar;
    String lineterminator;
    Character quotechar;
    CsvQuoting quoting;

    /**
     * Looks up one of the preset dialects: excel, excel-tab, unix (or unix_dialect).
     */
    public static CsvDialect preset(String name) throws ConfigurationException {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "excel":
                return EXCEL;
            case "excel-tab":
            case "excel_tab":
                return EXCEL_TAB;
            case "unix":
            case "unix_dialect":
                return UNIX;
            default:
                throw new ConfigurationException("Unknown csv dialect '" + name + "'. The allowed values are excel, excel-tab, unix");
        }
    }

    /**
     * Builds the dialect from the user options, either the named preset or the custom csv_* fields.
     */
    public static CsvDialect resolve(ExportFormatOptions options) throws ConfigurationException {
        if (StringUtils.isNotBlank(options.getCsvDialect())) {
            return preset(options.getCsvDialect());
        }

        CsvQuoting quoting = CsvQuoting.parse(options.getCsvQuoting());
        if (quoting == null) {
            throw new ConfigurationException("Unsupported csv quoting '" + options.getCsvQuoting()
                    + "'. The allowed values are ALL, MINIMAL, NONNUMERIC, NONE");
        }
        Character delimiter = singleChar("csv delimiter", options.getCsvDelimiter());
        if (delimiter == null) {
            throw new ConfigurationException("The csv delimiter must be a one-character string");
        }
        Character quotechar = singleChar("csv quotechar", options.getCsvQuotechar());
        if (quotechar == null && quoting != CsvQuoting.NONE) {
            throw new ConfigurationException("A csv quotechar is required unless quoting is NONE");
        }
        Character escapechar = singleChar("csv escapechar", options.getCsvEscapechar());
        String lineterminator = options.getCsvLineterminator();
        if (StringUtils.isEmpty(lineterminator)) {
            throw new ConfigurationException("The csv lineterminator must not be empty");
        }

        CsvDialect dialect = new CsvDialect(delimiter, options.isCsvDoublequote(), escapechar, lineterminator, quotechar, quoting);
        try {
            dialect.toCsvFormat();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid csv dialect " + dialect + ": " + e.getMessage(), e);
        }
        return dialect;
    }

    private static Character singleChar(String option, String value) throws ConfigurationException {
        if (StringUtils.isEmpty(value)) {
            return null;
        }
        if (value.length() != 1) {
            throw new ConfigurationException("The " + option + " must be a one-character string, got '" + value + "'");
        }
        return value.charAt(0);
    }

    /**
     * Translates the dialect to a commons-csv format.
     * <p>
     * Quoting NONE prints values raw. {@link CsvRecordEncoder} escapes the special characters itself,
     * or rejects the value when there is no escape character.
     */
    public CSVFormat toCsvFormat() {
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setRecordSeparator(lineterminator)
                .setIgnoreEmptyLines(false);

        if (quoting == CsvQuoting.NONE) {
            builder.setQuote(null).setEscape(null).setQuoteMode(null);
        } else {
            builder.setQuote(quotechar).setQuoteMode(quoting.getQuoteMode());
            // With doublequote the quote char is doubled, otherwise it is escaped
            builder.setEscape(doublequote ? null : escapechar);
        }
        return builder.build();
    }
}
