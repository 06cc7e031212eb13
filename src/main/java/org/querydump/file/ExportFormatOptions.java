package org.querydump.file;

import lombok.Data;

/**
 * Raw output format settings as given by the user. The csv fields are ignored for JSON,
 * and a named csv dialect overrides every other csv field.
 * A new instance with the defaults is created for every export.
 */
@Data
public class ExportFormatOptions {

    private FileFormats fileFormat = FileFormats.JSON;
    private String csvDialect;
    private String csvDelimiter = ",";
    private boolean csvDoublequote = true;
    private String csvEscapechar;
    private String csvLineterminator = "\r\n";
    private String csvQuotechar = "\"";
    private String csvQuoting = CsvQuoting.MINIMAL.name();
    private boolean csvColumnHeader = false;
}
