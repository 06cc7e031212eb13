package org.querydump.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.util.List;

@Log4j2
public class RecordEncoderFactory {

    private final ObjectMapper mapper;

    public RecordEncoderFactory(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Instantiate a RecordEncoder for the requested file format.
     *
     * @param options the user-provided format options
     * @param dialect the csv dialect resolved for this export, ignored for JSON
     * @param columns the output column names, in query order
     * @return the encoder shared by every file of the export
     */
    public RecordEncoder accept(ExportFormatOptions options, CsvDialect dialect, List<String> columns) {
        FileFormats fileFormat = options.getFileFormat();

        if (FileFormats.CSV == fileFormat) {
            log.info("return CsvRecordEncoder with dialect {}", dialect);
            return new CsvRecordEncoder(columns, dialect, options.isCsvColumnHeader());
        } else if (FileFormats.JSON == fileFormat) {
            log.info("return JsonRecordEncoder");
            return new JsonRecordEncoder(columns, mapper);
        } else {
            // JSON is the Default file format
            log.warn("The file format is not defined, setting JSON as the default file format.");
            return new JsonRecordEncoder(columns, mapper);
        }
    }
}
