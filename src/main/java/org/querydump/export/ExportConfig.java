package org.querydump.export;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.querydump.cli.ToolOptions;
import org.querydump.exception.ConfigurationException;
import org.querydump.file.CsvDialect;
import org.querydump.file.ExportFormatOptions;
import org.querydump.file.FileFormats;
import org.querydump.file.FilenameTemplate;
import org.querydump.schema.SchemaField;
import org.querydump.storage.SinkLocation;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything one export needs. Built fresh for each export.
 */
@Data
public class ExportConfig {

    private String sql;
    private String container;
    private String filenameTemplate;
    private String schemaFilename;
    private long approxMaxFileSizeBytes = ToolOptions.DEFAULT_APPROX_MAX_FILE_SIZE;
    private String schemaBlob;
    private List<SchemaField> schemaFields;
    private ExportFormatOptions exportFormat = new ExportFormatOptions();
    private Path tempDirectory;

    /**
     * Checks the settings that can be checked before the query runs.
     *
     * @return the csv dialect of the export, or null for JSON
     */
    public CsvDialect validate() throws ConfigurationException {
        if (StringUtils.isBlank(sql)) {
            throw new ConfigurationException("The source query is not defined");
        }
        FilenameTemplate template = FilenameTemplate.of(filenameTemplate);
        if (approxMaxFileSizeBytes <= 0) {
            throw new ConfigurationException("approxMaxFileSizeBytes must be positive, got " + approxMaxFileSizeBytes);
        }
        if (schemaFilename != null && schemaFilename.equals(template.format(0))) {
            throw new ConfigurationException("The schema filename '" + schemaFilename + "' collides with the first data file");
        }
        if (exportFormat == null || exportFormat.getFileFormat() == null) {
            throw new ConfigurationException("The file format is not defined");
        }
        return exportFormat.getFileFormat() == FileFormats.CSV ? CsvDialect.resolve(exportFormat) : null;
    }

    public static ExportConfig fromOptions(ToolOptions options, ObjectMapper mapper) throws ConfigurationException {
        ExportConfig config = new ExportConfig();
        config.setSql(options.getSourceQuery());
        config.setContainer(SinkLocation.parse(options.getSinkConnect()).getContainer());
        config.setFilenameTemplate(options.getSinkFilename());
        config.setSchemaFilename(options.getSinkSchemaFilename());
        config.setApproxMaxFileSizeBytes(options.getApproxMaxFileSize());
        config.setSchemaBlob(options.getSinkSchema());
        if (options.getSinkSchemaFile() != null) {
            config.setSchemaFields(readSchemaFields(options.getSinkSchemaFile(), mapper));
        }
        config.setExportFormat(toExportFormat(options));
        return config;
    }

    static ExportFormatOptions toExportFormat(ToolOptions options) throws ConfigurationException {
        ExportFormatOptions format = new ExportFormatOptions();
        if (options.getSinkFileFormat() != null) {
            FileFormats fileFormat = FileFormats.fromType(options.getSinkFileFormat());
            if (fileFormat == null) {
                throw new ConfigurationException("Unsupported file format '" + options.getSinkFileFormat()
                        + "'. The allowed values are json, csv");
            }
            format.setFileFormat(fileFormat);
        }
        format.setCsvDialect(options.getCsvDialect());
        if (options.getCsvDelimiter() != null) format.setCsvDelimiter(options.getCsvDelimiter());
        if (options.getCsvDoublequote() != null) format.setCsvDoublequote(options.getCsvDoublequote());
        if (options.getCsvEscapechar() != null) format.setCsvEscapechar(options.getCsvEscapechar());
        if (options.getCsvLineterminator() != null) format.setCsvLineterminator(options.getCsvLineterminator());
        if (options.getCsvQuotechar() != null) format.setCsvQuotechar(options.getCsvQuotechar());
        if (options.getCsvQuoting() != null) format.setCsvQuoting(options.getCsvQuoting());
        format.setCsvColumnHeader(options.isCsvColumnHeader());
        return format;
    }

    private static List<SchemaField> readSchemaFields(String path, ObjectMapper mapper) throws ConfigurationException {
        try {
            return mapper.readValue(new File(path), new TypeReference<List<SchemaField>>() {
            });
        } catch (IOException e) {
            throw new ConfigurationException("Could not read schema fields from " + path + ": " + e.getMessage(), e);
        }
    }
}
