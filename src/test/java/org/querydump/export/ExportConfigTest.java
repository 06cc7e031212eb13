package org.querydump.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.querydump.cli.ToolOptions;
import org.querydump.exception.ConfigurationException;
import org.querydump.file.CsvDialect;
import org.querydump.file.CsvQuoting;
import org.querydump.file.FileFormats;
import org.querydump.schema.SchemaField;
import org.querydump.schema.WarehouseType;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExportConfigTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private static ExportConfig validConfig() {
        ExportConfig config = new ExportConfig();
        config.setSql("SELECT 1");
        config.setContainer("exports");
        config.setFilenameTemplate("out_{}.json");
        return config;
    }

    private static ToolOptions options(String... extra) throws Exception {
        String[] required = {
                "--source-connect", "jdbc:sqlite::memory:",
                "--source-query", "SELECT 1",
                "--sink-connect", "s3://localhost:4566/exports",
                "--sink-filename", "out_{}.csv"
        };
        String[] args = new String[required.length + extra.length];
        System.arraycopy(required, 0, args, 0, required.length);
        System.arraycopy(extra, 0, args, required.length, extra.length);
        return new ToolOptions(args);
    }

    @Test
    void testValidate_jsonHasNoDialect() throws Exception {
        assertNull(validConfig().validate());
    }

    @Test
    void testValidate_blankQuery() {
        ExportConfig config = validConfig();
        config.setSql("  ");

        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void testValidate_nonPositiveSize() {
        ExportConfig config = validConfig();
        config.setApproxMaxFileSizeBytes(0);

        assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void testValidate_csvResolvesDialect() throws Exception {
        ExportConfig config = validConfig();
        config.getExportFormat().setFileFormat(FileFormats.CSV);
        config.getExportFormat().setCsvDialect("unix");

        assertEquals(CsvDialect.UNIX, config.validate());
    }

    @Test
    void testFreshFormatOptionsPerConfig() {
        ExportConfig first = validConfig();
        first.getExportFormat().setCsvDelimiter(";");

        assertEquals(",", validConfig().getExportFormat().getCsvDelimiter());
    }

    @Test
    void testFromOptions() throws Exception {
        // Given
        ToolOptions options = options(
                "--sink-file-format", "CSV",
                "--sink-schema-filename", "schema.json",
                "--approx-max-file-size", "1000",
                "--csv-quoting", "QUOTE_ALL",
                "--csv-doublequote", "false",
                "--csv-escapechar", "\\",
                "--csv-column-header");

        // When
        ExportConfig config = ExportConfig.fromOptions(options, mapper);

        // Then
        assertEquals("SELECT 1", config.getSql());
        assertEquals("exports", config.getContainer());
        assertEquals("out_{}.csv", config.getFilenameTemplate());
        assertEquals("schema.json", config.getSchemaFilename());
        assertEquals(1000L, config.getApproxMaxFileSizeBytes());
        assertEquals(FileFormats.CSV, config.getExportFormat().getFileFormat());
        assertTrue(config.getExportFormat().isCsvColumnHeader());

        CsvDialect dialect = config.validate();
        assertEquals(CsvQuoting.ALL, dialect.getQuoting());
        assertFalse(dialect.isDoublequote());
        assertEquals('\\', dialect.getEscapechar());
    }

    @Test
    void testFromOptions_unsupportedFormat() throws Exception {
        ToolOptions options = options("--sink-file-format", "parquet");

        assertThrows(ConfigurationException.class, () -> ExportConfig.fromOptions(options, mapper));
    }

    @Test
    void testFromOptions_schemaFieldsFile(@TempDir Path tempDir) throws Exception {
        // Given
        Path fields = Files.write(tempDir.resolve("fields.json"),
                "[{\"name\":\"id\",\"type\":\"INTEGER\",\"mode\":\"REQUIRED\"},{\"name\":\"note\",\"type\":\"STRING\"}]"
                        .getBytes(StandardCharsets.UTF_8));
        ToolOptions options = options("--sink-schema-file", fields.toString());

        // When
        ExportConfig config = ExportConfig.fromOptions(options, mapper);

        // Then
        assertEquals(2, config.getSchemaFields().size());
        SchemaField note = config.getSchemaFields().get(1);
        assertEquals("note", note.getName());
        assertEquals(WarehouseType.STRING, note.getType());
        assertNull(note.getMode());
    }

    @Test
    void testFromOptions_unreadableSchemaFieldsFile(@TempDir Path tempDir) throws Exception {
        Path fields = Files.write(tempDir.resolve("fields.json"),
                "[{\"name\":\"id\",\"type\":\"GEOGRAPHY\"}]".getBytes(StandardCharsets.UTF_8));
        ToolOptions options = options("--sink-schema-file", fields.toString());

        assertThrows(ConfigurationException.class, () -> ExportConfig.fromOptions(options, mapper));
    }
}
