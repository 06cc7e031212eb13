package org.querydump.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.querydump.exception.ConfigurationException;
import org.querydump.exception.ConnectionException;
import org.querydump.exception.EncodingException;
import org.querydump.exception.UploadException;
import org.querydump.file.FileFormats;
import org.querydump.file.FileSet;
import org.querydump.manager.InMemoryConnManager;
import org.querydump.manager.util.ColumnDescriptor;
import org.querydump.storage.RecordingUploadManager;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExportOrchestratorTest {

    private static final String SQL = "SELECT id, name, price, created FROM orders";

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private RecordingUploadManager uploads;
    private ExportConfig config;

    @BeforeEach
    void before() {
        uploads = new RecordingUploadManager();
        config = new ExportConfig();
        config.setSql(SQL);
        config.setContainer("exports");
        config.setFilenameTemplate("out_{}.json");
        config.setTempDirectory(tempDir);
    }

    private static InMemoryConnManager ordersSource() {
        return new InMemoryConnManager(Arrays.asList(
                new ColumnDescriptor("id", Types.INTEGER, ResultSetMetaData.columnNoNulls),
                new ColumnDescriptor("name", Types.VARCHAR, ResultSetMetaData.columnNullable),
                new ColumnDescriptor("price", Types.DECIMAL, ResultSetMetaData.columnNullable),
                new ColumnDescriptor("created", Types.TIMESTAMP, ResultSetMetaData.columnNoNulls)));
    }

    private static InMemoryConnManager namesSource(int rows) {
        InMemoryConnManager source = new InMemoryConnManager(Arrays.asList(
                new ColumnDescriptor("id", Types.INTEGER, ResultSetMetaData.columnNoNulls),
                new ColumnDescriptor("name", Types.VARCHAR, ResultSetMetaData.columnNullable)));
        for (int i = 1; i <= rows; i++) {
            source.addRow(i, "x");
        }
        return source;
    }

    private static Timestamp timestamp(int year, int month, int day) {
        return Timestamp.valueOf(LocalDateTime.of(year, month, day, 0, 0));
    }

    private String uploaded(String objectName) {
        return new String(uploads.getContent(objectName), StandardCharsets.UTF_8);
    }

    private long localFiles() throws IOException {
        try (Stream<Path> files = Files.list(tempDir)) {
            return files.count();
        }
    }

    private void useCsv(boolean header) {
        config.setFilenameTemplate("out_{}.csv");
        config.getExportFormat().setFileFormat(FileFormats.CSV);
        config.getExportFormat().setCsvColumnHeader(header);
    }

    @Test
    void testExecute_jsonSingleFile() throws Exception {
        // Given
        InMemoryConnManager source = ordersSource()
                .addRow(1, "a", new BigDecimal("9.99"), timestamp(2020, 1, 1))
                .addRow(2, null, null, timestamp(2020, 1, 2))
                .addRow(3, "c", new BigDecimal("0.5"), timestamp(2020, 1, 3));
        ExportOrchestrator orchestrator = new ExportOrchestrator(source, uploads, config, mapper);

        // When
        orchestrator.execute();

        // Then
        assertEquals(ExportState.FINALIZED, orchestrator.getState());
        assertEquals(3, orchestrator.getRowCount());
        assertEquals(Collections.singletonList(SQL), source.getExecutedQueries());
        assertTrue(source.isCursorClosed());
        assertEquals(Collections.singletonList("out_0.json"), uploads.getObjectNames());
        assertEquals(Collections.singletonList("exports"), uploads.getContainers());
        assertEquals("application/json", uploads.getMimeType("out_0.json"));
        assertEquals("{\"created\":1577836800,\"id\":1,\"name\":\"a\",\"price\":9.99}\n"
                        + "{\"created\":1577923200,\"id\":2,\"name\":null,\"price\":null}\n"
                        + "{\"created\":1578009600,\"id\":3,\"name\":\"c\",\"price\":0.5}\n",
                uploaded("out_0.json"));
        assertEquals(0, localFiles(), "local files are removed after the upload");
    }

    @Test
    void testExecute_emptyResultStillUploadsOneFile() throws Exception {
        ExportOrchestrator orchestrator = new ExportOrchestrator(ordersSource(), uploads, config, mapper);

        orchestrator.execute();

        assertEquals(0, orchestrator.getRowCount());
        assertEquals(Collections.singletonList("out_0.json"), uploads.getObjectNames());
        assertEquals(0, uploads.getContent("out_0.json").length);
    }

    @Test
    void testExecute_csvRolloverRepeatsHeader() throws Exception {
        // Given: a 9 byte header and 5 byte rows, so the first file is full after 5 rows
        useCsv(true);
        config.setApproxMaxFileSizeBytes(34);
        ExportOrchestrator orchestrator = new ExportOrchestrator(namesSource(8), uploads, config, mapper);

        // When
        orchestrator.execute();

        // Then
        assertEquals(Arrays.asList("out_0.csv", "out_1.csv"), uploads.getObjectNames());
        assertEquals("id,name\r\n1,x\r\n2,x\r\n3,x\r\n4,x\r\n5,x\r\n", uploaded("out_0.csv"));
        assertEquals("id,name\r\n6,x\r\n7,x\r\n8,x\r\n", uploaded("out_1.csv"));
        assertEquals("application/csv", uploads.getMimeType("out_0.csv"));
        assertEquals("application/csv", uploads.getMimeType("out_1.csv"));
    }

    @Test
    void testExecute_csvEmptyResultWithHeader() throws Exception {
        useCsv(true);
        ExportOrchestrator orchestrator = new ExportOrchestrator(namesSource(0), uploads, config, mapper);

        orchestrator.execute();

        assertEquals("id,name\r\n", uploaded("out_0.csv"));
    }

    @Test
    void testExecute_inferredSchemaUploadedLast() throws Exception {
        // Given
        config.setSchemaFilename("schema.json");
        InMemoryConnManager source = ordersSource().addRow(1, "a", new BigDecimal("1.25"), timestamp(2020, 1, 1));
        ExportOrchestrator orchestrator = new ExportOrchestrator(source, uploads, config, mapper);

        // When
        orchestrator.execute();

        // Then: TIMESTAMP columns are always NULLABLE
        assertEquals(Arrays.asList("out_0.json", "schema.json"), uploads.getObjectNames());
        assertEquals("application/json", uploads.getMimeType("schema.json"));
        assertEquals("[{\"mode\":\"REQUIRED\",\"name\":\"id\",\"type\":\"INTEGER\"},"
                        + "{\"mode\":\"NULLABLE\",\"name\":\"name\",\"type\":\"STRING\"},"
                        + "{\"mode\":\"NULLABLE\",\"name\":\"price\",\"type\":\"FLOAT\"},"
                        + "{\"mode\":\"NULLABLE\",\"name\":\"created\",\"type\":\"TIMESTAMP\"}]",
                uploaded("schema.json"));
    }

    @Test
    void testExecute_schemaBlobWrittenVerbatim() throws Exception {
        String blob = "[ {\"name\": \"id\", \"type\": \"INTEGER\"} ]";
        config.setSchemaFilename("schema.json");
        config.setSchemaBlob(blob);
        ExportOrchestrator orchestrator = new ExportOrchestrator(ordersSource(), uploads, config, mapper);

        orchestrator.execute();

        assertArrayEquals(blob.getBytes(StandardCharsets.UTF_8), uploads.getContent("schema.json"));
    }

    @Test
    void testExecute_schemaCollidingWithLaterDataFile() throws Exception {
        // Given: the second data file gets the schema's name
        useCsv(false);
        config.setApproxMaxFileSizeBytes(5);
        config.setSchemaFilename("out_1.csv");
        ExportOrchestrator orchestrator = new ExportOrchestrator(namesSource(3), uploads, config, mapper);

        // When / Then
        assertThrows(ConfigurationException.class, orchestrator::execute);
        assertEquals(ExportState.FAILED, orchestrator.getState());
        assertTrue(uploads.getObjectNames().isEmpty());
        assertEquals(0, localFiles());
    }

    @Test
    void testExecute_schemaCollidingWithFirstDataFileFailsBeforeQuery() {
        config.setSchemaFilename("out_0.json");
        InMemoryConnManager source = ordersSource();
        ExportOrchestrator orchestrator = new ExportOrchestrator(source, uploads, config, mapper);

        assertThrows(ConfigurationException.class, orchestrator::execute);
        assertTrue(source.getExecutedQueries().isEmpty());
    }

    @Test
    void testExecute_templateWithoutPlaceholderFailsBeforeQuery() {
        // Given
        config.setFilenameTemplate("out.json");
        InMemoryConnManager source = ordersSource();
        ExportOrchestrator orchestrator = new ExportOrchestrator(source, uploads, config, mapper);

        // When / Then
        assertThrows(ConfigurationException.class, orchestrator::execute);
        assertEquals(ExportState.FAILED, orchestrator.getState());
        assertTrue(source.getExecutedQueries().isEmpty());
    }

    @Test
    void testExecute_queryFailure() throws Exception {
        InMemoryConnManager source = ordersSource().failQueryWith(new SQLException("Table 'orders' doesn't exist"));
        ExportOrchestrator orchestrator = new ExportOrchestrator(source, uploads, config, mapper);

        ConnectionException e = assertThrows(ConnectionException.class, orchestrator::execute);

        assertTrue(e.getMessage().contains("Table 'orders' doesn't exist"));
        assertEquals(ExportState.FAILED, orchestrator.getState());
        assertTrue(uploads.getObjectNames().isEmpty());
        assertEquals(0, localFiles());
    }

    @Test
    void testExecute_fetchFailureDiscardsPartialFiles() throws Exception {
        // Given: the connection drops after two rows have been written
        useCsv(false);
        config.setApproxMaxFileSizeBytes(5);
        InMemoryConnManager source = namesSource(5).failAtRow(2);
        ExportOrchestrator orchestrator = new ExportOrchestrator(source, uploads, config, mapper);

        // When / Then
        assertThrows(ConnectionException.class, orchestrator::execute);
        assertEquals(ExportState.FAILED, orchestrator.getState());
        assertTrue(source.isCursorClosed());
        assertTrue(uploads.getObjectNames().isEmpty());
        assertEquals(0, localFiles());
    }

    @Test
    void testExecute_encodingFailureNamesTheRow() throws Exception {
        // Given: quoting NONE and no escape character cannot write a comma
        useCsv(false);
        config.getExportFormat().setCsvQuoting("NONE");
        InMemoryConnManager source = new InMemoryConnManager(Arrays.asList(
                new ColumnDescriptor("id", Types.INTEGER, ResultSetMetaData.columnNoNulls),
                new ColumnDescriptor("name", Types.VARCHAR, ResultSetMetaData.columnNullable)))
                .addRow(1, "plain")
                .addRow(2, "a,b");
        ExportOrchestrator orchestrator = new ExportOrchestrator(source, uploads, config, mapper);

        // When
        EncodingException e = assertThrows(EncodingException.class, orchestrator::execute);

        // Then
        assertTrue(e.getMessage().startsWith("Row 2: "), e.getMessage());
        assertEquals(1, orchestrator.getRowCount());
        assertTrue(uploads.getObjectNames().isEmpty());
        assertEquals(0, localFiles());
    }

    @Test
    void testExecute_uploadFailureStopsRemainingUploads() throws Exception {
        // Given
        useCsv(false);
        config.setApproxMaxFileSizeBytes(5);
        uploads.failOn("out_1.csv");
        ExportOrchestrator orchestrator = new ExportOrchestrator(namesSource(3), uploads, config, mapper);

        // When
        UploadException e = assertThrows(UploadException.class, orchestrator::execute);

        // Then: the first file stays uploaded and the local files are gone
        assertEquals("out_1.csv", e.getObjectName());
        assertEquals(Collections.singletonList("out_0.csv"), uploads.getObjectNames());
        assertEquals(0, localFiles());
    }

    @Test
    void testRun_returnsClosedFilesReadyForUpload() throws Exception {
        useCsv(false);
        config.setApproxMaxFileSizeBytes(5);
        ExportOrchestrator orchestrator = new ExportOrchestrator(namesSource(2), uploads, config, mapper);

        try (FileSet files = orchestrator.run()) {
            // every row fills a file, so the last one is empty
            assertEquals(Arrays.asList("out_0.csv", "out_1.csv", "out_2.csv"), files.getObjectNames());
            files.forEach(file -> assertTrue(file.isClosed()));
            assertEquals("1,x\r\n", new String(Files.readAllBytes(files.get("out_0.csv").getPath()), StandardCharsets.UTF_8));
            assertEquals(0, files.get("out_2.csv").getSize());
        }
        assertEquals(0, localFiles());
    }

    @Test
    void testRun_onlyOnce() throws Exception {
        ExportOrchestrator orchestrator = new ExportOrchestrator(ordersSource(), uploads, config, mapper);
        orchestrator.execute();

        assertThrows(IllegalStateException.class, orchestrator::run);
    }

    @Test
    void testUpload_beforeFinalized() {
        ExportOrchestrator orchestrator = new ExportOrchestrator(ordersSource(), uploads, config, mapper);

        assertThrows(IllegalStateException.class, () -> orchestrator.upload(new FileSet()));
        assertEquals(ExportState.NEW, orchestrator.getState());
    }
}
