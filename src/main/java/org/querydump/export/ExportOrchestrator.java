package org.querydump.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.querydump.exception.ConfigurationException;
import org.querydump.exception.ConnectionException;
import org.querydump.exception.EncodingException;
import org.querydump.exception.QueryDumpException;
import org.querydump.exception.UploadException;
import org.querydump.file.CsvDialect;
import org.querydump.file.FileFormats;
import org.querydump.file.FileSet;
import org.querydump.file.FilenameTemplate;
import org.querydump.file.OutputFile;
import org.querydump.file.RecordEncoder;
import org.querydump.file.RecordEncoderFactory;
import org.querydump.file.SplitFileWriter;
import org.querydump.manager.ConnManager;
import org.querydump.manager.RowCursor;
import org.querydump.manager.util.ColumnDescriptor;
import org.querydump.schema.Cell;
import org.querydump.schema.ExportSchema;
import org.querydump.schema.SchemaInferrer;
import org.querydump.schema.TypeConverter;
import org.querydump.storage.UploadManager;

import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one export: query, write the data files, optionally the schema file, then upload them.
 * <p>
 * Single use. Any failure before the files are finalized deletes every local file and is rethrown.
 */
public class ExportOrchestrator {

    private static final Logger LOG = LogManager.getLogger(ExportOrchestrator.class.getName());
    private static final String SCHEMA_MIME_TYPE = "application/json";

    private final ConnManager connManager;
    private final UploadManager uploadManager;
    private final ExportConfig config;
    private final ObjectMapper mapper;
    private final SchemaInferrer schemaInferrer = new SchemaInferrer();

    private ExportState state = ExportState.NEW;
    private long rowCount = 0;

    public ExportOrchestrator(ConnManager connManager, UploadManager uploadManager, ExportConfig config, ObjectMapper mapper) {
        this.connManager = connManager;
        this.uploadManager = uploadManager;
        this.config = config;
        this.mapper = mapper;
    }

    public ExportState getState() {
        return state;
    }

    public long getRowCount() {
        return rowCount;
    }

    /**
     * Writes and uploads every file, then removes the local copies.
     */
    public void execute() throws QueryDumpException, IOException {
        try (FileSet files = run()) {
            upload(files);
        }
    }

    /**
     * Writes every file locally and returns them flushed and closed, ready for upload.
     * The caller owns the returned files and must close the set to delete them.
     */
    public FileSet run() throws QueryDumpException, IOException {
        if (state != ExportState.NEW) {
            throw new IllegalStateException("An export can only run once, current state is " + state);
        }
        boolean success = false;
        try {
            CsvDialect dialect = config.validate();
            FilenameTemplate template = FilenameTemplate.of(config.getFilenameTemplate());

            transition(ExportState.QUERYING);
            RowCursor cursor = executeQuery();
            FileSet files;
            try {
                List<ColumnDescriptor> columns = cursor.getColumns();
                files = writeDataFiles(cursor, columns, dialect, template);
                if (config.getSchemaFilename() != null) {
                    transition(ExportState.WRITING_SCHEMA);
                    addSchemaFile(files, columns);
                }
            } finally {
                closeCursor(cursor);
            }

            transition(ExportState.FINALIZED);
            LOG.info("Exported {} rows into {} files: {}", rowCount, files.size(), files.getObjectNames());
            success = true;
            return files;
        } finally {
            if (!success) {
                state = ExportState.FAILED;
            }
        }
    }

    private RowCursor executeQuery() throws ConnectionException {
        try {
            return connManager.execute(config.getSql());
        } catch (SQLException e) {
            throw new ConnectionException("Could not execute the source query: " + e.getMessage(), e);
        }
    }

    private FileSet writeDataFiles(RowCursor cursor, List<ColumnDescriptor> columns, CsvDialect dialect, FilenameTemplate template)
            throws QueryDumpException, IOException {
        List<String> columnNames = new ArrayList<>(columns.size());
        int[] typeCodes = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            columnNames.add(columns.get(i).getColumnName());
            typeCodes[i] = columns.get(i).getJdbcType();
        }

        RecordEncoder encoder = new RecordEncoderFactory(mapper).accept(config.getExportFormat(), dialect, columnNames);

        transition(ExportState.WRITING_DATA);
        SplitFileWriter writer = new SplitFileWriter(template, config.getApproxMaxFileSizeBytes(),
                encoder.encodeHeader(), config.getTempDirectory());
        try {
            while (nextRow(cursor)) {
                Cell[] row = getRow(cursor);
                Object[] values = new Object[row.length];
                for (int i = 0; i < row.length; i++) {
                    values[i] = TypeConverter.convert(row[i], typeCodes[i]);
                }
                try {
                    writer.write(encoder.encode(values));
                } catch (EncodingException e) {
                    throw new EncodingException("Row " + (rowCount + 1) + ": " + e.getMessage(), e);
                }
                rowCount++;
            }
            return writer.finish();
        } catch (QueryDumpException | IOException | RuntimeException e) {
            writer.abort();
            throw e;
        }
    }

    private void addSchemaFile(FileSet files, List<ColumnDescriptor> columns) throws QueryDumpException, IOException {
        String schemaFilename = config.getSchemaFilename();
        boolean added = false;
        try {
            if (files.contains(schemaFilename)) {
                throw new ConfigurationException("The schema filename '" + schemaFilename + "' collides with a data file");
            }
            ExportSchema schema = schemaInferrer.infer(columns, config.getSchemaBlob(), config.getSchemaFields(), schemaFilename);

            SplitFileWriter writer = SplitFileWriter.singleFile(schemaFilename, config.getTempDirectory());
            try {
                writer.write(schema.toBytes(mapper));
                files.addAll(writer.finish());
            } catch (JsonProcessingException e) {
                writer.abort();
                throw new EncodingException("Could not serialize the schema: " + e.getOriginalMessage(), e);
            } catch (IOException | RuntimeException e) {
                writer.abort();
                throw e;
            }
            added = true;
        } finally {
            if (!added) {
                files.close();
            }
        }
    }

    /**
     * Uploads the files in creation order. Stops at the first failure; files already uploaded stay.
     */
    public void upload(FileSet files) throws UploadException {
        if (state != ExportState.FINALIZED) {
            throw new IllegalStateException("Files can only be uploaded once the export is finalized, current state is " + state);
        }
        FileFormats fileFormat = config.getExportFormat().getFileFormat();
        for (OutputFile file : files) {
            String mimeType = file.getObjectName().equals(config.getSchemaFilename())
                    ? SCHEMA_MIME_TYPE
                    : fileFormat.getMimeType();
            LOG.info("Uploading {} ({} bytes) as {}", file.getObjectName(), file.getSize(), mimeType);
            uploadManager.upload(config.getContainer(), file.getObjectName(), file.getPath(), mimeType);
        }
    }

    private boolean nextRow(RowCursor cursor) throws ConnectionException {
        try {
            return cursor.next();
        } catch (SQLException e) {
            throw new ConnectionException("Could not fetch row " + (rowCount + 1) + ": " + e.getMessage(), e);
        }
    }

    private Cell[] getRow(RowCursor cursor) throws ConnectionException {
        try {
            return cursor.getRow();
        } catch (SQLException e) {
            throw new ConnectionException("Could not read row " + (rowCount + 1) + ": " + e.getMessage(), e);
        }
    }

    private void closeCursor(RowCursor cursor) {
        try {
            cursor.close();
        } catch (SQLException e) {
            LOG.error("Exception closing the query cursor: " + e, e);
        }
    }

    private void transition(ExportState next) {
        LOG.debug("Export state {} -> {}", state, next);
        state = next;
    }
}
