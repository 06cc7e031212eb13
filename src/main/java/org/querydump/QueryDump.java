package org.querydump;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.querydump.cli.ToolOptions;
import org.querydump.exception.QueryDumpException;
import org.querydump.export.ExportConfig;
import org.querydump.export.ExportOrchestrator;
import org.querydump.manager.ConnManager;
import org.querydump.manager.ManagerFactory;
import org.querydump.storage.SinkLocation;
import org.querydump.storage.UploadManager;
import org.querydump.storage.UploadManagerFactory;

import java.io.IOException;
import java.sql.SQLException;

/**
 * QueryDump entry point: exports the result of a SQL query to JSON or CSV files in object storage.
 */
public class QueryDump {

    private static final Logger LOG = LogManager.getLogger(QueryDump.class.getName());
    private static final int SUCCESS = 0;
    private static final int ERROR = 1;

    public static void main(String[] args) {
        int exitCode;
        try {
            ToolOptions options = new ToolOptions(args);

            if (options.isHelp()) {
                exitCode = SUCCESS;
            } else if (options.isVersionCheck()) {
                System.out.println("QueryDump " + options.getVersion());
                exitCode = SUCCESS;
            } else {
                exitCode = processExport(options);
            }
        } catch (ParseException | IOException | IllegalArgumentException e) {
            LOG.error("Invalid options: {}", e.getMessage());
            exitCode = ERROR;
        }
        System.exit(exitCode);
    }

    /**
     * Runs one complete export.
     *
     * @return 0 on success, 1 if the export failed
     */
    public static int processExport(ToolOptions options) {
        if (options.isVerbose()) {
            Configurator.setRootLevel(Level.DEBUG);
        }

        ObjectMapper mapper = new ObjectMapper();
        long start = System.currentTimeMillis();

        try {
            ExportConfig config = ExportConfig.fromOptions(options, mapper);
            SinkLocation location = SinkLocation.parse(options.getSinkConnect());
            UploadManager uploadManager = new UploadManagerFactory().accept(location, options.getSinkConnectionParams());

            try (ConnManager connManager = new ManagerFactory().accept(options)) {
                ExportOrchestrator orchestrator = new ExportOrchestrator(connManager, uploadManager, config, mapper);
                orchestrator.execute();
                LOG.info("Total process time: {}ms, {} rows exported to {}",
                        System.currentTimeMillis() - start, orchestrator.getRowCount(), location);
            }
            return SUCCESS;
        } catch (QueryDumpException | IOException | SQLException | IllegalArgumentException e) {
            LOG.error("Export failed: {}", e.getMessage(), e);
            return ERROR;
        }
    }
}
