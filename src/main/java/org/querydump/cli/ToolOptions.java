package org.querydump.cli;

import java.io.IOException;
import java.util.Properties;

import lombok.Data;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

@Data
@Log4j2
public class ToolOptions {

    public static final long DEFAULT_APPROX_MAX_FILE_SIZE = 1_900_000_000L;
    private static final int DEFAULT_FETCH_SIZE = 5000;

    private String sourceConnect;
    private String sourceUser;
    private String sourcePassword;
    private String sourceQuery;

    private String sinkConnect;
    private String sinkFilename;
    private String sinkSchemaFilename;
    private String sinkSchema;
    private String sinkSchemaFile;
    private String sinkFileFormat;
    private long approxMaxFileSize = DEFAULT_APPROX_MAX_FILE_SIZE;

    private String csvDialect;
    private String csvDelimiter;
    private Boolean csvDoublequote;
    private String csvEscapechar;
    private String csvLineterminator;
    private String csvQuotechar;
    private String csvQuoting;
    private boolean csvColumnHeader = false;

    private int fetchSize = DEFAULT_FETCH_SIZE;
    private boolean help = false;
    private boolean versionCheck = false;
    private boolean verbose = false;
    private String optionsFile;

    private Properties sourceConnectionParams;
    private Properties sinkConnectionParams;

    private Options options;

    public ToolOptions(String[] args) throws ParseException, IOException {
        checkOptions(args);
    }

    private void checkOptions(String[] args) throws ParseException, IOException {

        this.options = new Options();

        // Source Options
        options.addOption(
                Option.builder()
                        .longOpt("source-connect")
                        .desc("Source database JDBC connect string")
                        .hasArg()
                        .argName("jdbc-uri")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("source-user")
                        .desc("Source database authentication username")
                        .hasArg()
                        .argName("username")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("source-password")
                        .desc("Source database authentication password")
                        .hasArg()
                        .argName("password")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("source-query")
                        .desc("SQL statement to be executed in the source database")
                        .hasArg()
                        .argName("statement")
                        .build()
        );

        // Sink Options
        options.addOption(
                Option.builder()
                        .longOpt("sink-connect")
                        .desc("Sink location: s3://host[:port]/bucket or file:///directory")
                        .hasArg()
                        .argName("uri")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("sink-filename")
                        .desc("Object name of the data files. {} is replaced by the file number when the export is split")
                        .hasArg()
                        .argName("template")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("sink-schema-filename")
                        .desc("If set, object name of a .json file containing the warehouse schema of the exported columns")
                        .hasArg()
                        .argName("name")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("sink-schema")
                        .desc("Schema written verbatim to the schema file instead of the inferred one")
                        .hasArg()
                        .argName("json")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("sink-schema-file")
                        .desc("Path of a JSON array of {name, type, mode} fields used instead of the inferred schema")
                        .hasArg()
                        .argName("file-path")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("sink-file-format")
                        .desc("Sink file format. The allowed values are json, csv. Default json")
                        .hasArg()
                        .argName("file format")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("approx-max-file-size")
                        .desc("Approximate size in bytes after which a new file is started. Default " + DEFAULT_APPROX_MAX_FILE_SIZE)
                        .hasArg()
                        .argName("bytes")
                        .build()
        );

        // CSV Options
        options.addOption(
                Option.builder()
                        .longOpt("csv-dialect")
                        .desc("Preset of CSV options: excel, excel-tab or unix. Overrides every other csv option")
                        .hasArg()
                        .argName("dialect")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-delimiter")
                        .desc("A one-character string used to separate fields. Default ','")
                        .hasArg()
                        .argName("char")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-doublequote")
                        .desc("Whether a quotechar inside a field is doubled. Default true")
                        .hasArg()
                        .argName("true|false")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-escapechar")
                        .desc("A one-character string used to escape special characters. Default none")
                        .hasArg()
                        .argName("char")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-lineterminator")
                        .desc("The string used to terminate lines. Default '\\r\\n'")
                        .hasArg()
                        .argName("string")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-quotechar")
                        .desc("A one-character string used to quote fields. Default '\"'")
                        .hasArg()
                        .argName("char")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-quoting")
                        .desc("When fields are quoted: ALL, MINIMAL, NONNUMERIC or NONE. Default MINIMAL")
                        .hasArg()
                        .argName("policy")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("csv-column-header")
                        .desc("Write the column names as the first row of every CSV file.")
                        .build()
        );

        // Other Options
        options.addOption(
                Option.builder()
                        .longOpt("options-file")
                        .desc("Options file path location")
                        .hasArg()
                        .argName("file-path")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("fetch-size")
                        .desc("Number of entries to read from database at once.")
                        .hasArg()
                        .argName("fetch-size")
                        .build()
        );

        options.addOption(
                Option.builder()
                        .longOpt("version")
                        .desc("Show implementation version and exit.")
                        .build()
        );

        Option helpOpt = new Option("h", "help", false, "Print this help screen");
        options.addOption(helpOpt);

        Option verboseOpt = new Option("v", "verbose", false, "Print more information while working");
        options.addOption(verboseOpt);

        // create the command line parser
        CommandLineParser parser = new DefaultParser();

        // If help argument is not passed is not necessary test the rest of arguments
        if (existsHelpArgument(args)) {
            printHelp();
            this.setHelp(true);
        } else if (existsVersionArgument(args)) {
            this.setVersionCheck(true);
        } else {
            // parse the command line arguments
            CommandLine line = parser.parse(options, args);

            // check for optionsFile
            setOptionsFile(line.getOptionValue("options-file"));
            if (this.optionsFile != null && !this.optionsFile.isEmpty()) {
                loadOptionsFile();
            }

            //get & set Options
            if (line.hasOption("verbose")) {
                enableVerbose();
            }
            if (line.hasOption("csv-column-header")) {
                enableCsvColumnHeader();
            }

            setSourceConnectNotNull(line.getOptionValue("source-connect"));
            setSourceUserNotNull(line.getOptionValue("source-user"));
            setSourcePasswordNotNull(line.getOptionValue("source-password"));
            setSourceQueryNotNull(line.getOptionValue("source-query"));
            setSinkConnectNotNull(line.getOptionValue("sink-connect"));
            setSinkFilenameNotNull(line.getOptionValue("sink-filename"));
            setSinkSchemaFilenameNotNull(line.getOptionValue("sink-schema-filename"));
            setSinkSchemaNotNull(line.getOptionValue("sink-schema"));
            setSinkSchemaFileNotNull(line.getOptionValue("sink-schema-file"));
            setSinkFileFormatNotNull(line.getOptionValue("sink-file-format"));
            setApproxMaxFileSizeNotNull(line.getOptionValue("approx-max-file-size"));
            setCsvDialectNotNull(line.getOptionValue("csv-dialect"));
            setCsvDelimiterNotNull(line.getOptionValue("csv-delimiter"));
            setCsvDoublequoteNotNull(line.getOptionValue("csv-doublequote"));
            setCsvEscapecharNotNull(line.getOptionValue("csv-escapechar"));
            setCsvLineterminatorNotNull(line.getOptionValue("csv-lineterminator"));
            setCsvQuotecharNotNull(line.getOptionValue("csv-quotechar"));
            setCsvQuotingNotNull(line.getOptionValue("csv-quoting"));
            setFetchSizeNotNull(line.getOptionValue("fetch-size"));
            setHelp(line.hasOption("help"));

            //Check for required values
            if (!checkRequiredValues())
                throw new IllegalArgumentException("Missing any of the required parameters:" +
                        " source-connect=" + this.sourceConnect +
                        " source-query=" + this.sourceQuery +
                        " sink-connect=" + this.sinkConnect +
                        " sink-filename=" + this.sinkFilename);
        }

    }


    private void printHelp() {
        String header = "\nArguments: \n";
        String footer = "\nExports the result of a SQL query as JSON or CSV files for warehouse bulk loads";

        // automatically generate the help statement
        HelpFormatter formatter = new HelpFormatter();
        formatter.setWidth(140);
        formatter.printHelp("querydump [OPTIONS]", header, this.options, footer, false);
    }

    private boolean existsHelpArgument(String[] args) {
        //help argument is -h or --help
        for (int i = 0; i <= args.length - 1; i++) {
            if (args[i].equals("-h") || args[i].equals("--help")) {
                return true;
            }
        }
        return false;
    }

    private boolean existsVersionArgument(String[] args) {
        for (int i = 0; i <= args.length - 1; i++) {
            if (args[i].equals("--version")) {
                return true;
            }
        }
        return false;
    }

    public String getVersion() {
        return ToolOptions.class.getPackage().getImplementationVersion();
    }

    public boolean checkRequiredValues() {

        if (this.sourceConnect == null) return false;
        if (this.sourceQuery == null) return false;
        if (this.sinkConnect == null) return false;
        return this.sinkFilename != null;
    }

    private void loadOptionsFile() throws IOException {

        OptionsFile of = new OptionsFile(this.optionsFile);

        // set properties from options file to this ToolOptions
        Properties prop = of.getProperties();

        setVerbose(Boolean.parseBoolean(prop.getProperty("verbose")));

        setSourceConnect(prop.getProperty("source.connect"));
        setSourceUser(prop.getProperty("source.user"));
        setSourcePassword(prop.getProperty("source.password"));
        setSourceQuery(prop.getProperty("source.query"));
        setSinkConnect(prop.getProperty("sink.connect"));
        setSinkFilename(prop.getProperty("sink.filename"));
        setSinkSchemaFilename(prop.getProperty("sink.schema.filename"));
        setSinkSchema(prop.getProperty("sink.schema"));
        setSinkSchemaFile(prop.getProperty("sink.schema.file"));
        setSinkFileFormat(prop.getProperty("sink.file.format"));
        setApproxMaxFileSize(prop.getProperty("approx.max.file.size"));
        setCsvDialect(prop.getProperty("csv.dialect"));
        setCsvDelimiter(prop.getProperty("csv.delimiter"));
        setCsvDoublequoteNotNull(prop.getProperty("csv.doublequote"));
        setCsvEscapechar(prop.getProperty("csv.escapechar"));
        setCsvLineterminatorNotNull(prop.getProperty("csv.lineterminator"));
        setCsvQuotechar(prop.getProperty("csv.quotechar"));
        setCsvQuoting(prop.getProperty("csv.quoting"));
        setCsvColumnHeader(Boolean.parseBoolean(prop.getProperty("csv.column.header")));
        setFetchSize(prop.getProperty("fetch.size"));

        // Connection params
        setSinkConnectionParams(of.getSinkConnectionParams());
        setSourceConnectionParams(of.getSourceConnectionParams());
    }

    /*
     * Getters & Setters
     */
    private void setSourceConnectNotNull(String sourceConnect) {
        if (sourceConnect != null && !sourceConnect.isEmpty())
            this.sourceConnect = sourceConnect;
    }

    public void setSourceUserNotNull(String sourceUser) {
        if (sourceUser != null && !sourceUser.isEmpty())
            this.sourceUser = sourceUser;
    }

    public void setSourcePasswordNotNull(String sourcePassword) {
        if (sourcePassword != null && !sourcePassword.isEmpty())
            this.sourcePassword = sourcePassword;
    }

    public void setSourceQueryNotNull(String sourceQuery) {
        if (sourceQuery != null && !sourceQuery.isEmpty())
            this.sourceQuery = sourceQuery;
    }

    public void setSinkConnectNotNull(String sinkConnect) {
        if (sinkConnect != null && !sinkConnect.isEmpty())
            this.sinkConnect = sinkConnect;
    }

    public void setSinkFilenameNotNull(String sinkFilename) {
        if (sinkFilename != null && !sinkFilename.isEmpty())
            this.sinkFilename = sinkFilename;
    }

    public void setSinkSchemaFilenameNotNull(String sinkSchemaFilename) {
        if (sinkSchemaFilename != null && !sinkSchemaFilename.isEmpty())
            this.sinkSchemaFilename = sinkSchemaFilename;
    }

    public void setSinkSchemaNotNull(String sinkSchema) {
        if (sinkSchema != null && !sinkSchema.isEmpty())
            this.sinkSchema = sinkSchema;
    }

    public void setSinkSchemaFileNotNull(String sinkSchemaFile) {
        if (sinkSchemaFile != null && !sinkSchemaFile.isEmpty())
            this.sinkSchemaFile = sinkSchemaFile;
    }

    private void setSinkFileFormatNotNull(String fileFormat) {
        if (fileFormat != null && !fileFormat.isEmpty())
            this.sinkFileFormat = fileFormat;
    }

    public void setApproxMaxFileSize(String approxMaxFileSize) {
        try {
            if (approxMaxFileSize != null && !approxMaxFileSize.isEmpty()) {
                this.approxMaxFileSize = Long.parseLong(approxMaxFileSize.trim());
                if (this.approxMaxFileSize <= 0) throw new NumberFormatException();
            }
        } catch (NumberFormatException e) {
            log.error("Option --approx-max-file-size must be a positive integer grater than 0.");
            throw e;
        }
    }

    public void setApproxMaxFileSizeNotNull(String approxMaxFileSize) {
        if (approxMaxFileSize != null && !approxMaxFileSize.isEmpty())
            setApproxMaxFileSize(approxMaxFileSize);
    }

    public void setCsvDialectNotNull(String csvDialect) {
        if (csvDialect != null && !csvDialect.isEmpty())
            this.csvDialect = csvDialect;
    }

    public void setCsvDelimiterNotNull(String csvDelimiter) {
        if (csvDelimiter != null && !csvDelimiter.isEmpty())
            this.csvDelimiter = unescape(csvDelimiter);
    }

    public void setCsvDoublequoteNotNull(String csvDoublequote) {
        if (csvDoublequote == null || csvDoublequote.isEmpty()) return;

        String value = csvDoublequote.trim();
        if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
            throw new IllegalArgumentException("Option --csv-doublequote must be true or false, got '" + csvDoublequote + "'");
        }
        this.csvDoublequote = Boolean.parseBoolean(value);
    }

    public void setCsvEscapecharNotNull(String csvEscapechar) {
        if (csvEscapechar != null && !csvEscapechar.isEmpty())
            this.csvEscapechar = csvEscapechar;
    }

    public void setCsvLineterminatorNotNull(String csvLineterminator) {
        if (csvLineterminator != null && !csvLineterminator.isEmpty())
            this.csvLineterminator = unescape(csvLineterminator);
    }

    public void setCsvQuotecharNotNull(String csvQuotechar) {
        if (csvQuotechar != null && !csvQuotechar.isEmpty())
            this.csvQuotechar = csvQuotechar;
    }

    public void setCsvQuotingNotNull(String csvQuoting) {
        if (csvQuoting != null && !csvQuoting.isEmpty())
            this.csvQuoting = csvQuoting;
    }

    public void setFetchSize(String fetchSize) {
        try {
            if (fetchSize != null && !fetchSize.isEmpty()) {
                this.fetchSize = Integer.parseInt(fetchSize);
                if (this.fetchSize <= 0) throw new NumberFormatException();
            }
        } catch (NumberFormatException | NullPointerException e) {
            log.error("Option --fetch-size must be a positive integer grater than 0.");
            throw e;
        }

    }

    public void setFetchSizeNotNull(String fetchSize) {
        if (fetchSize != null && !fetchSize.isEmpty())
            setFetchSize(fetchSize);
    }

    public void enableVerbose() {
        this.verbose = true;
    }

    public void enableCsvColumnHeader() {
        this.csvColumnHeader = true;
    }

    /**
     * Shells and properties files cannot easily carry control characters, so \t, \r and \n are accepted literally.
     */
    static String unescape(String value) {
        return value.replace("\\t", "\t").replace("\\r", "\r").replace("\\n", "\n");
    }
}
