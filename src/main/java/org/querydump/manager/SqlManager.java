package org.querydump.manager;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.querydump.cli.ToolOptions;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Properties;


/**
 * ConnManager implementation for generic SQL-compliant database.
 * This is an abstract class; it requires a database-specific
 * ConnManager implementation to name the driver and tune the statement.
 */
public abstract class SqlManager extends ConnManager {

    private static final Logger LOG = LogManager.getLogger(SqlManager.class.getName());
    private static final String DRIVER_PARAM_KEY = "driver";

    protected Connection connection;

    /**
     * Constructs the SqlManager.
     *
     * @param opts the QueryDump ToolOptions describing the user's requested action.
     */
    public SqlManager(final ToolOptions opts) {
        this.options = opts;
    }

    /**
     * Retrieve the actual connection from the outer ConnManager.
     */
    public Connection getConnection() throws SQLException {
        if (null == this.connection) {
            this.connection = makeSourceConnection();
        }
        return this.connection;
    }

    /**
     * Fetch size applied to the query statement, null to keep the driver default.
     */
    protected Integer getFetchSize() {
        return options.getFetchSize();
    }

    /**
     * Executes an arbitrary SQL query with a forward-only, read-only statement.
     *
     * @param stmt The SQL statement to execute
     * @return A cursor encapsulating the results
     */
    @Override
    public RowCursor execute(String stmt) throws SQLException {
        LOG.info("{}: Executing SQL statement: {}", Thread.currentThread().getName(), stmt);

        Connection conn = this.getConnection();
        LOG.debug("{}: Connection state - autoCommit: {}, transactionIsolation: {}, isClosed: {}",
                Thread.currentThread().getName(),
                conn.getAutoCommit(),
                conn.getTransactionIsolation(),
                conn.isClosed());

        PreparedStatement statement = conn.prepareStatement(stmt, ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
        try {
            Integer fetchSize = getFetchSize();
            if (fetchSize != null) {
                LOG.debug("{}: Using fetchSize for next query: {}", Thread.currentThread().getName(), fetchSize);
                statement.setFetchSize(fetchSize);
            }
            ResultSet resultSet = statement.executeQuery();
            return new JdbcRowCursor(statement, resultSet);
        } catch (SQLException e) {
            statement.close();
            throw e;
        }
    }

    @Override
    public void close() throws SQLException {
        if (this.connection != null) {
            try {
                // Source connections only read, never commit
                if (!this.connection.getAutoCommit()) {
                    this.connection.rollback();
                }
            } finally {
                this.connection.close();
                this.connection = null;
            }
        }
    }

    /**
     * The 'source.connect.parameter.*' properties passed to the driver, null if there are none.
     */
    protected Properties getSourceConnectionParams() {
        return options.getSourceConnectionParams();
    }

    /**
     * Create a connection to the database; usually used only from within
     * getConnection(), which enforces a singleton guarantee around the
     * Connection object.
     */
    protected Connection makeSourceConnection() throws SQLException {

        Connection conn;
        String driverClass = getDriverClass();

        if (driverClass != null) {
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException cnfe) {
                throw new SQLException("Could not load db driver class: " + driverClass, cnfe);
            }
        }

        String username = options.getSourceUser();
        String password = options.getSourcePassword();
        String connectString = options.getSourceConnect();

        Properties connectionParams = getSourceConnectionParams();
        if (connectionParams != null && connectionParams.size() > 0) {
            LOG.trace("User specified connection params. Using properties specific API for making connection.");

            Properties props = new Properties();
            if (username != null) {
                props.put("user", username);
            }

            if (password != null) {
                props.put("password", password);
            }

            props.putAll(connectionParams);
            // Filter driver parameter - used for Class.forName() only, not JDBC connection
            props.remove(DRIVER_PARAM_KEY);
            conn = DriverManager.getConnection(connectString, props);
        } else {
            LOG.trace("No connection parameters specified. Using regular API for making connection.");
            if (username == null) {
                conn = DriverManager.getConnection(connectString);
            } else {
                conn = DriverManager.getConnection(connectString, username, password);
            }
        }

        conn.setAutoCommit(false);

        return conn;
    }
}
