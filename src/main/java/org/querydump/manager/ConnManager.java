package org.querydump.manager;

import org.querydump.cli.ToolOptions;

import java.sql.SQLException;

/**
 * Abstract interface that manages connections to a source database.
 * Implementations execute one query and hand back a forward-only cursor over its rows.
 */
public abstract class ConnManager implements AutoCloseable {

    protected ToolOptions options;

    /**
     * Return the name of the driver class to load, or null to rely on JDBC driver auto-loading.
     */
    public abstract String getDriverClass();

    /**
     * Executes a SQL query and returns a cursor over its result.
     * The caller owns the cursor and must close it.
     */
    public abstract RowCursor execute(String sqlQuery) throws SQLException;

    /**
     * Releases the connection. Safe to call more than once.
     */
    @Override
    public abstract void close() throws SQLException;
}
