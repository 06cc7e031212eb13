package org.querydump.manager;

import org.querydump.manager.util.ColumnDescriptor;
import org.querydump.schema.Cell;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Source database stand-in serving a fixed result from memory.
 */
public class InMemoryConnManager extends ConnManager {

    private final List<ColumnDescriptor> columns;
    private final List<Object[]> rows = new ArrayList<>();
    private final List<String> executedQueries = new ArrayList<>();

    private SQLException queryFailure;
    private int failAtRow = -1;
    private boolean cursorClosed = false;
    private boolean closed = false;

    public InMemoryConnManager(List<ColumnDescriptor> columns) {
        this.columns = columns;
    }

    /**
     * Adds a row of raw driver values, classified with {@link Cell#of(Object)}.
     */
    public InMemoryConnManager addRow(Object... values) {
        rows.add(values);
        return this;
    }

    public InMemoryConnManager failQueryWith(SQLException e) {
        this.queryFailure = e;
        return this;
    }

    /**
     * Makes fetching the given zero-based row fail.
     */
    public InMemoryConnManager failAtRow(int rowIndex) {
        this.failAtRow = rowIndex;
        return this;
    }

    public List<String> getExecutedQueries() {
        return executedQueries;
    }

    public boolean isCursorClosed() {
        return cursorClosed;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String getDriverClass() {
        return null;
    }

    @Override
    public RowCursor execute(String sqlQuery) throws SQLException {
        executedQueries.add(sqlQuery);
        if (queryFailure != null) {
            throw queryFailure;
        }
        return new RowCursor() {
            private int position = -1;

            @Override
            public List<ColumnDescriptor> getColumns() {
                return columns;
            }

            @Override
            public boolean next() throws SQLException {
                position++;
                if (position == failAtRow) {
                    throw new SQLException("Connection reset while fetching row " + position);
                }
                return position < rows.size();
            }

            @Override
            public Cell[] getRow() {
                Object[] values = rows.get(position);
                Cell[] row = new Cell[values.length];
                for (int i = 0; i < values.length; i++) {
                    row[i] = Cell.of(values[i]);
                }
                return row;
            }

            @Override
            public void close() {
                cursorClosed = true;
            }
        };
    }

    @Override
    public void close() {
        closed = true;
    }
}
