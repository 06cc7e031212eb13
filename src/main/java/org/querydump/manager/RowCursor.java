package org.querydump.manager;

import org.querydump.manager.util.ColumnDescriptor;
import org.querydump.schema.Cell;

import java.sql.SQLException;
import java.util.List;

/**
 * Forward-only view over the result of a query. Rows can be read once, in order.
 */
public interface RowCursor extends AutoCloseable {

    List<ColumnDescriptor> getColumns();

    /**
     * Moves to the next row.
     *
     * @return false when the result is exhausted
     */
    boolean next() throws SQLException;

    /**
     * @return the cells of the current row, one per column
     */
    Cell[] getRow() throws SQLException;

    @Override
    void close() throws SQLException;
}
