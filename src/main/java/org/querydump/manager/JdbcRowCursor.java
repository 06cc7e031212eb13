package org.querydump.manager;

import org.apache.commons.io.IOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.querydump.manager.util.ColumnDescriptor;
import org.querydump.schema.Cell;

import java.io.IOException;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link RowCursor} over a JDBC {@link ResultSet}. Closing the cursor closes the statement too.
 */
public class JdbcRowCursor implements RowCursor {

    private static final Logger LOG = LogManager.getLogger(JdbcRowCursor.class.getName());

    private final Statement statement;
    private final ResultSet resultSet;
    private final List<ColumnDescriptor> columns;

    public JdbcRowCursor(Statement statement, ResultSet resultSet) throws SQLException {
        this.statement = statement;
        this.resultSet = resultSet;
        this.columns = Collections.unmodifiableList(readColumns(resultSet.getMetaData()));
    }

    static List<ColumnDescriptor> readColumns(ResultSetMetaData rsmd) throws SQLException {
        int columnCount = rsmd.getColumnCount();
        List<ColumnDescriptor> columnDescriptors = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            // The label honours "AS" aliases of the query
            String columnName = rsmd.getColumnLabel(i);
            if (columnName == null || columnName.isEmpty()) columnName = rsmd.getColumnName(i);
            columnDescriptors.add(new ColumnDescriptor(columnName, rsmd.getColumnType(i), rsmd.isNullable(i)));
        }
        LOG.debug("Query columns: {}", columnDescriptors);
        return columnDescriptors;
    }

    @Override
    public List<ColumnDescriptor> getColumns() {
        return columns;
    }

    @Override
    public boolean next() throws SQLException {
        return resultSet.next();
    }

    @Override
    public Cell[] getRow() throws SQLException {
        Cell[] row = new Cell[columns.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = getCell(i + 1);
        }
        return row;
    }

    private Cell getCell(int columnIndex) throws SQLException {
        Object value = resultSet.getObject(columnIndex);
        if (value == null) {
            return Cell.ofNull();
        }
        try {
            if (value instanceof Clob) {
                return Cell.ofString(clobToString((Clob) value));
            }
            if (value instanceof SQLXML) {
                return Cell.ofString(sqlxmlToString((SQLXML) value));
            }
            if (value instanceof Blob) {
                return Cell.of(blobToBytes((Blob) value));
            }
        } catch (IOException e) {
            throw new SQLException("Could not read LOB column " + columns.get(columnIndex - 1).getColumnName(), e);
        }
        return Cell.of(value);
    }

    /**
     * From java.sql.CLOB to String
     */
    private static String clobToString(Clob clobData) throws SQLException, IOException {
        try {
            return IOUtils.toString(clobData.getCharacterStream());
        } finally {
            // The most important thing here is free the CLOB to avoid memory Leaks
            clobData.free();
        }
    }

    private static String sqlxmlToString(SQLXML xmlData) throws SQLException, IOException {
        try {
            return IOUtils.toString(xmlData.getCharacterStream());
        } finally {
            xmlData.free();
        }
    }

    private static byte[] blobToBytes(Blob blobData) throws SQLException, IOException {
        try {
            return IOUtils.toByteArray(blobData.getBinaryStream());
        } finally {
            blobData.free();
        }
    }

    @Override
    public void close() throws SQLException {
        try {
            resultSet.close();
        } finally {
            statement.close();
        }
    }
}
