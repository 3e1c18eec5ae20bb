package io.planduck.commons;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.types.pojo.Schema;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.duckdb.DuckDBResultSet;

import java.io.IOException;
import java.io.InputStream;
import java.sql.*;
import java.util.Properties;

/**
 * Single in-memory DuckDB database shared by the process. Every caller gets its own
 * duplicated connection, so workers never share a connection.
 */
public enum ConnectionPool {
    INSTANCE;

    private static final String DUCKDB_PROPERTY_FILENAME = "duckdb.properties";
    private final DuckDBConnection connection;


    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            throw new RuntimeException(e);
        }
    }

    ConnectionPool() {
        try {
            final Properties properties = loadProperties();
            if (!properties.containsKey(DuckDBDriver.JDBC_STREAM_RESULTS)) {
                properties.setProperty(DuckDBDriver.JDBC_STREAM_RESULTS, String.valueOf(true));
            }
            this.connection = (DuckDBConnection) DriverManager.getConnection("jdbc:duckdb:", properties);
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    /**
     *
     * @param connection
     * @param sql sql to be executed
     * @param tClass class of the return object
     * @return first value of the result set
     * @param <T>
     */
    public static <T> T collectFirst(Connection connection, String sql, Class<T> tClass) {
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
            try (ResultSet resultSet = statement.getResultSet()) {
                if (!resultSet.next()) {
                    throw new SQLException("Query returned no results: " + sql);
                }
                return resultSet.getObject(1, tClass);
            }
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static <T> T collectFirst(String sql, Class<T> tClass) {
        try (DuckDBConnection connection = getConnection()) {
            return collectFirst(connection, sql, tClass);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static boolean execute(Connection connection, String sql)  {
        try(Statement statement = connection.createStatement()) {
            return statement.execute(sql);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    public static boolean execute(String sql)  {
        try(Connection connection = ConnectionPool.getConnection();
            Statement statement = connection.createStatement()) {
            return statement.execute(sql);
        } catch (SQLException e) {
            throw new RuntimeSqlException(e);
        }
    }

    /**
     * Runs the sql and exposes the result as an arrow stream. The statement and result set are closed
     * together with the returned reader.
     */
    public static ArrowReader getReader(DuckDBConnection connection,
                                        BufferAllocator allocator,
                                        String sql,
                                        int batchSize) throws SQLException {

        final Statement statement = connection.createStatement();
        try {
            statement.execute(sql);
            final DuckDBResultSet resultSet = (DuckDBResultSet) statement.getResultSet();
            final ArrowReader internal = (ArrowReader) resultSet.arrowExportStream(allocator, batchSize);

            return new ArrowReader(allocator) {
                @Override
                public boolean loadNextBatch() throws IOException {
                    return internal.loadNextBatch();
                }

                @Override
                public long bytesRead() {
                    return internal.bytesRead();
                }

                @Override
                protected void closeReadSource() throws IOException {
                    internal.close();
                    try {
                        resultSet.close();
                        statement.close();
                    } catch (SQLException e) {
                        throw new IOException(e);
                    }
                }

                @Override
                protected Schema readSchema() throws IOException {
                    return internal.getVectorSchemaRoot().getSchema();
                }

                @Override
                public VectorSchemaRoot getVectorSchemaRoot() throws IOException {
                    return internal.getVectorSchemaRoot();
                }
            };
        } catch (SQLException e) {
            try {
                statement.close();
            } catch (SQLException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    public static DuckDBConnection getConnection()  {
        return INSTANCE.getConnectionInternal();
    }

    private DuckDBConnection getConnectionInternal() {
        try {
            return (DuckDBConnection) connection.duplicate();
        } catch (SQLException e ){
            throw new RuntimeException("Error creating connection", e);
        }
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();

        try (InputStream input = ConnectionPool.class.getClassLoader().getResourceAsStream(DUCKDB_PROPERTY_FILENAME)) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new RuntimeException(e);
        }
        return properties;
    }
}
