package io.planduck.commons.engine;

import io.planduck.commons.ConnectionPool;
import io.planduck.commons.RuntimeSqlException;
import io.planduck.commons.SqlQuoting;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.ipc.ArrowWriter;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import static io.planduck.commons.SqlQuoting.identifier;
import static io.planduck.commons.SqlQuoting.literal;
import static io.planduck.commons.SqlQuoting.string;

/**
 * {@link TabularEngine} on top of the embedded DuckDB database. Tables are lazy sql relations
 * composed step by step; nothing is executed until the table is serialized or written, at which
 * point rows are exported through arrow.
 */
public class DuckDBTabularEngine implements TabularEngine, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBTabularEngine.class);

    private static final int DEFAULT_ARROW_BATCH_SIZE = 10_000;

    private final BufferAllocator allocator;
    private final int batchSize;

    public DuckDBTabularEngine() {
        this(new RootAllocator(), DEFAULT_ARROW_BATCH_SIZE);
    }

    public DuckDBTabularEngine(BufferAllocator allocator, int batchSize) {
        this.allocator = allocator;
        this.batchSize = batchSize;
    }

    /**
     * Relation over the sql of a select statement.
     */
    public record SqlTable(String sql) implements Table {
    }

    @Override
    public Table load(String path) {
        if (!isGlob(path) && !Files.exists(Path.of(path))) {
            throw new EngineException(EngineException.Kind.NOT_FOUND, "Source not found: " + path);
        }
        var table = new SqlTable("SELECT * FROM read_parquet(%s)".formatted(string(path)));
        // Binding reads the parquet footer, which is enough to reject files that are not parquet.
        try (DuckDBConnection connection = ConnectionPool.getConnection()) {
            ConnectionPool.execute(connection, "DESCRIBE " + table.sql());
        } catch (RuntimeSqlException | SQLException e) {
            throw new EngineException(EngineException.Kind.CORRUPT, "Unable to read source %s: %s".formatted(path, e.getMessage()), e);
        }
        return table;
    }

    @Override
    public Table filter(Table table, Predicate predicate) {
        return new SqlTable("SELECT * FROM (%s) AS t WHERE %s %s %s".formatted(
                sql(table),
                identifier(predicate.column()),
                predicate.operator().sqlSymbol(),
                literal(predicate.literal())));
    }

    @Override
    public Table project(Table table, List<String> columns) {
        if (columns.isEmpty()) {
            throw new EngineException(EngineException.Kind.EXECUTION, "Projection requires at least one column");
        }
        return new SqlTable("SELECT %s FROM (%s) AS t".formatted(joinIdentifiers(columns), sql(table)));
    }

    @Override
    public Table groupAggregate(Table table, String key, List<AggregateExpression> aggregates) {
        var aggregateList = aggregates.stream()
                .map(a -> "%s(%s) AS %s".formatted(a.function().sqlFunction(), identifier(a.column()), identifier(a.outputName())))
                .collect(Collectors.joining(", "));
        if (key == null) {
            if (aggregates.isEmpty()) {
                throw new IllegalArgumentException("Whole table aggregation requires at least one aggregate");
            }
            return new SqlTable("SELECT %s FROM (%s) AS t".formatted(aggregateList, sql(table)));
        }
        var select = aggregates.isEmpty() ? identifier(key) : identifier(key) + ", " + aggregateList;
        return new SqlTable("SELECT %s FROM (%s) AS t GROUP BY %s".formatted(select, sql(table), identifier(key)));
    }

    @Override
    public Table sort(Table table, String column) {
        return new SqlTable("SELECT * FROM (%s) AS t ORDER BY %s".formatted(sql(table), identifier(column)));
    }

    @Override
    public byte[] serialize(Table table) throws IOException {
        var out = new ByteArrayOutputStream();
        export(table, root -> new ArrowStreamWriter(root, null, Channels.newChannel(out)));
        return out.toByteArray();
    }

    @Override
    public void writeToFile(Table table, Path path) throws IOException {
        try (var fos = new FileOutputStream(path.toFile());
             var channel = fos.getChannel()) {
            export(table, root -> new ArrowFileWriter(root, null, channel));
        }
    }

    private void export(Table table, Function<VectorSchemaRoot, ArrowWriter> writerFactory) throws IOException {
        var sql = sql(table);
        logger.debug("Exporting {}", sql);
        try (DuckDBConnection connection = ConnectionPool.getConnection();
             BufferAllocator childAllocator = allocator.newChildAllocator("export", 0, Long.MAX_VALUE);
             ArrowReader reader = ConnectionPool.getReader(connection, childAllocator, sql, batchSize);
             ArrowWriter writer = writerFactory.apply(reader.getVectorSchemaRoot())) {
            writer.start();
            while (reader.loadNextBatch()) {
                writer.writeBatch();
            }
            writer.end();
        } catch (SQLException e) {
            throw new EngineException(EngineException.Kind.EXECUTION, e.getMessage(), e);
        }
    }

    private static String sql(Table table) {
        if (table instanceof SqlTable sqlTable) {
            return sqlTable.sql();
        }
        throw new IllegalArgumentException("Table was not created by DuckDBTabularEngine: " + table);
    }

    private static String joinIdentifiers(List<String> columns) {
        return columns.stream().map(SqlQuoting::identifier).collect(Collectors.joining(", "));
    }

    private static boolean isGlob(String path) {
        return path.contains("*") || path.contains("?");
    }

    @Override
    public void close() {
        allocator.close();
    }
}
