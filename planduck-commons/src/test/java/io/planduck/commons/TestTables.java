package io.planduck.commons;

import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.util.Text;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parquet fixtures written through DuckDB, and helpers decoding arrow output back into rows.
 */
public final class TestTables {

    private TestTables() {
    }

    /**
     * name, age and city of five people; ages are BIGINT.
     */
    public static Path people(Path dir) {
        return writeParquet(dir.resolve("people.parquet"), """
                SELECT * FROM (VALUES
                    ('alice', 20::BIGINT, 'Paris'),
                    ('bob',   40::BIGINT, 'London'),
                    ('carol', 25::BIGINT, 'Paris'),
                    ('dave',  35::BIGINT, 'Berlin'),
                    ('erin',  40::BIGINT, 'London')) AS t(name, age, city)
                """);
    }

    public static Path writeParquet(Path path, String select) {
        ConnectionPool.execute("COPY (%s) TO %s (FORMAT parquet)".formatted(select, SqlQuoting.string(path.toString())));
        return path;
    }

    public static List<Map<String, Object>> readStream(byte[] arrowStream) throws IOException {
        return readStream(new ByteArrayInputStream(arrowStream));
    }

    public static List<Map<String, Object>> readStream(InputStream in) throws IOException {
        try (var allocator = new RootAllocator();
             var reader = new ArrowStreamReader(in, allocator)) {
            return rows(reader);
        }
    }

    public static List<Map<String, Object>> readFile(Path path) throws IOException {
        try (var allocator = new RootAllocator();
             var channel = Files.newByteChannel(path);
             var reader = new ArrowFileReader(channel, allocator)) {
            return rows(reader);
        }
    }

    private static List<Map<String, Object>> rows(ArrowReader reader) throws IOException {
        var result = new ArrayList<Map<String, Object>>();
        var root = reader.getVectorSchemaRoot();
        while (reader.loadNextBatch()) {
            for (int i = 0; i < root.getRowCount(); i++) {
                var row = new LinkedHashMap<String, Object>();
                for (FieldVector vector : root.getFieldVectors()) {
                    var value = vector.getObject(i);
                    row.put(vector.getName(), value instanceof Text text ? text.toString() : value);
                }
                result.add(row);
            }
        }
        return result;
    }
}
