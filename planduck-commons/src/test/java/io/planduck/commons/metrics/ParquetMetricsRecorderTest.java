package io.planduck.commons.metrics;

import io.planduck.commons.ConnectionPool;
import io.planduck.commons.SqlQuoting;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ParquetMetricsRecorderTest {

    @TempDir
    Path dir;

    private static long count(Path file, String where) {
        return ConnectionPool.collectFirst("SELECT count(*) FROM read_parquet(%s) WHERE %s"
                .formatted(SqlQuoting.string(file.toString()), where), Long.class);
    }

    @Test
    public void testRecordsAreAppended() throws Exception {
        var metricsDir = dir.resolve("nested/metrics");
        var recorder = new ParquetMetricsRecorder(metricsDir);
        recorder.record(new QueryMetrics("load \"a.parquet\"", 12, 10, 345));
        recorder.record(new QueryMetrics("it's quoted", 3, 0, 0));

        var file = metricsDir.resolve(ParquetMetricsRecorder.METRICS_FILE_NAME);
        assertEquals(file, recorder.getMetricsFile());
        assertTrue(Files.exists(file));
        assertFalse(Files.exists(metricsDir.resolve(ParquetMetricsRecorder.METRICS_FILE_NAME + ".tmp")));
        assertEquals(2, count(file, "true"));
        assertEquals(1, count(file, "query = 'load \"a.parquet\"' AND duration_ms = 12 AND cost = 10 AND output_size = 345"));
        assertEquals(1, count(file, "query = 'it''s quoted'"));
    }

    @Test
    public void testCorruptLogFails() throws Exception {
        Files.writeString(dir.resolve(ParquetMetricsRecorder.METRICS_FILE_NAME), "garbage");
        var recorder = new ParquetMetricsRecorder(dir);
        assertThrows(IOException.class, () -> recorder.record(new QueryMetrics("q", 1, 1, 1)));
    }
}
