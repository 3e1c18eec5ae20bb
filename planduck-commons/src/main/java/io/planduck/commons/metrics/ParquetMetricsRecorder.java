package io.planduck.commons.metrics;

import io.planduck.commons.ConnectionPool;
import io.planduck.commons.RuntimeSqlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import static io.planduck.commons.SqlQuoting.string;

/**
 * Keeps the metrics log in {@code query_metrics.parquet} inside the metrics directory. Parquet
 * files cannot be appended to, so every record reads the existing rows back and rewrites the file
 * with the new row at the end. Records are serialized.
 */
public class ParquetMetricsRecorder implements MetricsRecorder {

    private static final Logger logger = LoggerFactory.getLogger(ParquetMetricsRecorder.class);

    public static final String METRICS_FILE_NAME = "query_metrics.parquet";

    private static final String COLUMNS = "query, duration_ms, cost, output_size";

    private final Path metricsDir;

    public ParquetMetricsRecorder(Path metricsDir) {
        this.metricsDir = metricsDir;
    }

    public Path getMetricsFile() {
        return metricsDir.resolve(METRICS_FILE_NAME);
    }

    @Override
    public synchronized void record(QueryMetrics metrics) throws IOException {
        Files.createDirectories(metricsDir);
        var target = getMetricsFile();
        var row = "SELECT CAST(%s AS VARCHAR) AS query, CAST(%d AS BIGINT) AS duration_ms, CAST(%d AS BIGINT) AS cost, CAST(%d AS BIGINT) AS output_size"
                .formatted(string(metrics.query()), metrics.durationMs(), metrics.cost(), metrics.outputSize());
        try {
            if (Files.exists(target)) {
                var temp = metricsDir.resolve(METRICS_FILE_NAME + ".tmp");
                ConnectionPool.execute("COPY (SELECT %s FROM read_parquet(%s) UNION ALL %s) TO %s (FORMAT parquet)"
                        .formatted(COLUMNS, string(target.toString()), row, string(temp.toString())));
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } else {
                ConnectionPool.execute("COPY (%s) TO %s (FORMAT parquet)".formatted(row, string(target.toString())));
            }
        } catch (RuntimeSqlException e) {
            throw new IOException("Unable to append metrics to " + target, e);
        }
        logger.debug("Recorded metrics {}", metrics);
    }
}
