package io.planduck.commons.output;

import com.github.luben.zstd.Zstd;
import io.planduck.commons.engine.Table;
import io.planduck.commons.engine.TabularEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Packages a finished table as the result of a job. The table is serialized and zstd compressed;
 * when the compressed size is within the inline threshold the compressed bytes are returned.
 * Otherwise the uncompressed table is written to {@code output_<jobId>.arrow} in the output
 * directory and the path is returned instead. Spilled files are never deleted here.
 */
public class OutputMaterializer {

    private static final Logger logger = LoggerFactory.getLogger(OutputMaterializer.class);

    public static final long DEFAULT_INLINE_THRESHOLD_BYTES = 1_000_000;

    private final TabularEngine engine;
    private final Path outputDir;
    private final long inlineThresholdBytes;

    public OutputMaterializer(TabularEngine engine, Path outputDir) {
        this(engine, outputDir, DEFAULT_INLINE_THRESHOLD_BYTES);
    }

    public OutputMaterializer(TabularEngine engine, Path outputDir, long inlineThresholdBytes) {
        this.engine = engine;
        this.outputDir = outputDir;
        this.inlineThresholdBytes = inlineThresholdBytes;
    }

    public JobOutput materialize(long jobId, Table table) throws IOException {
        var serialized = engine.serialize(table);
        var compressed = Zstd.compress(serialized);
        if (compressed.length <= inlineThresholdBytes) {
            logger.debug("Job {} inline output: {} bytes compressed, {} bytes raw", jobId, compressed.length, serialized.length);
            return new JobOutput.Inline(compressed);
        }
        var path = spillPath(jobId);
        engine.writeToFile(table, path);
        var size = Files.size(path);
        logger.info("Job {} output spilled to {}: {} bytes compressed exceeds {}", jobId, path, compressed.length, inlineThresholdBytes);
        return new JobOutput.Spilled(path.toString(), size);
    }

    public Path spillPath(long jobId) {
        return outputDir.resolve("output_%d.arrow".formatted(jobId));
    }
}
