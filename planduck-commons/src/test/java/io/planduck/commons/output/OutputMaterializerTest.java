package io.planduck.commons.output;

import com.github.luben.zstd.ZstdInputStream;
import io.planduck.commons.TestTables;
import io.planduck.commons.engine.DuckDBTabularEngine;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class OutputMaterializerTest {

    @TempDir
    static Path dir;

    static DuckDBTabularEngine engine;
    static Path people;

    @BeforeAll
    static void setup() {
        engine = new DuckDBTabularEngine();
        people = TestTables.people(dir);
    }

    @AfterAll
    static void cleanup() {
        engine.close();
    }

    @Test
    public void testSmallTableIsInlinedCompressed() throws Exception {
        var materializer = new OutputMaterializer(engine, dir);
        var output = materializer.materialize(1, engine.load(people.toString()));

        var inline = assertInstanceOf(JobOutput.Inline.class, output);
        assertEquals(inline.bytes().length, output.size());
        try (var in = new ZstdInputStream(new ByteArrayInputStream(inline.bytes()))) {
            var rows = TestTables.readStream(in);
            assertEquals(5, rows.size());
            assertEquals("alice", rows.get(0).get("name"));
        }
        assertFalse(Files.exists(materializer.spillPath(1)));
    }

    @Test
    public void testLowThresholdSpillsUncompressedFile() throws Exception {
        var outputDir = Files.createDirectory(dir.resolve("low-threshold"));
        var materializer = new OutputMaterializer(engine, outputDir, 16);
        var output = materializer.materialize(7, engine.load(people.toString()));

        var spilled = assertInstanceOf(JobOutput.Spilled.class, output);
        var path = outputDir.resolve("output_7.arrow");
        assertEquals(path.toString(), spilled.path());
        assertEquals(Files.size(path), spilled.size());
        assertEquals(5, TestTables.readFile(path).size());
    }

    @Test
    public void testLargeIncompressibleTableSpills() throws Exception {
        var outputDir = Files.createDirectory(dir.resolve("large"));
        var random = TestTables.writeParquet(dir.resolve("random.parquet"),
                "SELECT random() AS a, random() AS b FROM range(300000)");
        var materializer = new OutputMaterializer(engine, outputDir);
        var output = materializer.materialize(42, engine.load(random.toString()));

        var spilled = assertInstanceOf(JobOutput.Spilled.class, output);
        assertTrue(spilled.size() > OutputMaterializer.DEFAULT_INLINE_THRESHOLD_BYTES);
        assertEquals(300000, TestTables.readFile(Path.of(spilled.path())).size());
    }

    @Test
    public void testThresholdIsInclusive() throws Exception {
        var table = engine.load(people.toString());
        var inline = (JobOutput.Inline) new OutputMaterializer(engine, dir).materialize(3, table);
        var exact = new OutputMaterializer(engine, dir, inline.size()).materialize(4, table);
        assertInstanceOf(JobOutput.Inline.class, exact);
    }
}
