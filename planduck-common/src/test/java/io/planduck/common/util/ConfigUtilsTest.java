package io.planduck.common.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigUtilsTest {

    @Test
    public void testDefaults() {
        var config = ConfigUtils.loadAppConfig(new String[0]);
        assertEquals(3000, config.getConfig(ConfigUtils.HTTP_KEY).getInt(ConfigUtils.PORT_KEY));
        assertEquals(4, config.getInt(ConfigUtils.MAX_CONCURRENT_JOBS_KEY));
        assertEquals(100, config.getInt(ConfigUtils.MAILBOX_CAPACITY_KEY));
        assertEquals(1_000_000L, config.getLong(ConfigUtils.INLINE_THRESHOLD_BYTES_KEY));
        assertTrue(config.getBoolean(ConfigUtils.METRICS_ENABLED_KEY));
    }

    @Test
    public void testCommandLineOverride() {
        var config = ConfigUtils.loadAppConfig(new String[]{
                "--conf", "planduck.http.port=8099",
                "--conf", "planduck.scheduler.max_concurrent_jobs=2"});
        assertEquals(8099, config.getConfig(ConfigUtils.HTTP_KEY).getInt(ConfigUtils.PORT_KEY));
        assertEquals(2, config.getInt(ConfigUtils.MAX_CONCURRENT_JOBS_KEY));
        // untouched keys still come from application.conf
        assertEquals("*", config.getConfig(ConfigUtils.HTTP_KEY).getString(ConfigUtils.ALLOW_ORIGIN_KEY));
    }

    @Test
    public void testMainParameters() {
        var result = ConfigUtils.loadCommandLineConfig(new String[]{"--conf", "a=1", "extra"});
        assertEquals(1, result.config().getInt("a"));
        assertEquals(List.of("extra"), result.mainParameters());
    }

    @Test
    public void testOutputDirIsCreated(@TempDir Path tempDir) throws Exception {
        var target = tempDir.resolve("spill").resolve("nested");
        var config = ConfigUtils.loadAppConfig(new String[]{
                "--conf", "planduck.output.dir=\"%s\"".formatted(target)});
        var dir = ConfigUtils.getOutputDir(config);
        assertEquals(target, dir);
        assertTrue(Files.isDirectory(dir));
    }
}
