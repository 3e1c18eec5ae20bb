package io.planduck.common.util;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class ConfigUtils {

    public static final String CONFIG_PATH = "planduck";

    public static final String HTTP_KEY = "http";
    public static final String PORT_KEY = "port";
    public static final String HOST_KEY = "host";
    public static final String ALLOW_ORIGIN_KEY = "allow-origin";

    // Scheduler configuration keys
    public static final String MAX_CONCURRENT_JOBS_KEY = "scheduler.max_concurrent_jobs";
    public static final String MAILBOX_CAPACITY_KEY = "scheduler.mailbox_capacity";

    // Output configuration keys
    public static final String OUTPUT_DIR_KEY = "output.dir";
    public static final String INLINE_THRESHOLD_BYTES_KEY = "output.inline_threshold_bytes";

    // Metrics configuration keys
    public static final String METRICS_ENABLED_KEY = "metrics.enabled";
    public static final String METRICS_DIR_KEY = "metrics.dir";

    public record ConfigWithMainParameters(Config config, List<String> mainParameters){}

    public static ConfigWithMainParameters loadCommandLineConfig(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .build()
                .parse(args);
        var buffer = new StringBuilder();
        if(argv.configs !=null) {
            argv.configs.forEach(c -> {
                buffer.append(c);
                buffer.append("\n");
            });
        }

        return new ConfigWithMainParameters(ConfigFactory.parseString(buffer.toString()), argv.mainParameters);
    }

    /**
     * Command line overrides layered over {@code application.conf}, resolved and narrowed to {@link #CONFIG_PATH}.
     */
    public static Config loadAppConfig(String[] args) {
        var commandlineConfig = loadCommandLineConfig(args).config();
        return commandlineConfig.withFallback(ConfigFactory.load()).resolve().getConfig(CONFIG_PATH);
    }

    public static Path getOutputDir(Config config) throws IOException {
        return ensureDirectory(Path.of(config.getString(OUTPUT_DIR_KEY)));
    }

    public static Path getMetricsDir(Config config) {
        return Path.of(config.getString(METRICS_DIR_KEY));
    }

    private static Path ensureDirectory(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
        }
        return dir;
    }

    public static class Args {
        @Parameter(names = {"--conf"}, description = "Configurations" )
        private List<String> configs;

        @Parameter
        private List<String>  mainParameters;
    }
}
