package io.planduck.http.server;

import com.sun.net.httpserver.HttpServer;
import com.typesafe.config.Config;
import io.planduck.common.util.ConfigUtils;
import io.planduck.commons.engine.DuckDBTabularEngine;
import io.planduck.commons.executor.PlanExecutor;
import io.planduck.commons.metrics.MetricsRecorder;
import io.planduck.commons.metrics.ParquetMetricsRecorder;
import io.planduck.commons.output.OutputMaterializer;
import io.planduck.commons.scheduler.JobScheduler;
import io.planduck.commons.scheduler.PlanJobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.Executors;

/**
 * The application main class.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Application main entry point.
     * @param args command line arguments, {@code --conf key=value} overrides application.conf
     */
    public static void main(String[] args) throws Exception {
        var appConfig = ConfigUtils.loadAppConfig(args);
        var server = start(appConfig);
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "planduck-shutdown"));
    }

    public static QueryServer start(Config appConfig) throws IOException {
        var httpConfig = appConfig.getConfig(ConfigUtils.HTTP_KEY);
        var port = httpConfig.getInt(ConfigUtils.PORT_KEY);
        var host = httpConfig.getString(ConfigUtils.HOST_KEY);
        var allowOrigin = httpConfig.hasPath(ConfigUtils.ALLOW_ORIGIN_KEY) ? httpConfig.getString(ConfigUtils.ALLOW_ORIGIN_KEY) : "*";

        var engine = new DuckDBTabularEngine();
        var materializer = new OutputMaterializer(engine,
                ConfigUtils.getOutputDir(appConfig),
                appConfig.getLong(ConfigUtils.INLINE_THRESHOLD_BYTES_KEY));
        MetricsRecorder metricsRecorder = appConfig.getBoolean(ConfigUtils.METRICS_ENABLED_KEY)
                ? new ParquetMetricsRecorder(ConfigUtils.getMetricsDir(appConfig))
                : MetricsRecorder.NOOP;
        var scheduler = new JobScheduler(
                appConfig.getInt(ConfigUtils.MAX_CONCURRENT_JOBS_KEY),
                appConfig.getInt(ConfigUtils.MAILBOX_CAPACITY_KEY),
                new PlanJobRunner(new PlanExecutor(engine), materializer),
                metricsRecorder);

        var server = HttpServer.create(new InetSocketAddress(host, port), 0);
        var cors = new CorsFilter(allowOrigin);
        server.createContext("/run-query", new QueryService(scheduler)).getFilters().add(cors);
        server.createContext("/health", new HealthCheckService(scheduler)).getFilters().add(cors);
        var requestExecutor = Executors.newCachedThreadPool();
        server.setExecutor(requestExecutor);
        server.start();

        logger.info("Http Server is up: Listening on URL: http://{}:{}", host, server.getAddress().getPort());
        return new QueryServer(server, requestExecutor, scheduler, engine);
    }
}
