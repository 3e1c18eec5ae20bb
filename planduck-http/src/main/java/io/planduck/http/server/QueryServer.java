package io.planduck.http.server;

import com.sun.net.httpserver.HttpServer;
import io.planduck.commons.engine.DuckDBTabularEngine;
import io.planduck.commons.scheduler.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;

/**
 * A started server together with what it owns. Closing it stops accepting requests, then shuts
 * the scheduler and the engine down.
 */
public class QueryServer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(QueryServer.class);

    private final HttpServer server;
    private final ExecutorService requestExecutor;
    private final JobScheduler scheduler;
    private final DuckDBTabularEngine engine;

    QueryServer(HttpServer server, ExecutorService requestExecutor, JobScheduler scheduler, DuckDBTabularEngine engine) {
        this.server = server;
        this.requestExecutor = requestExecutor;
        this.scheduler = scheduler;
        this.engine = engine;
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        scheduler.close();
        requestExecutor.shutdown();
        engine.close();
        logger.info("Http Server stopped");
    }
}
