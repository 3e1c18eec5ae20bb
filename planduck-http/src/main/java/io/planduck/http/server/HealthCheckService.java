package io.planduck.http.server;

import com.sun.net.httpserver.HttpExchange;
import io.planduck.commons.ConnectionPool;
import io.planduck.commons.scheduler.JobScheduler;

import java.io.IOException;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class HealthCheckService extends AbstractService {

    private final Instant startTime = Instant.now();
    private final JobScheduler scheduler;

    public HealthCheckService(JobScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    protected void handleInternal(HttpExchange exchange) throws IOException {
        requireMethod(exchange, "GET");

        boolean dbUp;
        String dbError = null;
        try (Connection conn = ConnectionPool.getConnection();
             var stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT 1")) {
            dbUp = rs.next();
            if (!dbUp) {
                dbError = "SELECT 1 returned no rows";
            }
        } catch (Exception e) {
            dbUp = false;
            dbError = e.getMessage();
            logger.atWarn().setCause(e).log("Database health check failed");
        }

        var body = new LinkedHashMap<String, Object>();
        body.put("status", dbUp ? "UP" : "DEGRADED");
        body.put("uptime_seconds", Instant.now().getEpochSecond() - startTime.getEpochSecond());
        body.put("scheduler", Map.of(
                "active", scheduler.activeJobs(),
                "queued", scheduler.queuedJobs(),
                "max_concurrent_jobs", scheduler.getMaxConcurrentJobs()));
        body.put("database", dbUp
                ? Map.of("status", "UP", "check", "SELECT 1")
                : Map.of("status", "DOWN", "check", "SELECT 1", "error", String.valueOf(dbError)));
        body.put("timestamp", Instant.now().toString());
        sendJson(exchange, dbUp ? 200 : 503, body);
    }
}
