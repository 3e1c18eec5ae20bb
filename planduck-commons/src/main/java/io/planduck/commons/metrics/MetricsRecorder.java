package io.planduck.commons.metrics;

import java.io.IOException;

/**
 * Append-only log with one row per completed query.
 */
public interface MetricsRecorder {

    void record(QueryMetrics metrics) throws IOException;

    MetricsRecorder NOOP = metrics -> { };
}
