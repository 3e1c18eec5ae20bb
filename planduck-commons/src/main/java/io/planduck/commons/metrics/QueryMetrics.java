package io.planduck.commons.metrics;

public record QueryMetrics(String query, long durationMs, long cost, long outputSize) {
}
