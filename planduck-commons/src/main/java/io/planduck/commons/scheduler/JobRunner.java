package io.planduck.commons.scheduler;

import io.planduck.commons.output.JobOutput;

/**
 * Work performed by a worker slot for one job.
 */
@FunctionalInterface
public interface JobRunner {
    JobOutput run(Job job) throws Exception;
}
