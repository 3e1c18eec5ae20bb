package io.planduck.commons.scheduler;

import io.planduck.commons.output.JobOutput;

import java.time.Duration;

/**
 * @param error reason of the failure, null unless {@code output} is {@link JobOutput.Empty}
 */
public record JobResult(long jobId, JobOutput output, Duration duration, int cost, String error) {

    public boolean isSuccess() {
        return !(output instanceof JobOutput.Empty);
    }
}
