package io.planduck.commons.scheduler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * What a submitter gets back from {@link JobScheduler#enqueue}. The result future completes exactly
 * once, with a failed {@link JobResult} rather than exceptionally when the job fails.
 */
public record JobHandle(long jobId, AdmissionStatus status, int cost, CompletableFuture<JobResult> result) {

    public JobResult await() throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Job %d completed exceptionally".formatted(jobId), e.getCause());
        }
    }
}
