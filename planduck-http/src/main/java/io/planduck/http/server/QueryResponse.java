package io.planduck.http.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.planduck.commons.output.JobOutput;
import io.planduck.commons.scheduler.JobHandle;
import io.planduck.commons.scheduler.JobResult;

import java.util.Base64;

/**
 * Body of a {@code /run-query} answer. {@code output} is the base64 of the zstd compressed arrow
 * stream, the path of the spilled arrow file, or null when the job failed.
 */
public record QueryResponse(@JsonProperty("job_id") long jobId,
                            String status,
                            @JsonProperty("duration_ms") long durationMs,
                            int cost,
                            String output,
                            @JsonInclude(JsonInclude.Include.NON_NULL) String error) {

    public static QueryResponse of(JobHandle handle, JobResult result) {
        String output = null;
        if (result.output() instanceof JobOutput.Inline inline) {
            output = Base64.getEncoder().encodeToString(inline.bytes());
        } else if (result.output() instanceof JobOutput.Spilled spilled) {
            output = spilled.path();
        }
        return new QueryResponse(handle.jobId(),
                handle.status().label(),
                result.duration().toMillis(),
                result.cost(),
                output,
                output == null ? result.error() : null);
    }
}
