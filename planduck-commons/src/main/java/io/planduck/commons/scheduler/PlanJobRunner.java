package io.planduck.commons.scheduler;

import io.planduck.commons.executor.PlanExecutor;
import io.planduck.commons.output.JobOutput;
import io.planduck.commons.output.OutputMaterializer;

import java.io.IOException;

/**
 * Executes the parsed plan of a job and materializes the resulting table.
 */
public class PlanJobRunner implements JobRunner {

    private final PlanExecutor executor;
    private final OutputMaterializer materializer;

    public PlanJobRunner(PlanExecutor executor, OutputMaterializer materializer) {
        this.executor = executor;
        this.materializer = materializer;
    }

    @Override
    public JobOutput run(Job job) throws IOException {
        var table = executor.execute(job.plan());
        return materializer.materialize(job.id(), table);
    }
}
