package io.planduck.commons.scheduler;

import io.planduck.commons.plan.PlanStep;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * A submitted query. Owned by the scheduler's coordinator until it is handed to a worker, then by
 * that worker until it completes. Moves {@code QUEUED -> RUNNING -> COMPLETED}, each step once.
 */
public final class Job {

    public enum State {
        QUEUED, RUNNING, COMPLETED
    }

    private final long id;
    private final String query;
    private final List<PlanStep> plan;
    private final String parseError;
    private final int cost;
    private final CompletableFuture<AdmissionStatus> admission = new CompletableFuture<>();
    private final CompletableFuture<JobResult> completion = new CompletableFuture<>();
    private volatile State state = State.QUEUED;

    Job(long id, String query, List<PlanStep> plan, String parseError, int cost) {
        this.id = id;
        this.query = query;
        this.plan = List.copyOf(plan);
        this.parseError = parseError;
        this.cost = cost;
    }

    public long id() {
        return id;
    }

    public String query() {
        return query;
    }

    public List<PlanStep> plan() {
        return plan;
    }

    /**
     * Message of the parse failure that left this job with an empty plan, or null.
     */
    public String parseError() {
        return parseError;
    }

    public int cost() {
        return cost;
    }

    public State state() {
        return state;
    }

    CompletableFuture<AdmissionStatus> admission() {
        return admission;
    }

    CompletableFuture<JobResult> completion() {
        return completion;
    }

    void markRunning() {
        transition(State.QUEUED, State.RUNNING);
    }

    /**
     * Writes the completion slot. Only the first result is kept.
     */
    boolean complete(JobResult result) {
        if (completion.complete(result)) {
            state = State.COMPLETED;
            return true;
        }
        return false;
    }

    private void transition(State from, State to) {
        if (state != from) {
            throw new IllegalStateException("Job %d cannot move from %s to %s".formatted(id, state, to));
        }
        state = to;
    }

    @Override
    public String toString() {
        return "Job[id=" + id + ", cost=" + cost + ", state=" + state + ']';
    }
}
