package io.planduck.commons.scheduler;

import io.planduck.commons.engine.EngineException;
import io.planduck.commons.executor.NoTableBuiltException;
import io.planduck.commons.metrics.MetricsRecorder;
import io.planduck.commons.metrics.QueryMetrics;
import io.planduck.commons.output.JobOutput;
import io.planduck.commons.plan.PlanParseException;
import io.planduck.commons.plan.PlanParser;
import io.planduck.commons.plan.PlanStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Runs submitted queries on at most {@code maxConcurrentJobs} workers at a time.
 *
 * <p>All scheduling decisions are taken by a single coordinator thread, which is the only owner of
 * the active worker count and of the overflow queue. It is fed through two channels: the bounded
 * arrival mailbox, written by {@link #enqueue}, and the completion channel, written by workers
 * when they finish. The coordinator alternates which channel it looks at first, so neither kind
 * of event has priority over the other; each channel is FIFO.
 * <ul>
 *   <li>arrival: start a worker if one is free, otherwise append the job to the overflow queue</li>
 *   <li>completion: free the slot and start the head of the overflow queue, if any</li>
 * </ul>
 * Every worker sends its completion notice no matter how the job ended, so queued jobs always
 * get to run.
 */
public class JobScheduler implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(JobScheduler.class);

    public static final int DEFAULT_MAX_CONCURRENT_JOBS = 4;
    public static final int DEFAULT_MAILBOX_CAPACITY = 100;
    public static final int COST_PER_STEP = 10;
    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(1);

    private final int maxConcurrentJobs;
    private final JobRunner runner;
    private final MetricsRecorder metricsRecorder;
    private final AtomicLong nextId = new AtomicLong(1);

    // Every event put on one of the channels releases exactly one permit.
    private final BlockingQueue<Job> arrivals;
    private final BlockingQueue<Job> completions = new LinkedBlockingQueue<>();
    private final Semaphore events = new Semaphore(0);

    // Coordinator thread only
    private final Deque<Job> overflow = new ArrayDeque<>();
    private int active;
    private boolean arrivalsFirst = true;

    private volatile int activeSnapshot;
    private volatile int queuedSnapshot;

    private final ExecutorService workers;
    // Metrics appends run off the worker slots so a slow log never holds up queued jobs.
    private final ExecutorService metricsWriter;
    private final Thread coordinator;
    private final ReentrantReadWriteLock closeLock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    public JobScheduler(JobRunner runner) {
        this(DEFAULT_MAX_CONCURRENT_JOBS, DEFAULT_MAILBOX_CAPACITY, runner, MetricsRecorder.NOOP);
    }

    public JobScheduler(int maxConcurrentJobs,
                        int mailboxCapacity,
                        JobRunner runner,
                        MetricsRecorder metricsRecorder) {
        if (maxConcurrentJobs <= 0) {
            throw new IllegalArgumentException("maxConcurrentJobs must be positive, got: " + maxConcurrentJobs);
        }
        if (mailboxCapacity <= 0) {
            throw new IllegalArgumentException("mailboxCapacity must be positive, got: " + mailboxCapacity);
        }
        this.maxConcurrentJobs = maxConcurrentJobs;
        this.runner = runner;
        this.metricsRecorder = metricsRecorder;
        this.arrivals = new ArrayBlockingQueue<>(mailboxCapacity);
        var workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxConcurrentJobs, r -> {
            var thread = new Thread(r, "planduck-worker-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.metricsWriter = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "planduck-metrics");
            thread.setDaemon(true);
            return thread;
        });
        this.coordinator = new Thread(this::coordinate, "planduck-scheduler");
        this.coordinator.setDaemon(true);
        this.coordinator.start();
        logger.info("Scheduler started with {} workers and mailbox capacity {}", maxConcurrentJobs, mailboxCapacity);
    }

    /**
     * Submits a query. Blocks while the arrival mailbox is full, then until the coordinator has
     * decided whether the job runs now or waits in the overflow queue.
     *
     * <p>A query that does not parse is still accepted: it runs with an empty plan and fails with
     * {@link NoTableBuiltException}; the parse message is kept in the result's error.
     *
     * @throws IllegalStateException if the scheduler is closed
     */
    public JobHandle enqueue(String query) throws InterruptedException {
        var id = nextId.getAndIncrement();
        List<PlanStep> plan;
        String parseError = null;
        try {
            plan = PlanParser.parse(query);
        } catch (PlanParseException e) {
            logger.warn("Job {} does not parse, running it with an empty plan: {}", id, e.getMessage());
            plan = List.of();
            parseError = e.getMessage();
        }
        var job = new Job(id, query, plan, parseError, estimateCost(plan));

        closeLock.readLock().lock();
        try {
            if (closed) {
                throw new IllegalStateException("Scheduler is closed");
            }
            arrivals.put(job);
            events.release();
        } finally {
            closeLock.readLock().unlock();
        }

        AdmissionStatus status;
        try {
            status = job.admission().get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Admission of job %d failed".formatted(id), e.getCause());
        }
        return new JobHandle(id, status, job.cost(), job.completion());
    }

    public static int estimateCost(List<PlanStep> plan) {
        return plan.size() * COST_PER_STEP;
    }

    public int getMaxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    /**
     * Jobs holding a worker slot, as last published by the coordinator.
     */
    public int activeJobs() {
        return activeSnapshot;
    }

    public int queuedJobs() {
        return queuedSnapshot;
    }

    private void coordinate() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                events.acquire();
                dispatchNextEvent();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("Scheduler coordinator stopped");
    }

    private void dispatchNextEvent() {
        Job arrived = null;
        Job finished = null;
        if (arrivalsFirst) {
            arrived = arrivals.poll();
            if (arrived == null) {
                finished = completions.poll();
            }
        } else {
            finished = completions.poll();
            if (finished == null) {
                arrived = arrivals.poll();
            }
        }
        arrivalsFirst = !arrivalsFirst;

        if (arrived != null) {
            onArrival(arrived);
        } else if (finished != null) {
            onCompletion(finished);
        }
        activeSnapshot = active;
        queuedSnapshot = overflow.size();
    }

    private void onArrival(Job job) {
        if (active < maxConcurrentJobs) {
            job.admission().complete(AdmissionStatus.RUNNING);
            startWorker(job);
        } else {
            overflow.addLast(job);
            job.admission().complete(AdmissionStatus.QUEUED);
            logger.debug("Job {} queued behind {} jobs", job.id(), overflow.size() - 1);
        }
    }

    private void onCompletion(Job job) {
        active--;
        var next = overflow.pollFirst();
        if (next != null) {
            startWorker(next);
        }
    }

    private void startWorker(Job job) {
        job.markRunning();
        active++;
        workers.execute(() -> runJob(job));
    }

    private void runJob(Job job) {
        var start = System.nanoTime();
        try {
            logger.info("Job {} started", job.id());
            JobOutput output = JobOutput.EMPTY;
            String error = null;
            try {
                output = runner.run(job);
            } catch (Exception e) {
                error = describeFailure(job, e);
            }
            var duration = Duration.ofNanos(System.nanoTime() - start);
            var result = new JobResult(job.id(), output, duration, job.cost(), error);
            job.complete(result);
            logger.info("Job {} finished in {} ms, success {}", job.id(), duration.toMillis(), result.isSuccess());
        } finally {
            if (job.state() != Job.State.COMPLETED) {
                job.complete(failed(job, Duration.ofNanos(System.nanoTime() - start), "Worker terminated unexpectedly"));
            }
            completions.add(job);
            events.release();
        }
        var result = job.completion().join();
        metricsWriter.execute(() -> recordMetrics(job, result));
    }

    private String describeFailure(Job job, Exception e) {
        if (e instanceof EngineException || e instanceof NoTableBuiltException || e instanceof IOException) {
            logger.warn("Job {} failed: {}", job.id(), e.getMessage());
        } else {
            logger.atError().setCause(e).log("Job {} failed unexpectedly", job.id());
        }
        var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return job.parseError() == null ? message : "%s (%s)".formatted(message, job.parseError());
    }

    private void recordMetrics(Job job, JobResult result) {
        try {
            metricsRecorder.record(new QueryMetrics(job.query(), result.duration().toMillis(), result.cost(), result.output().size()));
        } catch (IOException | RuntimeException e) {
            logger.warn("Unable to record metrics for job {}: {}", job.id(), e.getMessage());
        }
    }

    private void reject(Job job, String reason) {
        job.admission().complete(AdmissionStatus.QUEUED);
        job.complete(failed(job, Duration.ZERO, reason));
    }

    private static JobResult failed(Job job, Duration duration, String reason) {
        return new JobResult(job.id(), JobOutput.EMPTY, duration, job.cost(), reason);
    }

    /**
     * Stops accepting jobs. Jobs still waiting for a worker complete with a failed result; running
     * jobs are allowed to finish.
     */
    @Override
    public void close() {
        closeLock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
        } finally {
            closeLock.writeLock().unlock();
        }
        coordinator.interrupt();
        try {
            coordinator.join();
            // The coordinator is gone, this thread now owns the mailbox and the overflow queue.
            Job job;
            while ((job = overflow.pollFirst()) != null) {
                reject(job, "Scheduler closed before the job started");
            }
            while ((job = arrivals.poll()) != null) {
                reject(job, "Scheduler closed before the job started");
            }
            workers.shutdown();
            if (!workers.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Workers still running after {}", SHUTDOWN_TIMEOUT);
            }
            metricsWriter.shutdown();
            if (!metricsWriter.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Metrics still being written after {}", SHUTDOWN_TIMEOUT);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
            metricsWriter.shutdownNow();
        }
        logger.info("Scheduler closed");
    }
}
