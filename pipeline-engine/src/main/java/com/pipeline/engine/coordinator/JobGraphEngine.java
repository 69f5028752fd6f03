package com.pipeline.engine.coordinator;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.exception.InvalidStateTransitionException;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.exception.PipelineException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.JobResult;
import com.pipeline.core.model.JobState;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.RunContext;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.RunState;
import com.pipeline.core.model.StepResult;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.core.repository.ArtifactStore;
import com.pipeline.core.repository.RunRepository;
import com.pipeline.core.secret.SecretStore;
import com.pipeline.engine.environment.EnvironmentProvisioner;
import com.pipeline.engine.environment.ExecutionEnvironment;
import com.pipeline.engine.graph.JobGraph;
import com.pipeline.engine.graph.WorkflowValidator;
import com.pipeline.engine.history.RunEventLog;
import com.pipeline.engine.logging.LoggingContext;
import com.pipeline.engine.step.ConditionEvaluator;
import com.pipeline.engine.step.ExpressionScope;
import com.pipeline.engine.step.JobExecution;
import com.pipeline.engine.step.StepRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes workflow runs: validates the job graph, schedules jobs level by level
 * and records every transition in the run log.
 *
 * Within a level, every job whose {@code needs} all succeeded is launched concurrently
 * on a bounded executor. A job with a failed, skipped or cancelled need is skipped, which
 * propagates the failure to all of its descendants. A job running past its time budget is
 * interrupted and fails with {@code JOB_TIMEOUT}. Nothing is retried automatically.
 *
 * This is the central control plane component.
 */
public class JobGraphEngine {

    private static final Logger log = LoggerFactory.getLogger(JobGraphEngine.class);

    public static final String ERROR_CANCELLED = "RUN_CANCELLED";
    public static final String ERROR_INTERNAL = "INTERNAL_ERROR";

    /** How long a cancelled job thread may take to unwind before the run is closed without it. */
    static final Duration CANCEL_GRACE = Duration.ofSeconds(10);

    private final WorkflowValidator validator;
    private final StepRunner stepRunner;
    private final ConditionEvaluator conditionEvaluator;
    private final EnvironmentProvisioner provisioner;
    private final RunRepository runRepository;
    private final ArtifactStore artifactStore;
    private final SecretStore secretStore;
    private final RunEventLog eventLog;
    private final Duration defaultJobTimeout;

    private final ExecutorService runExecutor;
    private final ExecutorService jobExecutor;
    private final ScheduledExecutorService watchdog;
    private final Map<UUID, RunHandle> activeRuns = new ConcurrentHashMap<>();

    public JobGraphEngine(
            WorkflowValidator validator,
            StepRunner stepRunner,
            ConditionEvaluator conditionEvaluator,
            EnvironmentProvisioner provisioner,
            RunRepository runRepository,
            ArtifactStore artifactStore,
            SecretStore secretStore,
            RunEventLog eventLog,
            int maxParallelJobs,
            Duration defaultJobTimeout) {
        this.validator = validator;
        this.stepRunner = stepRunner;
        this.conditionEvaluator = conditionEvaluator;
        this.provisioner = provisioner;
        this.runRepository = runRepository;
        this.artifactStore = artifactStore;
        this.secretStore = secretStore;
        this.eventLog = eventLog;
        this.defaultJobTimeout = defaultJobTimeout;
        this.runExecutor = Executors.newCachedThreadPool(namedThreads("run"));
        this.jobExecutor = Executors.newFixedThreadPool(maxParallelJobs, namedThreads("job"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(namedThreads("job-watchdog"));
    }

    /**
     * Validate the workflow and start a run for the event. Returns as soon as the run is queued.
     *
     * @param definition The workflow
     * @param event The triggering event
     * @param rerunOf The run being repeated, or null
     * @return The queued run
     * @throws ConfigurationException if the workflow is invalid; no run is created and no job executes
     */
    public Run start(WorkflowDefinition definition, RepositoryEvent event, UUID rerunOf) {
        JobGraph graph = validator.validate(definition);

        Run run = Run.create(definition, event, rerunOf);
        runRepository.save(run);
        RunHandle handle = new RunHandle(run.runId());
        activeRuns.put(run.runId(), handle);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow", definition.id());
        payload.put("event", event.kind().triggerName());
        payload.put("ref", event.ref());
        if (rerunOf != null) {
            payload.put("rerunOf", rerunOf.toString());
        }
        eventLog.record(run.runId(), run.traceId(), RunEventType.RUN_QUEUED, null, null, payload);
        log.info("Queued run {} of {} for {} on {}", run.runId(), definition.id(),
            event.kind().triggerName(), event.ref());

        runExecutor.submit(() -> coordinate(definition, graph, run.runId(), handle));
        return run;
    }

    /**
     * Start a run and wait for it to finish.
     */
    public Run execute(WorkflowDefinition definition, RepositoryEvent event) throws InterruptedException {
        Run run = start(definition, event, null);
        return await(run.runId(), null);
    }

    /**
     * Wait until a run reaches a terminal state.
     *
     * @param timeout Maximum wait, or null to wait indefinitely
     * @return The run as last recorded
     */
    public Run await(UUID runId, Duration timeout) throws InterruptedException {
        RunHandle handle = activeRuns.get(runId);
        if (handle != null) {
            if (timeout == null) {
                handle.done.await();
            } else {
                handle.done.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        }
        return getRun(runId);
    }

    public Run getRun(UUID runId) {
        return runRepository.findById(runId)
            .orElseThrow(() -> new NotFoundException("Run", runId.toString()));
    }

    /**
     * Cancel a run: pending jobs are cancelled and in-flight jobs are interrupted;
     * their environments are disposed as they unwind.
     *
     * @throws InvalidStateTransitionException if the run already finished
     */
    public void cancel(UUID runId, String reason) {
        Run run = getRun(runId);
        RunHandle handle = activeRuns.get(runId);
        if (run.isTerminal() || handle == null) {
            throw new InvalidStateTransitionException("Run", runId, run.state(), RunState.CANCELLED);
        }
        log.info("Cancelling run {}: {}", runId, reason);
        handle.cancel(reason);
    }

    public Set<UUID> activeRunIds() {
        return Set.copyOf(activeRuns.keySet());
    }

    /**
     * Wait for active runs to finish, cancel those still running at the deadline,
     * then stop the executors.
     *
     * @return Number of runs that had to be cancelled
     */
    public int shutdown(Duration gracePeriod) {
        long deadline = System.currentTimeMillis() + gracePeriod.toMillis();
        int cancelled = 0;
        for (RunHandle handle : activeRuns.values()) {
            long left = deadline - System.currentTimeMillis();
            try {
                if (left <= 0 || !handle.done.await(left, TimeUnit.MILLISECONDS)) {
                    handle.cancel("shutdown");
                    cancelled++;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handle.cancel("shutdown");
                cancelled++;
            }
        }
        runExecutor.shutdown();
        jobExecutor.shutdown();
        watchdog.shutdownNow();
        try {
            if (!runExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                runExecutor.shutdownNow();
            }
            if (!jobExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                jobExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            runExecutor.shutdownNow();
            jobExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        return cancelled;
    }

    // ========== Internal Methods ==========

    private void coordinate(WorkflowDefinition definition, JobGraph graph, UUID runId, RunHandle handle) {
        Run run = runRepository.update(runId, Run::withStarted);
        RunContext context = RunContext.of(run, definition, secretStore.resolve(definition.name()));

        try (var ctx = LoggingContext.forRun(runId, definition.name(), run.traceId())) {
            eventLog.record(runId, run.traceId(), RunEventType.RUN_STARTED, null, null,
                Map.of("jobs", graph.topologicalOrder()));
            log.info("Run {} started with {} jobs in {} levels", runId, graph.size(), graph.levels().size());

            for (List<String> level : graph.levels()) {
                if (handle.isCancelled()) {
                    break;
                }
                runLevel(level, graph, context, handle);
            }
            finish(runId, handle);
        } catch (RuntimeException e) {
            log.error("Run {} aborted by an internal error", runId, e);
            runRepository.update(runId, r -> r.isTerminal() ? r
                : r.withCompleted(RunState.FAILED, ERROR_INTERNAL, e.getMessage()));
            eventLog.record(runId, run.traceId(), RunEventType.RUN_FAILED, null, null,
                Map.of("errorCode", ERROR_INTERNAL, "errorMessage", String.valueOf(e.getMessage())));
        } finally {
            handle.markFinished();
            purgeArtifacts(runId);
            activeRuns.remove(runId);
            handle.done.countDown();
        }
    }

    private void runLevel(List<String> level, JobGraph graph, RunContext context, RunHandle handle) {
        UUID runId = context.runId();
        Map<String, Future<JobResult>> launched = new LinkedHashMap<>();
        Map<String, JobTask> tasks = new LinkedHashMap<>();

        for (String jobId : level) {
            JobDefinition job = graph.job(jobId);
            Run current = getRun(runId);
            String blocker = job.needs().stream()
                .filter(need -> current.job(need).state() != JobState.SUCCEEDED)
                .findFirst()
                .orElse(null);
            if (blocker != null) {
                skipJob(context, jobId, String.format("needs '%s' which ended %s",
                    blocker, current.job(blocker).state()));
                continue;
            }
            if (job.isConditional()) {
                try {
                    ExpressionScope scope = ExpressionScope.forJob(runId, jobId, job.effectiveRunsOn(),
                        context.event(), jobEnv(context, job), context.secrets());
                    if (!conditionEvaluator.evaluate(job.condition(), scope, "jobs." + jobId)) {
                        skipJob(context, jobId, "condition is false");
                        continue;
                    }
                } catch (ConfigurationException e) {
                    completeJob(context, JobResult.pending(jobId).withFailed(List.of(), null,
                        e.getErrorCode(), e.getMessage()));
                    continue;
                }
            }
            runRepository.update(runId, r -> r.withJob(r.job(jobId).withQueued()));
            JobTask task = new JobTask(runId, handle, () -> runJob(context, job, handle));
            tasks.put(jobId, task);
            launched.put(jobId, jobExecutor.submit(task));
        }
        handle.track(launched);

        for (Map.Entry<String, Future<JobResult>> entry : launched.entrySet()) {
            String jobId = entry.getKey();
            JobResult result;
            try {
                result = entry.getValue().get();
            } catch (CancellationException e) {
                awaitUnwind(jobId, tasks.get(jobId));
                result = getRun(runId).job(jobId).withCancelled(handle.reason());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                handle.cancel("coordinator interrupted");
                result = getRun(runId).job(jobId).withCancelled(handle.reason());
            } catch (ExecutionException e) {
                log.error("Job {} crashed", jobId, e.getCause());
                result = getRun(runId).job(jobId).withFailed(List.of(), null, ERROR_INTERNAL,
                    String.valueOf(e.getCause().getMessage()));
            }
            completeJob(context, result);
        }
        handle.untrack(launched.keySet());
    }

    private JobResult runJob(RunContext context, JobDefinition job, RunHandle handle) {
        UUID runId = context.runId();
        String jobId = job.jobId();
        try (var ctx = LoggingContext.forJob(runId, context.workflowName(), context.traceId(), jobId)) {
            Run run = runRepository.update(runId, r -> r.job(jobId).isTerminal() ? r
                : r.withJob(r.job(jobId).withRunning()));
            JobResult running = run.job(jobId);
            if (running.isTerminal() || handle.isCancelled()) {
                return running.isTerminal() ? running : running.withCancelled(handle.reason());
            }
            eventLog.record(runId, context.traceId(), RunEventType.JOB_STARTED, jobId, null,
                Map.of("runsOn", job.effectiveRunsOn(), "steps", job.steps().size()));

            Duration timeout = job.effectiveTimeout(defaultJobTimeout);
            Instant deadline = timeout != null ? Instant.now().plus(timeout) : null;
            JobWatchdog guard = new JobWatchdog(Thread.currentThread());
            ScheduledFuture<?> timer = timeout != null
                ? watchdog.schedule(guard::expire, timeout.toMillis(), TimeUnit.MILLISECONDS)
                : null;

            try (ExecutionEnvironment environment = provisioner.provision(job.effectiveRunsOn(), runId, jobId)) {
                JobExecution execution = new JobExecution(context, job, environment, eventLog, deadline);
                List<StepResult> steps;
                try {
                    steps = stepRunner.run(execution);
                } catch (InterruptedException e) {
                    if (guard.expired()) {
                        log.warn("Job {} exceeded its time budget of {}", jobId, timeout);
                        return running.withFailed(List.of(), null, JobResult.ERROR_JOB_TIMEOUT,
                            "Job exceeded its time budget of " + timeout);
                    }
                    return running.withCancelled(handle.reason());
                }

                StepResult failed = steps.stream().filter(StepResult::isFatal).findFirst().orElse(null);
                if (failed == null) {
                    return running.withSucceeded(steps, execution.artifacts(), execution.cacheKeys());
                }
                String code = JobResult.ERROR_JOB_TIMEOUT.equals(failed.errorCode())
                    ? JobResult.ERROR_JOB_TIMEOUT : JobResult.ERROR_STEP_FAILED;
                return running.withFailed(steps, failed.stepId(), code,
                    String.format("Step '%s' failed: [%s] %s", failed.stepId(), failed.errorCode(),
                        failed.errorMessage()));
            } catch (PipelineException e) {
                log.error("Job {} could not run: {}", jobId, e.getMessage());
                return running.withFailed(List.of(), null, e.getErrorCode(), e.getMessage());
            } finally {
                if (timer != null) {
                    timer.cancel(false);
                }
                guard.finish();
            }
        }
    }

    /**
     * A cancelled job's thread may still be inside an action that ignores interrupts.
     * Wait for it so that nothing it writes outlives the run's artifact purge.
     */
    private void awaitUnwind(String jobId, JobTask task) {
        try {
            if (!task.awaitExit(CANCEL_GRACE)) {
                log.warn("Job {} still running {} after cancellation; its artifacts are purged when it exits",
                    jobId, CANCEL_GRACE);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void purgeArtifacts(UUID runId) {
        int purged = artifactStore.purge(runId);
        if (purged > 0) {
            log.debug("Purged {} artifacts of run {}", purged, runId);
        }
    }

    private void skipJob(RunContext context, String jobId, String reason) {
        log.info("Skipping job {}: {}", jobId, reason);
        completeJob(context, getRun(context.runId()).job(jobId).withSkipped(reason));
    }

    private void completeJob(RunContext context, JobResult result) {
        UUID runId = context.runId();
        runRepository.update(runId, r -> r.withJob(result));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("state", result.state().name());
        if (result.startedAt() != null && result.completedAt() != null) {
            payload.put("durationMs", Duration.between(result.startedAt(), result.completedAt()).toMillis());
        }
        if (result.failedStepId() != null) {
            payload.put("failedStepId", result.failedStepId());
        }
        if (result.errorCode() != null) {
            payload.put("errorCode", result.errorCode());
        }
        if (result.errorMessage() != null) {
            payload.put("reason", result.errorMessage());
        }
        if (!result.artifacts().isEmpty()) {
            payload.put("artifacts", result.artifacts());
        }

        RunEventType type = switch (result.state()) {
            case SUCCEEDED -> RunEventType.JOB_SUCCEEDED;
            case SKIPPED -> RunEventType.JOB_SKIPPED;
            case CANCELLED -> RunEventType.JOB_CANCELLED;
            default -> JobResult.ERROR_JOB_TIMEOUT.equals(result.errorCode())
                ? RunEventType.JOB_TIMED_OUT : RunEventType.JOB_FAILED;
        };
        eventLog.record(runId, context.traceId(), type, result.jobId(), null, payload);

        if (result.state() == JobState.FAILED) {
            log.warn("Job {} failed: {}", result.jobId(), result.errorMessage());
        } else {
            log.info("Job {} ended {}", result.jobId(), result.state());
        }
    }

    private void finish(UUID runId, RunHandle handle) {
        Run run = getRun(runId);
        if (handle.isCancelled()) {
            for (JobResult job : run.jobs().values()) {
                if (!job.isTerminal()) {
                    run = runRepository.update(runId, r -> r.withJob(r.job(job.jobId()).withCancelled(handle.reason())));
                }
            }
        }

        RunState finalState = outcome(run, handle.isCancelled());
        String code = null;
        String message = null;
        if (finalState == RunState.FAILED) {
            code = JobResult.ERROR_STEP_FAILED;
            message = "Failed jobs: " + run.jobs().values().stream()
                .filter(j -> j.state() == JobState.FAILED).map(JobResult::jobId).toList();
        } else if (finalState == RunState.CANCELLED) {
            code = ERROR_CANCELLED;
            message = handle.reason();
        }
        String finalCode = code;
        String finalMessage = message;
        Run completed = runRepository.update(runId, r -> r.withCompleted(finalState, finalCode, finalMessage));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("state", finalState.name());
        payload.put("durationMs", Duration.between(completed.startedAt(), completed.completedAt()).toMillis());
        if (finalMessage != null) {
            payload.put("reason", finalMessage);
        }
        RunEventType type = switch (finalState) {
            case FAILED -> RunEventType.RUN_FAILED;
            case CANCELLED -> RunEventType.RUN_CANCELLED;
            case SKIPPED -> RunEventType.RUN_SKIPPED;
            default -> RunEventType.RUN_COMPLETED;
        };
        eventLog.record(runId, completed.traceId(), type, null, null, payload);
        log.info("Run {} ended {}", runId, finalState);
    }

    /**
     * FAILED if any job failed, SKIPPED if every job was skipped, otherwise SUCCESS.
     */
    static RunState outcome(Run run, boolean cancelled) {
        if (cancelled) {
            return RunState.CANCELLED;
        }
        boolean anyFailed = run.jobs().values().stream().anyMatch(j -> j.state() == JobState.FAILED);
        if (anyFailed) {
            return RunState.FAILED;
        }
        boolean allSkipped = run.jobs().values().stream().allMatch(j -> j.state() == JobState.SKIPPED);
        return allSkipped ? RunState.SKIPPED : RunState.SUCCESS;
    }

    private static Map<String, String> jobEnv(RunContext context, JobDefinition job) {
        Map<String, String> env = new LinkedHashMap<>(context.env());
        env.putAll(job.env());
        return env;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Cancellation flag and in-flight job futures of one run.
     */
    private static final class RunHandle {
        private final UUID runId;
        private final CountDownLatch done = new CountDownLatch(1);
        private final Map<String, Future<JobResult>> inFlight = new ConcurrentHashMap<>();
        private volatile String cancelReason;
        private volatile boolean finished;

        RunHandle(UUID runId) {
            this.runId = runId;
        }

        void markFinished() {
            finished = true;
        }

        boolean isFinished() {
            return finished;
        }

        synchronized void cancel(String reason) {
            if (cancelReason == null) {
                cancelReason = reason != null ? reason : "cancelled";
            }
            inFlight.forEach((jobId, future) -> {
                if (future.cancel(true)) {
                    log.debug("Interrupted job {} of run {}", jobId, runId);
                }
            });
        }

        synchronized void track(Map<String, Future<JobResult>> futures) {
            inFlight.putAll(futures);
            if (cancelReason != null) {
                futures.values().forEach(f -> f.cancel(true));
            }
        }

        void untrack(Set<String> jobIds) {
            jobIds.forEach(inFlight::remove);
        }

        boolean isCancelled() {
            return cancelReason != null;
        }

        String reason() {
            return cancelReason;
        }
    }

    /**
     * One submitted job. A task cancelled before it starts never runs its body;
     * one that exits after its run finished purges what it left in the artifact store.
     */
    private final class JobTask implements Callable<JobResult> {
        private final UUID runId;
        private final RunHandle handle;
        private final Callable<JobResult> body;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CountDownLatch exited = new CountDownLatch(1);

        JobTask(UUID runId, RunHandle handle, Callable<JobResult> body) {
            this.runId = runId;
            this.handle = handle;
            this.body = body;
        }

        @Override
        public JobResult call() throws Exception {
            if (!claimed.compareAndSet(false, true)) {
                return null;
            }
            try {
                return body.call();
            } finally {
                exited.countDown();
                if (handle.isFinished()) {
                    purgeArtifacts(runId);
                }
            }
        }

        boolean awaitExit(Duration timeout) throws InterruptedException {
            if (claimed.compareAndSet(false, true)) {
                return true;
            }
            return exited.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Interrupts a job thread when its time budget runs out, unless the job already finished.
     */
    private static final class JobWatchdog {
        private final Thread thread;
        private boolean finished;
        private boolean expired;

        JobWatchdog(Thread thread) {
            this.thread = thread;
        }

        synchronized void expire() {
            if (!finished) {
                expired = true;
                thread.interrupt();
            }
        }

        synchronized boolean expired() {
            return expired;
        }

        synchronized void finish() {
            finished = true;
            // Clear an interrupt that arrived after the last step, so the pooled thread starts clean
            Thread.interrupted();
        }
    }
}
