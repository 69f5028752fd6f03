package com.pipeline.engine.step;

import com.pipeline.actions.ActionContext;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.RunContext;
import com.pipeline.core.model.RunEventType;
import com.pipeline.engine.environment.ExecutionEnvironment;
import com.pipeline.engine.history.RunEventLog;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one job while its steps run: the provisioned environment, the run log,
 * the deadline, and the artifacts and cache keys produced so far (including by
 * nested composite steps). Used by a single thread.
 */
public class JobExecution {

    private final RunContext run;
    private final JobDefinition job;
    private final ExecutionEnvironment environment;
    private final RunEventLog eventLog;
    private final Instant deadline;
    private final List<String> artifacts = new ArrayList<>();
    private final List<String> cacheKeys = new ArrayList<>();

    public JobExecution(RunContext run, JobDefinition job, ExecutionEnvironment environment,
                        RunEventLog eventLog, Instant deadline) {
        this.run = run;
        this.job = job;
        this.environment = environment;
        this.eventLog = eventLog;
        this.deadline = deadline;
    }

    public RunContext run() {
        return run;
    }

    public JobDefinition job() {
        return job;
    }

    public ExecutionEnvironment environment() {
        return environment;
    }

    /**
     * Time left before the job's deadline, or null if the job has none.
     */
    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void record(RunEventType type, String stepId, Object payload) {
        eventLog.record(run.runId(), run.traceId(), type, job.jobId(), stepId, payload);
    }

    /**
     * Recorder handed to actions of the given step.
     */
    public ActionContext.RunRecorder recorderFor(String stepId) {
        return (type, payload) -> eventLog.append(run.runId(), run.traceId(), type, job.jobId(), stepId, payload);
    }

    void addArtifacts(List<String> names) {
        artifacts.addAll(names);
    }

    void addCacheKeys(List<String> keys) {
        cacheKeys.addAll(keys);
    }

    public List<String> artifacts() {
        return List.copyOf(artifacts);
    }

    public List<String> cacheKeys() {
        return List.copyOf(cacheKeys);
    }
}
