package com.pipeline.engine.history;

import com.pipeline.actions.cache.CacheRestoreAction;
import com.pipeline.core.exception.NotFoundException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.JobState;
import com.pipeline.core.model.Run;
import com.pipeline.core.model.RunEventType;
import com.pipeline.core.model.RunState;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.StepOutcome;
import com.pipeline.core.model.WorkflowDefinition;
import com.pipeline.engine.environment.CommandResult;
import com.pipeline.engine.history.RunHistoryService.RunHistory;
import com.pipeline.engine.history.RunHistoryService.TimelineEntry;
import com.pipeline.engine.test.TestPipeline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static com.pipeline.engine.test.TestPipeline.action;
import static com.pipeline.engine.test.TestPipeline.push;
import static com.pipeline.engine.test.TestPipeline.shell;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunHistoryServiceTest {

    @TempDir
    Path tempDir;

    private TestPipeline pipeline;
    private RunHistoryService historyService;

    @BeforeEach
    void setUp() {
        pipeline = TestPipeline.create(tempDir);
        historyService = new RunHistoryService(pipeline.eventRepository(), pipeline.runRepository());
        pipeline.provisioner().on("npm test", (cmd, ws, env) ->
            CommandResult.failure(1, List.of("Tests: 1 failed, 41 passed")));
    }

    @AfterEach
    void tearDown() {
        pipeline.close();
    }

    @Test
    void getHistory_shouldSummarizeJobsAndSteps() throws Exception {
        Run run = pipeline.engine().execute(workflow(), push("main"));

        RunHistory history = historyService.getHistory(run.runId());

        assertThat(history.state()).isEqualTo(RunState.FAILED);
        assertThat(history.workflowName()).isEqualTo("ci");
        assertThat(history.jobs()).containsOnlyKeys("install", "test");
        assertThat(history.jobs().get("test").state()).isEqualTo(JobState.FAILED);
        assertThat(history.jobs().get("test").failedStepId()).isEqualTo("unit");
        assertThat(history.jobs().get("test").steps())
            .extracting(RunHistoryService.StepSummary::outcome)
            .containsExactly(StepOutcome.FAILURE, StepOutcome.SKIPPED);
        assertThat(history.jobs().get("test").steps().get(0).log()).contains("Tests: 1 failed, 41 passed");
    }

    @Test
    void getHistory_timelineShouldLeaveOutRoutineStepEvents() throws Exception {
        Run run = pipeline.engine().execute(workflow(), push("main"));

        RunHistory history = historyService.getHistory(run.runId());

        assertThat(history.timeline()).extracting(TimelineEntry::eventType)
            .doesNotContain(RunEventType.STEP_SUCCEEDED.name(), RunEventType.STEP_SKIPPED.name())
            .contains(RunEventType.STEP_FAILED.name(), RunEventType.RUN_FAILED.name());
        assertThat(history.timeline()).extracting(TimelineEntry::sequenceNumber).isSorted();
        assertThat(history.events().size()).isGreaterThan(history.timeline().size());
    }

    @Test
    void getHistory_statisticsShouldCountCacheLookups() throws Exception {
        Run run = pipeline.engine().execute(workflow(), push("main"));

        RunHistoryService.RunStatistics statistics = historyService.getHistory(run.runId()).statistics();

        assertThat(statistics.cacheMisses()).isEqualTo(1);
        assertThat(statistics.cacheHits()).isZero();
        assertThat(statistics.jobsByState()).containsEntry(JobState.SUCCEEDED, 1L).containsEntry(JobState.FAILED, 1L);
        assertThat(statistics.stepsByOutcome()).containsEntry(StepOutcome.FAILURE, 1L);
        assertThat(statistics.totalEvents()).isEqualTo(history(run).events().size());
    }

    @Test
    void getEvents_withTypes_shouldFilter() throws Exception {
        Run run = pipeline.engine().execute(workflow(), push("main"));

        assertThat(historyService.getEvents(run.runId(), List.of(RunEventType.JOB_STARTED)))
            .hasSize(2)
            .allMatch(e -> e.type() == RunEventType.JOB_STARTED);
        assertThat(historyService.getEvents(run.runId(), null)).hasSameSizeAs(history(run).events());
    }

    @Test
    void getHistory_unknownRun_shouldFailNotFound() {
        assertThatThrownBy(() -> historyService.getHistory(UUID.randomUUID()))
            .isInstanceOf(NotFoundException.class);
    }

    private RunHistory history(Run run) {
        return historyService.getHistory(run.runId());
    }

    private static WorkflowDefinition workflow() {
        return WorkflowDefinition.builder()
            .name("ci")
            .jobs(List.of(
                JobDefinition.builder().jobId("install")
                    .steps(List.of(
                        action("restore", CacheRestoreAction.NAME, Map.of("path", "node_modules")),
                        shell("npm ci")))
                    .build(),
                JobDefinition.builder().jobId("test").needs(Set.of("install"))
                    .steps(List.of(
                        StepDefinition.builder().stepId("unit").run("npm test").build(),
                        shell("npm run lint")))
                    .build()))
            .build();
    }
}
