package com.pipeline.core.trigger;

import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.RepositoryEvent;
import com.pipeline.core.model.TriggerSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TriggerEvaluatorTest {

    private final TriggerEvaluator evaluator = new TriggerEvaluator();

    private final TriggerSpec mainOnly = TriggerSpec.builder()
        .events(Set.of("push", "pull_request"))
        .branches(List.of("main"))
        .pathsIgnore(List.of("**.md", "docs/**"))
        .manualDispatch(true)
        .build();

    @Test
    @DisplayName("push to main touching source starts a run")
    void pushToMain_shouldBeAccepted() {
        RepositoryEvent event = push("refs/heads/main", List.of("src/App.js"), "fix header");

        assertThat(evaluator.evaluate(event, mainOnly).accepted()).isTrue();
    }

    @Test
    void pushToFeatureBranch_shouldBeRejected() {
        RepositoryEvent event = push("refs/heads/feature/x", List.of("src/App.js"), "wip");

        TriggerDecision decision = evaluator.evaluate(event, mainOnly);

        assertThat(decision.accepted()).isFalse();
        assertThat(decision.reason()).contains("feature/x");
    }

    @Test
    void pushTouchingOnlyIgnoredPaths_shouldBeRejected() {
        RepositoryEvent event = push("refs/heads/main", List.of("README.md", "docs/setup.md"), "docs");

        assertThat(evaluator.evaluate(event, mainOnly).accepted()).isFalse();
    }

    @Test
    @DisplayName("push to feature/x touching only README.md passes the branch glob and is then rejected by paths-ignore")
    void pushToMatchedFeatureBranch_onlyIgnoredPath_shouldBeRejectedByPathsIgnore() {
        TriggerSpec spec = TriggerSpec.builder()
            .branches(List.of("main", "feature/*"))
            .pathsIgnore(List.of("README.md"))
            .build();
        RepositoryEvent event = push("feature/x", List.of("README.md"), "update readme");

        TriggerDecision decision = evaluator.evaluate(event, spec);

        assertThat(decision.accepted()).isFalse();
        assertThat(decision.reason()).contains("paths-ignore").doesNotContain("branch filter");
        assertThat(evaluator.evaluate(push("feature/x", List.of("src/Cart.js"), "cart"), spec).accepted()).isTrue();
    }

    @Test
    void pushTouchingIgnoredAndSourcePaths_shouldBeAccepted() {
        RepositoryEvent event = push("refs/heads/main", List.of("README.md", "src/index.js"), "both");

        assertThat(evaluator.evaluate(event, mainOnly).accepted()).isTrue();
    }

    @Test
    void skipMarker_shouldRejectRegardlessOfCase() {
        RepositoryEvent event = push("refs/heads/main", List.of("src/App.js"), "bump version [SKIP CI]");

        TriggerDecision decision = evaluator.evaluate(event, mainOnly);

        assertThat(decision.accepted()).isFalse();
        assertThat(decision.reason()).contains("skip marker");
    }

    @Test
    void skipMarker_shouldAlsoRejectManualDispatch() {
        RepositoryEvent event = RepositoryEvent.builder()
            .kind(EventKind.MANUAL_DISPATCH)
            .ref("main")
            .commitMessage("[skip ci]")
            .build();

        assertThat(evaluator.evaluate(event, mainOnly).accepted()).isFalse();
    }

    @Test
    void manualDispatch_shouldBypassBranchFilter_whenEnabled() {
        RepositoryEvent event = RepositoryEvent.builder()
            .kind(EventKind.MANUAL_DISPATCH)
            .ref("refs/heads/experiment")
            .build();

        assertThat(evaluator.evaluate(event, mainOnly).accepted()).isTrue();

        TriggerSpec noDispatch = TriggerSpec.builder().branches(List.of("main")).build();
        assertThat(evaluator.evaluate(event, noDispatch).accepted()).isFalse();
    }

    @Test
    void pullRequest_shouldFilterOnBaseBranch() {
        RepositoryEvent event = RepositoryEvent.builder()
            .kind(EventKind.PULL_REQUEST_OPENED)
            .ref("refs/heads/feature/login")
            .baseRef("refs/heads/main")
            .changeRequestNumber(7)
            .changedPaths(List.of("src/Login.js"))
            .build();

        assertThat(evaluator.evaluate(event, mainOnly).accepted()).isTrue();
    }

    @Test
    void unsubscribedEvent_shouldBeRejected() {
        TriggerSpec pushOnly = TriggerSpec.builder().events(Set.of("push")).build();
        RepositoryEvent event = RepositoryEvent.builder()
            .kind(EventKind.PULL_REQUEST_SYNCHRONIZED)
            .ref("feature")
            .baseRef("main")
            .build();

        assertThat(evaluator.evaluate(event, pushOnly).accepted()).isFalse();
    }

    @Test
    void emptyBranchList_shouldAcceptAnyBranch() {
        TriggerSpec anyBranch = TriggerSpec.builder().build();

        assertThat(evaluator.evaluate(push("refs/heads/anything", List.of(), "x"), anyBranch).accepted()).isTrue();
    }

    private static RepositoryEvent push(String ref, List<String> paths, String message) {
        return RepositoryEvent.builder()
            .kind(EventKind.PUSH)
            .repository("acme/web")
            .ref(ref)
            .commitSha("abc123")
            .changedPaths(paths)
            .commitMessage(message)
            .build();
    }
}
