package com.pipeline.engine.loader;

import com.pipeline.core.exception.ConfigurationException;
import com.pipeline.core.model.JobDefinition;
import com.pipeline.core.model.StepDefinition;
import com.pipeline.core.model.TriggerSpec;
import com.pipeline.core.model.WorkflowDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowLoaderTest {

    private static final String DEPLOY_PAGES = """
        name: deploy-pages
        on:
          push:
            branches: [main]
            paths-ignore: ['docs/**', '*.md']
          workflow_dispatch: {}
        permissions:
          contents: read
          pages: write
        env:
          NODE_VERSION: 18
        jobs:
          build:
            runs-on: ubuntu-22.04
            timeout-minutes: 15
            steps:
              - name: Install
                run: npm ci
              - id: bundle
                run: npm run build
                continue-on-error: false
              - uses: upload-artifact
                with:
                  name: site
                  path: build
          deploy:
            needs: build
            if: event.branch == 'main'
            environment:
              name: github-pages
              url: https://pages.example.test
            steps:
              - uses: deploy
                with:
                  artifact: site
        """;

    @TempDir
    Path tempDir;

    private final WorkflowLoader loader = new WorkflowLoader();

    @Test
    void parse_fullWorkflow_shouldMapEveryField() {
        WorkflowDefinition definition = loader.parse(DEPLOY_PAGES, "fallback");

        assertThat(definition.name()).isEqualTo("deploy-pages");
        assertThat(definition.env()).containsEntry("NODE_VERSION", "18");
        assertThat(definition.grantsWrite("pages")).isTrue();
        assertThat(definition.grantsWrite("contents")).isFalse();

        TriggerSpec trigger = definition.trigger();
        assertThat(trigger.events()).containsExactlyInAnyOrder("push", "workflow_dispatch");
        assertThat(trigger.branches()).containsExactly("main");
        assertThat(trigger.pathsIgnore()).containsExactly("docs/**", "*.md");
        assertThat(trigger.manualDispatch()).isTrue();
        assertThat(trigger.skipMarker()).isEqualTo(TriggerSpec.DEFAULT_SKIP_MARKER);

        JobDefinition build = definition.getJob("build");
        assertThat(build.runsOn()).isEqualTo("ubuntu-22.04");
        assertThat(build.timeout()).isEqualTo(Duration.ofMinutes(15));
        assertThat(build.steps()).extracting(StepDefinition::stepId).containsExactly("step-1", "bundle", "step-3");
        assertThat(build.steps().get(0).displayName()).isEqualTo("Install");
        assertThat(build.steps().get(2).with()).containsEntry("name", "site").containsEntry("path", "build");

        JobDefinition deploy = definition.getJob("deploy");
        assertThat(deploy.needs()).containsExactly("build");
        assertThat(deploy.condition()).isEqualTo("event.branch == 'main'");
        assertThat(deploy.environment()).isEqualTo("github-pages");
        assertThat(deploy.effectiveRunsOn()).isEqualTo(JobDefinition.DEFAULT_RUNS_ON);
    }

    @Test
    void parse_eventList_shouldSubscribeWithoutFilters() {
        WorkflowDefinition definition = loader.parse("""
            on: [push, pull_request]
            skip-marker: "[no ci]"
            jobs:
              test:
                steps:
                  - run: npm test
            """, "ci");

        assertThat(definition.name()).isEqualTo("ci");
        assertThat(definition.trigger().events()).containsExactlyInAnyOrder("push", "pull_request");
        assertThat(definition.trigger().branches()).isEmpty();
        assertThat(definition.trigger().manualDispatch()).isFalse();
        assertThat(definition.trigger().skipMarker()).isEqualTo("[no ci]");
    }

    @Test
    void parse_singleEventAndScalarNeeds_shouldBeAccepted() {
        WorkflowDefinition definition = loader.parse("""
            on: pull_request
            jobs:
              lint:
                steps:
                  - run: npm run lint
              test:
                needs: lint
                environment: preview
                steps:
                  - run: npm test
            """, "pr");

        assertThat(definition.trigger().events()).containsExactly("pull_request");
        assertThat(definition.getJob("test").needs()).containsExactly("lint");
        assertThat(definition.getJob("test").environment()).isEqualTo("preview");
    }

    @Test
    void parse_unsupportedEvent_shouldFail() {
        assertThatThrownBy(() -> loader.parse("""
            on: schedule
            jobs:
              nightly:
                steps:
                  - run: echo hi
            """, "nightly"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("on.schedule");
    }

    @Test
    void parse_invalidYaml_shouldFailWithConfigurationError() {
        assertThatThrownBy(() -> loader.parse("jobs: [unclosed", "broken"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("not valid YAML");
    }

    @Test
    void parse_badTimeout_shouldNameTheField() {
        assertThatThrownBy(() -> loader.parse("""
            jobs:
              build:
                timeout-minutes: soon
                steps:
                  - run: make
            """, "build"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("jobs.build.timeout-minutes");
    }

    @Test
    void parse_malformedBranchGlob_shouldNameTheEventFilter() {
        assertThatThrownBy(() -> loader.parse("""
            on:
              push:
                branches: [main, "release/["]
            jobs:
              build:
                steps:
                  - run: make
            """, "release"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("on.push.branches")
            .hasMessageContaining("release/[");
    }

    @Test
    void loadDirectory_shouldReadYamlFilesInNameOrder() throws Exception {
        Files.writeString(tempDir.resolve("b-release.yaml"), "jobs:\n  r:\n    steps:\n      - run: echo r\n");
        Files.writeString(tempDir.resolve("a-ci.yml"), "jobs:\n  c:\n    steps:\n      - run: echo c\n");
        Files.writeString(tempDir.resolve("README.md"), "# workflows");

        assertThat(loader.loadDirectory(tempDir)).extracting(WorkflowDefinition::name)
            .containsExactly("a-ci", "b-release");
        assertThat(loader.loadDirectory(tempDir.resolve("missing"))).isEmpty();
    }
}
