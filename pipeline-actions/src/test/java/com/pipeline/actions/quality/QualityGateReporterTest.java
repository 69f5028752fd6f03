package com.pipeline.actions.quality;

import com.pipeline.core.exception.AnalysisServiceUnavailableException;
import com.pipeline.core.model.EventKind;
import com.pipeline.core.model.QualityReport;
import com.pipeline.core.model.QualityStatus;
import com.pipeline.core.model.RepositoryEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class QualityGateReporterTest {

    @TempDir
    Path codeTree;

    private final AnalysisProject project = new AnalysisProject("acme_web", "acme", "src");
    private LoggingChangeRequestReporter changeRequests;
    private QualityGateReporter reporter;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(codeTree.resolve("src"));
        changeRequests = new LoggingChangeRequestReporter();
        reporter = new QualityGateReporter(new RuleBasedAnalysisService(), changeRequests);
    }

    @Nested
    @DisplayName("analyze")
    class Analyze {

        @Test
        void cleanTree_shouldPass() throws Exception {
            Files.writeString(codeTree.resolve("src/App.js"), "export default function App() { return null; }\n");

            QualityReport report = reporter.analyze(codeTree, project, "main", null);

            assertThat(report.passed()).isTrue();
            assertThat(report.findings()).isEmpty();
        }

        @Test
        void newDebugOutput_shouldFail() throws Exception {
            Files.writeString(codeTree.resolve("src/App.js"), "console.log('here');\n");

            QualityReport report = reporter.analyze(codeTree, project, "feature/x", null);

            assertThat(report.status()).isEqualTo(QualityStatus.FAILED);
            assertThat(report.findings()).extracting("rule").containsExactly(RuleBasedAnalysisService.RULE_DEBUG_OUTPUT);
        }

        @Test
        void findingsInBaseline_shouldBePreExistingAndNotFail() throws Exception {
            Files.writeString(codeTree.resolve("src/App.js"), "console.log('here');\n");
            QualityReport baseline = reporter.analyze(codeTree, project, "main", null);

            Files.writeString(codeTree.resolve("src/App.js"), "// header\nconsole.log('here');\n");
            QualityReport report = reporter.analyze(codeTree, project, "feature/x", baseline);

            assertThat(report.passed()).isTrue();
            assertThat(report.findings()).allMatch(f -> f.preExisting());
        }

        @Test
        void unavailableService_shouldYieldIndeterminate() {
            QualityGateReporter offline = new QualityGateReporter((tree, p) -> {
                throw new AnalysisServiceUnavailableException("service down");
            }, changeRequests);

            QualityReport report = offline.analyze(codeTree, project, "main", null);

            assertThat(report.status()).isEqualTo(QualityStatus.INDETERMINATE);
            assertThat(report.passed()).isFalse();
        }

        @Test
        void dependencyDirectories_shouldBeIgnored() throws Exception {
            Files.createDirectories(codeTree.resolve("src/node_modules/lib"));
            Files.writeString(codeTree.resolve("src/node_modules/lib/index.js"), "console.log('vendor');\n");

            assertThat(reporter.analyze(codeTree, project, "main", null).findings()).isEmpty();
        }
    }

    @Test
    void report_shouldOnlyPostForPullRequests() {
        QualityReport report = QualityReport.of("acme_web", "feature/x", java.util.List.of());
        RepositoryEvent pr = RepositoryEvent.builder()
            .kind(EventKind.PULL_REQUEST_OPENED).repository("acme/web").ref("feature/x").baseRef("main")
            .changeRequestNumber(42).build();
        RepositoryEvent push = RepositoryEvent.builder().kind(EventKind.PUSH).ref("main").build();

        assertThat(reporter.report(pr, report)).isTrue();
        assertThat(reporter.report(push, report)).isFalse();
        assertThat(changeRequests.getPosted()).singleElement()
            .satisfies(p -> assertThat(p.changeRequestNumber()).isEqualTo(42));
    }

    @Test
    void record_shouldKeepBaselinePerBranch() {
        QualityReport report = QualityReport.of("acme_web", "main", java.util.List.of());

        reporter.record(report);

        assertThat(reporter.baselineFor("acme_web", "main")).contains(report);
        assertThat(reporter.baselineFor("acme_web", "develop")).isEmpty();
    }

    @Test
    void load_shouldReadProjectProperties() throws Exception {
        Path file = codeTree.resolve(AnalysisProject.DEFAULT_FILE);
        Files.writeString(file, "projectKey=acme_web\norganization=acme\nsources=src\n");

        AnalysisProject loaded = AnalysisProject.load(file);

        assertThat(loaded).isEqualTo(project);
    }
}
