package com.pipeline.actions.deploy;

import com.pipeline.core.exception.AuthorizationException;
import com.pipeline.core.model.Artifact;
import com.pipeline.core.model.Blob;
import com.pipeline.core.model.DeploymentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentPublisherTest {

    @TempDir
    Path hostingRoot;

    private CountingHostingTarget hosting;
    private DeploymentPublisher publisher;

    @BeforeEach
    void setUp() {
        hosting = new CountingHostingTarget(new DirectoryHostingTarget(hostingRoot, "https://pages.example.test"));
        publisher = new DeploymentPublisher(hosting,
            Map.of("github-pages", new EnvironmentPolicy("github-pages", List.of("main"))));
    }

    @Test
    void publish_twiceWithIdenticalContent_shouldTouchHostingOnce() {
        Artifact site = artifact("index.html", "<h1>v1</h1>");
        DeploymentAuthorization auth = authorized("main");

        DeploymentRecord first = publisher.publish("github-pages", site, auth);
        DeploymentRecord second = publisher.publish("github-pages", artifact("index.html", "<h1>v1</h1>"), auth);

        assertThat(first.noop()).isFalse();
        assertThat(second.noop()).isTrue();
        assertThat(second.url()).isEqualTo(first.url());
        assertThat(second.contentHash()).isEqualTo(first.contentHash());
        assertThat(hosting.publishes).isEqualTo(1);
        assertThat(publisher.getHistory()).hasSize(2);
        assertThat(hostingRoot.resolve("github-pages/index.html")).hasContent("<h1>v1</h1>");
    }

    @Test
    void publish_changedContent_shouldReplaceLiveContent() {
        DeploymentAuthorization auth = authorized("main");
        publisher.publish("github-pages", artifact("index.html", "v1"), auth);

        DeploymentRecord record = publisher.publish("github-pages", artifact("about.html", "v2"), auth);

        assertThat(record.noop()).isFalse();
        assertThat(hosting.publishes).isEqualTo(2);
        assertThat(hostingRoot.resolve("github-pages/index.html")).doesNotExist();
        assertThat(hostingRoot.resolve("github-pages/about.html")).hasContent("v2");
    }

    @Test
    void publish_withoutWritePermission_shouldBeDenied() {
        DeploymentAuthorization auth = new DeploymentAuthorization(UUID.randomUUID(), "main", false, "github-pages");

        assertThatThrownBy(() -> publisher.publish("github-pages", artifact("index.html", "x"), auth))
            .isInstanceOf(AuthorizationException.class)
            .hasMessageContaining("write");
        assertThat(hosting.publishes).isZero();
    }

    @Test
    void publish_fromDisallowedBranch_shouldBeDenied() {
        assertThatThrownBy(() -> publisher.publish("github-pages", artifact("index.html", "x"), authorized("feature/x")))
            .isInstanceOf(AuthorizationException.class)
            .hasMessageContaining("feature/x");
    }

    @Test
    void publish_toEnvironmentTheJobDidNotDeclare_shouldBeDenied() {
        DeploymentAuthorization auth = new DeploymentAuthorization(UUID.randomUUID(), "main", true, "staging");

        assertThatThrownBy(() -> publisher.publish("github-pages", artifact("index.html", "x"), auth))
            .isInstanceOf(AuthorizationException.class);
    }

    private static DeploymentAuthorization authorized(String branch) {
        return new DeploymentAuthorization(UUID.randomUUID(), branch, true, "github-pages");
    }

    private static Artifact artifact(String file, String content) {
        Blob blob = Blob.of(Map.of(file, content.getBytes(StandardCharsets.UTF_8)));
        return Artifact.create(UUID.randomUUID(), "site", blob, "build", false);
    }

    private static class CountingHostingTarget implements HostingTarget {
        private final HostingTarget delegate;
        private int publishes;

        CountingHostingTarget(HostingTarget delegate) {
            this.delegate = delegate;
        }

        @Override
        public String publish(String environment, Blob content) {
            publishes++;
            return delegate.publish(environment, content);
        }
    }
}
