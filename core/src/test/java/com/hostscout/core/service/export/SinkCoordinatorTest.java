package com.hostscout.core.service.export;

import com.hostscout.core.api.ISink;
import com.hostscout.core.model.CanonicalEntity;
import com.hostscout.core.model.CrawlConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SinkCoordinatorTest {

    @TempDir Path tmp;

    private static final Set<CanonicalEntity> ONE =
            Set.of(new CanonicalEntity("a", URI.create("https://a.myshopify.com")));

    @Test
    void from_config_builds_json_and_csv() throws Exception {
        CrawlConfig.Output out = new CrawlConfig().output().setDir(tmp).setBaseName("found");
        SinkCoordinator sc = SinkCoordinator.fromConfig(out);

        assertThat(sc.sinks()).extracting(ISink::name).containsExactly("json", "csv");
        sc.writeAll(ONE);
        assertThat(Files.exists(tmp.resolve("found.json"))).isTrue();
        assertThat(Files.exists(tmp.resolve("found.csv"))).isTrue();
    }

    @Test
    void one_failing_sink_does_not_stop_the_others() {
        List<String> wrote = new ArrayList<>();
        ISink broken = new ISink() {
            @Override public String name() { return "broken"; }
            @Override public void write(Set<CanonicalEntity> entities) throws IOException {
                throw new IOException("disk full");
            }
        };
        ISink ok = new ISink() {
            @Override public String name() { return "ok"; }
            @Override public void write(Set<CanonicalEntity> entities) { wrote.add("ok:" + entities.size()); }
        };

        SinkCoordinator sc = new SinkCoordinator(List.of(broken, ok));
        assertThatThrownBy(() -> sc.writeAll(ONE)).isInstanceOf(IOException.class).hasMessage("disk full");
        assertThat(wrote).containsExactly("ok:1");
    }

    @Test
    void runtime_failure_is_wrapped() {
        ISink boom = new ISink() {
            @Override public String name() { return "boom"; }
            @Override public void write(Set<CanonicalEntity> entities) { throw new IllegalStateException("x"); }
        };
        assertThatThrownBy(() -> new SinkCoordinator(List.of(boom)).writeAll(ONE))
                .isInstanceOf(IOException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
