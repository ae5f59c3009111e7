package com.hostscout.core.service;

import com.hostscout.core.api.IVerifier;
import com.hostscout.core.crawler.MapFetcher;
import com.hostscout.core.crawler.politeness.HostPolicyCache;
import com.hostscout.core.crawler.politeness.PolitenessClock;
import com.hostscout.core.crawler.politeness.PolitenessGate;
import com.hostscout.core.model.CanonicalEntity;
import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.service.export.JsonEntitySink;
import com.hostscout.core.service.export.SinkCoordinator;
import com.hostscout.core.sources.StaticSeedSource;
import com.hostscout.core.util.ProgressListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiscoveryService: 크롤 → 검증 → 병합 → 저장")
class DiscoveryServiceTest {

    @TempDir Path tmp;

    private CrawlConfig config() {
        CrawlConfig cfg = new CrawlConfig().setFingerprint("myshopify.com").setConcurrency(2);
        cfg.output().setDir(tmp).setBaseName("shops");
        cfg.retry().setAttemptBudget(1);
        return cfg;
    }

    private static PolitenessGate gate() {
        return new PolitenessGate(null, new HostPolicyCache(), PolitenessClock.SYSTEM, Duration.ZERO, 0);
    }

    private static MapFetcher pages() {
        return new MapFetcher()
                .html("https://a.test/", "<a href=\"https://one.myshopify.com\">1</a>")
                .html("https://b.test/", "<p>two.myshopify.com, three.myshopify.com</p>");
    }

    private DiscoveryService service(CrawlConfig cfg, IVerifier verifier) {
        return new DiscoveryService(cfg, pages(), gate(),
                List.of(new StaticSeedSource("seeds", List.of("https://a.test/", "https://b.test/"))),
                verifier, SinkCoordinator.fromConfig(cfg.output()), d -> {});
    }

    @Test
    void crawls_and_exports() throws Exception {
        CrawlConfig cfg = config();
        DiscoveryService.Result r = service(cfg, null).run(ProgressListener.NONE);

        assertThat(r.exported().keys()).containsExactlyInAnyOrder("one", "two", "three");
        assertThat(r.verifiedOut()).isZero();
        assertThat(JsonEntitySink.load(cfg.output().jsonPath()).keys())
                .containsExactlyInAnyOrder("one", "two", "three");
        assertThat(cfg.output().csvPath()).exists();
    }

    @Test
    @DisplayName("검증기가 거부하거나 예외를 던진 엔티티는 빠진다")
    void verifier_filters_entities() throws Exception {
        IVerifier v = e -> {
            if (e.key().equals("three")) throw new IllegalStateException("boom");
            return !e.key().equals("two");
        };
        DiscoveryService.Result r = service(config(), v).run(null);

        assertThat(r.exported().keys()).containsExactly("one");
        assertThat(r.verifiedOut()).isEqualTo(2);
        assertThat(r.report().getEntities().size()).isEqualTo(3);
    }

    @Test
    @DisplayName("mergeExisting 이면 이전 산출물과 합친다")
    void merges_previous_results() throws Exception {
        CrawlConfig cfg = config();
        cfg.output().setMergeExisting(true);
        new JsonEntitySink(cfg.output().jsonPath()).write(Set.of(
                new CanonicalEntity("old", URI.create("https://old.myshopify.com")),
                new CanonicalEntity("one", URI.create("https://stale.example"))));

        DiscoveryService.Result r = service(cfg, null).run(ProgressListener.NONE);

        assertThat(r.exported().keys()).containsExactlyInAnyOrder("old", "one", "two", "three");
        assertThat(r.mergedFromPrevious()).isEqualTo(1);
        assertThat(r.exported().get("one").orElseThrow().uri()).isEqualTo(URI.create("https://one.myshopify.com"));
    }
}
