package com.hostscout.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CrawlConfigTest {

    @Test
    void defaultsAreValid() {
        CrawlConfig cfg = CrawlConfig.defaults();
        cfg.validate();

        assertThat(cfg.getFingerprint()).isEqualTo("myshopify.com");
        assertThat(cfg.getReservedWords()).contains("www", "admin", "cdn");
        assertThat(cfg.getConcurrency()).isEqualTo(5);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getTimeoutMs()).isEqualTo(10_000L);
        assertThat(cfg.getRps()).isEqualTo(10);
        assertThat(cfg.scope().perQueryBudget()).isEqualTo(100L);
        assertThat(cfg.scope().getMaxFrontierSize()).isEqualTo(10_000);
        assertThat(cfg.politeness().minHostInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(cfg.output().jsonPath()).isEqualTo(Path.of("out", "hostscout.json"));
        assertThat(cfg.output().getFormats()).containsExactly("json", "csv");
    }

    @Test
    void fingerprintIsNormalizedAndMustLookLikeHostSuffix() {
        CrawlConfig cfg = CrawlConfig.defaults().setFingerprint("  Shop.Example.COM ");
        assertThat(cfg.getFingerprint()).isEqualTo("shop.example.com");

        assertThatThrownBy(() -> CrawlConfig.defaults().setFingerprint("localhost").validate())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fingerprint");
    }

    @Test
    void setConcurrencyHasLowerBoundOne() {
        CrawlConfig cfg = CrawlConfig.defaults().setConcurrency(0);
        assertThat(cfg.getConcurrency()).isEqualTo(1);
        cfg.validate();
    }

    @Test
    void setTimeoutMsClampsToPositive() {
        CrawlConfig cfg = CrawlConfig.defaults().setTimeoutMs(-5);
        assertThat(cfg.getTimeoutMs()).isEqualTo(1L);
        cfg.validate();
    }

    @Test
    void validateRejectsBadNumbersAndFormats() {
        assertThatThrownBy(() -> { CrawlConfig c = CrawlConfig.defaults(); c.retry().setAttemptBudget(0); c.validate(); })
                .hasMessageContaining("attemptBudget");
        assertThatThrownBy(() -> { CrawlConfig c = CrawlConfig.defaults(); c.scope().setEmptyPageLimit(0); c.validate(); })
                .hasMessageContaining("emptyPageLimit");
        assertThatThrownBy(() -> CrawlConfig.defaults().setRps(0).validate())
                .hasMessageContaining("rps");
        assertThatThrownBy(() -> { CrawlConfig c = CrawlConfig.defaults(); c.output().setFormats(List.of("xml")); c.validate(); })
                .hasMessageContaining("xml");
    }

    @Test
    void sourceValidationPerType() {
        CrawlConfig ok = CrawlConfig.defaults()
                .addSource(new CrawlConfig.SourceCfg().setName("s").setUrls(List.of("https://a.test/")));
        ok.validate();

        CrawlConfig noName = CrawlConfig.defaults()
                .addSource(new CrawlConfig.SourceCfg().setUrls(List.of("https://a.test/")));
        assertThatThrownBy(noName::validate).hasMessageContaining("sources[0].name");

        CrawlConfig noQueries = CrawlConfig.defaults()
                .addSource(new CrawlConfig.SourceCfg().setType(CrawlConfig.SourceType.SEARCH)
                        .setName("bing").setTemplate("https://b.test/?q={query}"));
        assertThatThrownBy(noQueries::validate).hasMessageContaining("queries");
    }
}
