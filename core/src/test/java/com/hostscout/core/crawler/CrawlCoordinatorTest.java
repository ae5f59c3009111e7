package com.hostscout.core.crawler;

import com.hostscout.core.api.ISourceProvider;
import com.hostscout.core.crawler.politeness.HostPolicyCache;
import com.hostscout.core.crawler.politeness.PolitenessClock;
import com.hostscout.core.crawler.politeness.PolitenessGate;
import com.hostscout.core.crawler.robots.RobotsFetcher;
import com.hostscout.core.crawler.robots.RobotsRepository;
import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.CrawlReport;
import com.hostscout.core.model.FetchStatus;
import com.hostscout.core.model.FetchedDocument;
import com.hostscout.core.model.FrontierItem;
import com.hostscout.core.model.RunState;
import com.hostscout.core.sources.NextLinkSource;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CrawlCoordinator: 시드부터 엔티티 집합까지")
class CrawlCoordinatorTest {

    /** a[rel=next] 는 다음 페이지, a.detail 은 하위 링크로 돌려주는 테스트 소스 */
    static final class PagerSource implements ISourceProvider {
        private final String name;
        private final List<String> seeds;

        PagerSource(String name, String... seeds) {
            this.name = name;
            this.seeds = List.of(seeds);
        }

        @Override public String name() { return name; }

        @Override public List<FrontierItem> seeds() {
            List<FrontierItem> out = new ArrayList<>();
            for (String s : seeds) out.add(FrontierItem.seed(URI.create(s), name + ":" + s));
            return out;
        }

        @Override public List<FrontierItem> nextLinksFrom(FetchedDocument page, FrontierItem item) {
            List<FrontierItem> out = new ArrayList<>();
            for (Element a : page.dom().select("a[rel=next]")) out.add(item.nextPage(URI.create(a.attr("abs:href"))));
            for (Element a : page.dom().select("a.detail")) out.add(item.child(URI.create(a.attr("abs:href"))));
            return out;
        }
    }

    private static CrawlConfig config(int emptyPageLimit) {
        CrawlConfig cfg = new CrawlConfig().setFingerprint("fingerprint.com").setConcurrency(1);
        cfg.scope().setEmptyPageLimit(emptyPageLimit).setMaxDepth(5).setMaxPagesPerQuery(5);
        cfg.retry().setAttemptBudget(1);
        return cfg;
    }

    private static PolitenessGate openGate() {
        return new PolitenessGate(null, new HostPolicyCache(), PolitenessClock.SYSTEM, Duration.ZERO, 0);
    }

    private static CrawlCoordinator coordinator(CrawlConfig cfg, MapFetcher fetcher) {
        return new CrawlCoordinator(cfg, fetcher, openGate(), d -> {});
    }

    @Test
    @DisplayName("빈 페이지 한도 1: 빈 2페이지에서 쿼리가 멈춰 3페이지는 가져오지 않는다")
    void stops_query_after_empty_page() {
        MapFetcher f = new MapFetcher()
                .html("https://dir.test/p1", "<p>foo.fingerprint.com</p><a rel=next href=\"/p2\">next</a>")
                .html("https://dir.test/p2", "<p>foo.fingerprint.com again</p><a rel=next href=\"/p3\">next</a>")
                .html("https://dir.test/p3", "<p>bar.fingerprint.com</p>");

        CrawlReport r = coordinator(config(1), f).run(List.of(new PagerSource("dir", "https://dir.test/p1")));

        assertThat(r.getState()).isEqualTo(RunState.EXHAUSTED);
        assertThat(r.getEntities().keys()).containsExactly("foo");
        assertThat(r.getEntities().get("foo").orElseThrow().uri()).isEqualTo(URI.create("https://foo.fingerprint.com"));
        assertThat(f.wasRequested("https://dir.test/p3")).isFalse();
        assertThat(r.getStats().processed).isEqualTo(2);
        assertThat(r.getStats().newEntities).isEqualTo(1);
    }

    @Test
    @DisplayName("1페이지 {foo, WWW} + 빈 2페이지, 한도 1: 2페이지 뒤에 멈추고 결과는 {foo}")
    void two_page_query_with_reserved_word() {
        MapFetcher f = new MapFetcher()
                .html("https://search.test/a/1",
                        "<p>foo.fingerprint.com WWW.fingerprint.com</p><a rel=next href=\"/a/2\">next</a>")
                .html("https://search.test/a/2", "<p>no results</p><a rel=next href=\"/a/3\">next</a>")
                .html("https://search.test/a/3", "<p>late.fingerprint.com</p>");

        CrawlReport r = coordinator(config(1), f).run(List.of(new PagerSource("a", "https://search.test/a/1")));

        assertThat(r.getEntities().keys()).containsExactly("foo");
        assertThat(f.requested).containsExactly(
                URI.create("https://search.test/a/1"), URI.create("https://search.test/a/2"));
        assertThat(r.getState()).isEqualTo(RunState.EXHAUSTED);
    }

    @Test
    @DisplayName("상세 페이지가 목록의 호스트를 되풀이해도 목록 페이지마다 새 엔티티가 있으면 계속 넘긴다")
    void repeated_hosts_on_detail_pages_do_not_count_as_empty() {
        MapFetcher f = new MapFetcher();
        for (int i = 1; i <= 3; i++) {
            String host = "a" + i + ".fingerprint.com";
            String next = (i < 3) ? "<a rel=next href=\"/p" + (i + 1) + "\">next</a>" : "";
            f.html("https://dir.test/p" + i, "<p>" + host + "</p>"
                    + "<a class=detail href=\"/d" + i + "a\">a</a><a class=detail href=\"/d" + i + "b\">b</a>" + next);
            f.html("https://dir.test/d" + i + "a", "<p>" + host + "</p>");
            f.html("https://dir.test/d" + i + "b", "<p>" + host + "</p>");
        }
        NextLinkSource source = new NextLinkSource("dir", List.of("https://dir.test/p1"), "a[rel=next]", "a.detail");

        CrawlReport r = coordinator(config(2), f).run(List.of(source));

        assertThat(f.wasRequested("https://dir.test/p3")).isTrue();
        assertThat(r.getEntities().keys()).containsExactlyInAnyOrder("a1", "a2", "a3");
        assertThat(r.getStats().processed).isEqualTo(9);
    }

    @Test
    @DisplayName("목록 페이지 자체는 비어도 상세 페이지의 새 엔티티가 그 목록 페이지의 실적이 된다")
    void detail_entities_are_credited_to_their_listing_page() {
        MapFetcher f = new MapFetcher()
                .html("https://dir.test/p1", "<a rel=next href=\"/p2\">n</a><a class=detail href=\"/d1\">d</a>")
                .html("https://dir.test/d1", "<p>a1.fingerprint.com</p>")
                .html("https://dir.test/p2", "<a rel=next href=\"/p3\">n</a><a class=detail href=\"/d2\">d</a>")
                .html("https://dir.test/d2", "<p>a2.fingerprint.com</p>")
                .html("https://dir.test/p3", "<p>a3.fingerprint.com</p>");

        CrawlReport r = coordinator(config(1), f).run(List.of(new PagerSource("dir", "https://dir.test/p1")));

        assertThat(r.getEntities().keys()).containsExactlyInAnyOrder("a1", "a2", "a3");
        assertThat(f.wasRequested("https://dir.test/p3")).isTrue();
    }

    @Test
    @DisplayName("페이지네이션과 하위 링크를 따라가며 소스별로 모은다")
    void follows_pages_and_details() {
        MapFetcher f = new MapFetcher()
                .html("https://dir.test/p1", "<a class=detail href=\"/shop/1\">1</a><a rel=next href=\"/p2\">n</a>")
                .html("https://dir.test/shop/1", "<a href=\"https://one.fingerprint.com/\">visit</a>")
                .html("https://dir.test/p2", "<script type=\"application/json\">{\"s\":\"two.fingerprint.com\"}</script>")
                .html("https://list.test/", "<meta content=\"https://three.fingerprint.com\">");

        CrawlReport r = coordinator(config(5), f).run(List.of(
                new PagerSource("dir", "https://dir.test/p1"),
                new PagerSource("list", "https://list.test/")));

        assertThat(r.getEntities().keys()).containsExactlyInAnyOrder("one", "two", "three");
        assertThat(r.getPerSource().get("dir").keys()).containsExactlyInAnyOrder("one", "two");
        assertThat(r.getPerSource().get("list").keys()).containsExactly("three");
    }

    @Test
    @DisplayName("403/오류 페이지는 건너뛰고 통계에만 남긴다")
    void blocked_and_failed_pages_are_dropped() {
        MapFetcher f = new MapFetcher()
                .html("https://ok.test/", "x1.fingerprint.com")
                .status("https://blocked.test/", FetchStatus.BLOCKED, 403)
                .status("https://down.test/", FetchStatus.SERVER_ERROR, 503);

        CrawlReport r = coordinator(config(5), f).run(List.of(
                new PagerSource("s", "https://ok.test/", "https://blocked.test/", "https://down.test/")));

        assertThat(r.getEntities().keys()).containsExactly("x1");
        assertThat(r.getStats().blocked).isEqualTo(1);
        assertThat(r.getStats().failed).isEqualTo(1);
        assertThat(r.getStats().processed).isEqualTo(3);
    }

    @Test
    @DisplayName("다른 호스트로 가는 제외 목록 링크는 큐에 넣지 않는다")
    void excluded_hosts_are_not_followed() {
        MapFetcher f = new MapFetcher()
                .html("https://dir.test/", "<a class=detail href=\"https://www.bing.com/search?q=x\">b</a>"
                        + "<a class=detail href=\"https://other.test/\">o</a>")
                .html("https://other.test/", "ok2.fingerprint.com");

        CrawlReport r = coordinator(config(5), f).run(List.of(new PagerSource("s", "https://dir.test/")));

        assertThat(f.wasRequested("https://www.bing.com/search?q=x")).isFalse();
        assertThat(r.getEntities().keys()).containsExactly("ok2");
    }

    @Test
    @DisplayName("robots 가 막은 URL 은 요청하지 않는다")
    void robots_disallow_is_honoured() {
        RobotsFetcher robots = uri -> RobotsFetcher.Response.ok(200, "User-agent: *\nDisallow: /private\n");
        PolitenessGate gate = new PolitenessGate(new RobotsRepository(robots, "hostscout"),
                new HostPolicyCache(), PolitenessClock.SYSTEM, Duration.ZERO, 0);
        MapFetcher f = new MapFetcher()
                .html("https://ex.test/private/a", "hidden.fingerprint.com")
                .html("https://ex.test/public", "shown.fingerprint.com");

        CrawlReport r = new CrawlCoordinator(config(5), f, gate, d -> {})
                .run(List.of(new PagerSource("s", "https://ex.test/private/a", "https://ex.test/public")));

        assertThat(r.getEntities().keys()).containsExactly("shown");
        assertThat(r.getStats().disallowed).isEqualTo(1);
        assertThat(f.wasRequested("https://ex.test/private/a")).isFalse();
    }

    @Test
    @DisplayName("호스트 간격 대기는 Sleeper 로 위임된다")
    void politeness_wait_goes_through_sleeper() {
        List<Duration> sleeps = new ArrayList<>();
        long[] now = {0L};
        PolitenessGate gate = new PolitenessGate(null, new HostPolicyCache(), () -> now[0], Duration.ofMillis(500), 0);
        MapFetcher f = new MapFetcher()
                .html("https://ex.test/a", "aa.fingerprint.com")
                .html("https://ex.test/b", "bb.fingerprint.com");

        CrawlReport r = new CrawlCoordinator(config(5), f, gate, d -> {
            sleeps.add(d);
            now[0] += d.toMillis();
        }).run(List.of(new PagerSource("s", "https://ex.test/a", "https://ex.test/b")));

        assertThat(r.getEntities().keys()).containsExactlyInAnyOrder("aa", "bb");
        assertThat(sleeps).containsExactly(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("cancel() 이후 새 아이템을 꺼내지 않고 ABORTED 로 끝난다")
    void cancel_aborts_run() {
        AtomicReference<CrawlCoordinator> ref = new AtomicReference<>();
        MapFetcher f = new MapFetcher()
                .html("https://dir.test/p1", "c1.fingerprint.com<a rel=next href=\"/p2\">n</a>")
                .html("https://dir.test/p2", "c2.fingerprint.com");
        f.onFetch(() -> ref.get().cancel());

        CrawlCoordinator c = coordinator(config(5), f);
        ref.set(c);
        CrawlReport r = c.run(List.of(new PagerSource("dir", "https://dir.test/p1")));

        assertThat(r.getState()).isEqualTo(RunState.ABORTED);
        assertThat(c.getState()).isEqualTo(RunState.ABORTED);
        assertThat(f.wasRequested("https://dir.test/p2")).isFalse();
        assertThat(r.getEntities().keys()).containsExactly("c1");
    }

    @Test
    @DisplayName("여러 워커가 동시에 돌아도 결과 집합은 같다")
    void concurrent_workers() {
        MapFetcher f = new MapFetcher();
        List<String> seeds = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String url = "https://h" + i + ".test/";
            f.html(url, "<p>s" + i + "x.fingerprint.com and shared.fingerprint.com</p>");
            seeds.add(url);
        }
        CrawlConfig cfg = config(5).setConcurrency(4);

        CrawlReport r = coordinator(cfg, f).run(List.of(new PagerSource("s", seeds.toArray(new String[0]))));

        assertThat(r.getEntities().size()).isEqualTo(21);
        assertThat(r.getStats().processed).isEqualTo(20);
        assertThat(r.getStats().maxObservedConcurrency).isBetween(1, 4);
        assertThat(r.getStats().attemptsTotal).isEqualTo(20);
    }

    @Test
    @DisplayName("한 인스턴스는 한 번만 실행할 수 있고 소스 이름은 겹칠 수 없다")
    void single_use_and_unique_names() {
        MapFetcher f = new MapFetcher().html("https://a.test/", "");
        CrawlCoordinator c = coordinator(config(5), f);
        c.run(List.of(new PagerSource("s", "https://a.test/")));
        assertThatThrownBy(() -> c.run(List.of())).isInstanceOf(IllegalStateException.class);

        CrawlCoordinator c2 = coordinator(config(5), f);
        assertThatThrownBy(() -> c2.run(List.of(new PagerSource("s", "https://a.test/"), new PagerSource("s"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void invalid_config_is_rejected_up_front() {
        CrawlConfig bad = new CrawlConfig().setFingerprint("nodot");
        assertThatThrownBy(() -> coordinator(bad, new MapFetcher())).isInstanceOf(IllegalArgumentException.class);
    }
}
