package com.hostscout.core.crawler.robots;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RobotsRepositoryTest {

    @Test
    void success_is_cached_for_the_run() throws Exception {
        URI page = URI.create("https://ex.com/path");
        URI robots = URI.create("https://ex.com/robots.txt");
        FakeRobotsFetcher f = new FakeRobotsFetcher()
                .stub(robots, 200, "User-agent: *\nDisallow: /private\nCrawl-delay: 2\n");
        RobotsRepository repo = new RobotsRepository(f, "hostscout");

        RobotsPolicy p1 = repo.policyFor(page);
        assertFalse(p1.allows(URI.create("https://ex.com/private")));
        assertEquals(Duration.ofSeconds(2), p1.crawlDelay().orElseThrow());

        RobotsPolicy p2 = repo.policyFor(URI.create("https://ex.com/other"));
        assertSame(p1, p2);
        assertEquals(1, f.calls.get());
        assertTrue(repo.isCached(page));
    }

    @Test
    void not_found_and_network_failure_fail_open() throws Exception {
        FakeRobotsFetcher f = new FakeRobotsFetcher()
                .stub(URI.create("https://a.com/robots.txt"), 404, "")
                .fail(URI.create("https://b.com/robots.txt"), "connection refused");
        RobotsRepository repo = new RobotsRepository(f, "hostscout");

        assertTrue(repo.policyFor(URI.create("https://a.com/x")).isAllowAll());
        assertTrue(repo.policyFor(URI.create("https://b.com/x")).isAllowAll());
        assertEquals(2, repo.size());
    }

    @Test
    void server_error_fails_open() throws Exception {
        FakeRobotsFetcher f = new FakeRobotsFetcher().stub(URI.create("https://ex.com/robots.txt"), 503, "");
        RobotsRepository repo = new RobotsRepository(f, "hostscout");
        assertTrue(repo.policyFor(URI.create("https://ex.com/")).allows(URI.create("https://ex.com/any")));
    }

    @Test
    void same_host_redirect_is_followed() throws Exception {
        URI robotsHttp = URI.create("http://ex.com/robots.txt");
        URI robotsHttps = URI.create("https://ex.com/robots.txt");
        FakeRobotsFetcher f = new FakeRobotsFetcher()
                .redirect(robotsHttp, robotsHttps, 301)
                .stub(robotsHttps, 200, "User-agent: *\nDisallow: /q\n");
        RobotsRepository repo = new RobotsRepository(f, "hostscout");

        RobotsPolicy p = repo.policyFor(URI.create("http://ex.com/x"));
        assertFalse(p.allows(URI.create("https://ex.com/q?a=1")));
    }

    @Test
    void cross_host_redirect_fails_open() throws Exception {
        FakeRobotsFetcher f = new FakeRobotsFetcher()
                .redirect(URI.create("https://a.com/robots.txt"), URI.create("https://b.com/robots.txt"), 302);
        RobotsRepository repo = new RobotsRepository(f, "hostscout");
        assertTrue(repo.policyFor(URI.create("https://a.com/x")).isAllowAll());
    }

    @Test
    void redirect_loop_stops_after_limit() throws Exception {
        URI a = URI.create("https://ex.com/robots.txt");
        URI b = URI.create("https://ex.com/robots2.txt");
        FakeRobotsFetcher f = new FakeRobotsFetcher().redirect(a, b, 302).redirect(b, a, 302);
        RobotsRepository repo = new RobotsRepository(f, "hostscout");

        assertTrue(repo.policyFor(URI.create("https://ex.com/")).isAllowAll());
        assertEquals(RobotsRepository.MAX_REDIRECTS + 1, f.calls.get());
    }

    @Test
    void robots_uri_keeps_scheme_and_port() {
        assertEquals(URI.create("http://ex.com:8080/robots.txt"),
                RobotsRepository.robotsTxtUri(URI.create("http://ex.com:8080/a/b?c=d")));
        assertNull(RobotsRepository.robotsTxtUri(URI.create("ftp://ex.com/x")));
    }
}
