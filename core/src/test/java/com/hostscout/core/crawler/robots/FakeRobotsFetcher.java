package com.hostscout.core.crawler.robots;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** URI 별 고정 응답 + 호출 횟수 기록 */
final class FakeRobotsFetcher implements RobotsFetcher {
    private final Map<String, Response> byUri = new LinkedHashMap<>();
    final AtomicInteger calls = new AtomicInteger();

    FakeRobotsFetcher stub(URI uri, int status, String body) {
        byUri.put(uri.toString(), Response.ok(status, body));
        return this;
    }
    FakeRobotsFetcher redirect(URI from, URI to, int status) {
        byUri.put(from.toString(), Response.redirect(status, to));
        return this;
    }
    FakeRobotsFetcher fail(URI uri, String err) {
        byUri.put(uri.toString(), Response.fail(err));
        return this;
    }

    @Override public Response fetch(URI robotsTxtUri) {
        calls.incrementAndGet();
        Response r = byUri.get(robotsTxtUri.toString());
        return (r != null) ? r : Response.fail("no stub for " + robotsTxtUri);
    }
}
