package com.hostscout.core.crawler.robots;

import com.hostscout.core.http.BoundedBody;
import com.hostscout.core.http.RequestIdentity;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

public final class HttpRobotsFetcher implements RobotsFetcher {
    /** 비정상적으로 큰 robots.txt 는 앞부분만 읽는다 */
    static final int MAX_BYTES = 512 * 1024;

    private final HttpClient client;
    private final RequestIdentity identity;
    private final Duration timeout;

    public HttpRobotsFetcher(RequestIdentity identity, Duration timeout) {
        // 리다이렉트는 repository 가 직접 판단(동일 호스트만)
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NEVER)
                        .connectTimeout(timeout)
                        .build(),
                identity, timeout);
    }

    public HttpRobotsFetcher(HttpClient client, RequestIdentity identity, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.identity = Objects.requireNonNull(identity, "identity");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public Response fetch(URI robotsTxtUri) throws InterruptedException {
        try {
            HttpRequest req = HttpRequest.newBuilder(robotsTxtUri)
                    .timeout(timeout)
                    .header("User-Agent", identity.userAgent())
                    .header("Accept", "text/plain,*/*;q=0.8")
                    .GET()
                    .build();

            HttpResponse<InputStream> res = client.send(req, HttpResponse.BodyHandlers.ofInputStream());
            int code = res.statusCode();

            if (code >= 300 && code < 400) {
                BoundedBody.read(res.body(), 0);
                URI next = res.headers().firstValue("Location").map(robotsTxtUri::resolve).orElse(null);
                return Response.redirect(code, next);
            }
            byte[] body = BoundedBody.read(res.body(), MAX_BYTES);
            return Response.ok(code, new String(body, StandardCharsets.UTF_8));

        } catch (IOException | IllegalArgumentException e) {
            return Response.fail(e.toString());
        }
    }
}
