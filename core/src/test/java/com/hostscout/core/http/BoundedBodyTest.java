package com.hostscout.core.http;

import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.FetchOutcome;
import com.hostscout.core.model.FetchStatus;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Arrays;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("본문 상한: 상한까지만 읽고 스트림을 닫는다")
class BoundedBodyTest {

    private HttpServer server;
    private String base;

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        // 8 MiB 를 chunked 로 흘려보낸다. 클라이언트가 끊으면 쓰기 예외로 끝난다
        server.createContext("/huge", ex -> {
            ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            ex.sendResponseHeaders(200, 0);
            byte[] chunk = new byte[64 * 1024];
            Arrays.fill(chunk, (byte) 'x');
            try (OutputStream os = ex.getResponseBody()) {
                for (int i = 0; i < 128; i++) os.write(chunk);
            } catch (IOException closedByClient) {
                ex.close();
            }
        });
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    @Test
    void endless_stream_is_cut_at_the_limit_and_closed() throws IOException {
        AtomicBoolean closed = new AtomicBoolean();
        InputStream endless = new InputStream() {
            @Override public int read() { return 'a'; }
            @Override public void close() { closed.set(true); }
        };

        byte[] body = BoundedBody.read(endless, 4096);

        assertThat(body).hasSize(4096);
        assertThat(closed).isTrue();
        assertThat(BoundedBody.read(null, 10)).isEmpty();
    }

    @Test
    void production_fetcher_reads_at_most_max_body_bytes() throws Exception {
        CrawlConfig cfg = new CrawlConfig().setMaxBodyBytes(2048).setTimeoutMs(5000).setRps(100);
        HttpFetcher fetcher = new HttpFetcher(cfg);

        FetchOutcome out = fetcher.fetch(URI.create(base + "/huge"), 1);

        assertThat(out.getStatus()).isEqualTo(FetchStatus.SUCCESS);
        assertThat(out.getBody()).hasValueSatisfying(b -> assertThat(b).hasSize(2048));
    }
}
