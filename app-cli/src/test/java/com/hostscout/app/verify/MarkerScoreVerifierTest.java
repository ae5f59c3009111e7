package com.hostscout.app.verify;

import com.hostscout.core.api.IFetcher;
import com.hostscout.core.model.CanonicalEntity;
import com.hostscout.core.model.FetchOutcome;
import com.hostscout.core.model.FetchStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MarkerScoreVerifier: 마커 점수 판정")
class MarkerScoreVerifierTest {

    private static final CanonicalEntity SHOP = new CanonicalEntity("foo", URI.create("https://foo.myshopify.com"));

    private static IFetcher returning(FetchStatus status, String body) {
        return (uri, budget) -> FetchOutcome.builder()
                .status(status).httpCode(status == FetchStatus.SUCCESS ? 200 : 403)
                .requestUri(uri).contentType("text/html")
                .body(body == null ? null : body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    private final MarkerScoreVerifier scorer =
            new MarkerScoreVerifier(returning(FetchStatus.SUCCESS, ""), MarkerSet.SHOPIFY, 1);

    @Test
    void one_high_marker_is_enough() {
        MarkerScoreVerifier.Score s = scorer.score("<link href=\"https://CDN.Shopify.com/s/files/x.css\">");
        assertThat(s.high()).isEqualTo(1);
        assertThat(s.passes()).isTrue();
    }

    @Test
    void two_medium_markers_pass() {
        assertThat(scorer.score("<a href=\"/collections/all\"></a><a href=\"/products/x\"></a>").passes()).isTrue();
    }

    @Test
    void one_medium_and_two_low_pass() {
        MarkerScoreVerifier.Score s = scorer.score("<div data-shopify></div><a href=\"/cart\"></a><a href=\"/checkout\"></a>");
        assertThat(s.medium()).isEqualTo(1);
        assertThat(s.low()).isEqualTo(2);
        assertThat(s.passes()).isTrue();
    }

    @Test
    void weak_signals_alone_fail() {
        assertThat(scorer.score("<a href=\"/cart\">cart</a>").passes()).isFalse();
        assertThat(scorer.score("").passes()).isFalse();
        assertThat(scorer.score(null).passes()).isFalse();
    }

    @Test
    @DisplayName("anchor 는 중간+약한 마커 3개 이상일 때만 판정을 뒤집는다")
    void anchor_rule() {
        assertThat(new MarkerScoreVerifier.Score(0, 0, 3, true).passes()).isTrue();
        assertThat(new MarkerScoreVerifier.Score(0, 0, 3, false).passes()).isFalse();
        assertThat(new MarkerScoreVerifier.Score(0, 1, 1, true).passes()).isFalse();
        assertThat(new MarkerScoreVerifier.Score(0, 0, 2, true).passes()).isFalse();
    }

    @Test
    @DisplayName("플랫폼 이름이 든 응답 헤더는 high 마커로 계산된다")
    void platform_headers_count_as_high_markers() throws Exception {
        Map<String, List<String>> headers = Map.of(
                "X-ShopId", List.of("123456"),
                "Powered-By", List.of("Shopify"),
                "Content-Type", List.of("text/html"));

        MarkerScoreVerifier.Score s = scorer.score("<p>plain</p>", headers);
        assertThat(s.high()).isEqualTo(2);
        assertThat(s.passes()).isTrue();
        assertThat(scorer.headerHits(Map.of("Server", List.of("nginx")))).isZero();

        IFetcher withHeaders = (uri, budget) -> FetchOutcome.builder()
                .status(FetchStatus.SUCCESS).httpCode(200).requestUri(uri)
                .body("<p>plain</p>".getBytes(StandardCharsets.UTF_8))
                .headers(Map.of("x-shopify-stage", List.of("production")))
                .build();
        assertThat(new MarkerScoreVerifier(withHeaders, MarkerSet.SHOPIFY, 1).verify(SHOP)).isTrue();
    }

    @Test
    void verify_fetches_the_entity_uri() throws Exception {
        assertThat(new MarkerScoreVerifier(returning(FetchStatus.SUCCESS,
                "<script src=\"//cdn.shopify.com/x.js\"></script>"), MarkerSet.SHOPIFY, 2).verify(SHOP)).isTrue();
        assertThat(new MarkerScoreVerifier(returning(FetchStatus.SUCCESS, "<p>plain</p>"), MarkerSet.SHOPIFY, 2)
                .verify(SHOP)).isFalse();
        assertThat(new MarkerScoreVerifier(returning(FetchStatus.BLOCKED, null), MarkerSet.SHOPIFY, 2)
                .verify(SHOP)).isFalse();
    }

    @Test
    void generic_fingerprint_markers() {
        MarkerSet m = MarkerSet.forFingerprint("Fingerprint.com");
        assertThat(m.medium()).containsExactly(".fingerprint.com");
        assertThat(m.anchor()).isEqualTo(".fingerprint.com");
        assertThat(MarkerSet.forFingerprint("myshopify.com")).isSameAs(MarkerSet.SHOPIFY);
    }
}
