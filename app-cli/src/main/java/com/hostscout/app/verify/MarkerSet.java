package com.hostscout.app.verify;

import java.util.List;
import java.util.Locale;

/**
 * 본문 마커 3단계(소문자 부분 문자열).
 * anchor 는 "지문 도메인이 본문에 보이는가" 마커로, 약한 마커 여러 개와 함께일 때 판정을 뒤집는다.
 * headers 는 응답 헤더 "이름: 값" 에서 찾는 마커이며 일치한 헤더 하나가 high 1개로 계산된다.
 */
public record MarkerSet(List<String> high, List<String> medium, List<String> low, String anchor,
                        List<String> headers) {

    public MarkerSet {
        high = lower(high);
        medium = lower(medium);
        low = lower(low);
        anchor = (anchor == null) ? "" : anchor.toLowerCase(Locale.ROOT);
        headers = lower(headers);
    }

    public MarkerSet(List<String> high, List<String> medium, List<String> low, String anchor) {
        this(high, medium, low, anchor, List.of());
    }

    /** 기본 지문(myshopify.com) 용 마커 */
    public static final MarkerSet SHOPIFY = new MarkerSet(
            List.of("cdn.shopify.com", "shopifycdn.com", "window.shopify", "shopify.theme",
                    "shopify.settings", "shopify.analytics", "shopify.checkout"),
            List.of(".myshopify.com", "data-shopify", "shopify-section", "shopify-section-id",
                    "shopify.js", "shopify.theme.js", "/collections/", "/products/"),
            List.of("/cart", "/checkout", "shopify.com"),
            ".myshopify.com",
            List.of("shopify", "x-shopid", "x-sorting-hat"));

    /** 지문에 맞는 마커. 알려진 지문이 아니면 도메인 자체만 중간 마커(헤더에서는 high)로 쓴다 */
    public static MarkerSet forFingerprint(String fingerprint) {
        String fp = fingerprint.toLowerCase(Locale.ROOT);
        if (fp.equals("myshopify.com")) return SHOPIFY;
        return new MarkerSet(List.of(), List.of("." + fp), List.of(), "." + fp, List.of(fp));
    }

    private static List<String> lower(List<String> in) {
        if (in == null) return List.of();
        return in.stream().map(s -> s.toLowerCase(Locale.ROOT)).toList();
    }
}
