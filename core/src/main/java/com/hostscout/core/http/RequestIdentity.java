package com.hostscout.core.http;

import com.hostscout.core.model.CrawlConfig;

import java.util.Locale;

/** 요청마다 붙일 식별 헤더(User-Agent) 전략 */
public interface RequestIdentity {

    String userAgent();

    /** robots.txt 그룹 선택에 쓰는 제품 토큰(첫 '/' 또는 공백 앞, 소문자) */
    default String robotsToken() {
        return productToken(userAgent());
    }

    static String productToken(String ua) {
        if (ua == null || ua.isBlank()) return "*";
        String t = ua.trim();
        int cut = t.length();
        int slash = t.indexOf('/');
        int space = t.indexOf(' ');
        if (slash >= 0) cut = Math.min(cut, slash);
        if (space >= 0) cut = Math.min(cut, space);
        return t.substring(0, cut).toLowerCase(Locale.ROOT);
    }

    /** userAgents 가 있으면 순환, 없으면 userAgent 고정 */
    static RequestIdentity fromConfig(CrawlConfig cfg) {
        if (cfg.getUserAgents() != null && !cfg.getUserAgents().isEmpty()) {
            return new RotatingIdentity(cfg.getUserAgents(), cfg.getUserAgent());
        }
        return new FixedIdentity(cfg.getUserAgent());
    }
}
