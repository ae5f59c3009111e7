package com.hostscout.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/** URL 정규화 + 호스트 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙(방문 집합 키용):
     * - fragment 제거
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로를 "/"로, 중복 슬래시 축소
     * 쿼리는 그대로 둔다(검색 결과 페이지는 쿼리로 구분되므로).
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        try {
            return new URI(sb.toString());
        } catch (URISyntaxException e) {
            // 파싱 실패 시 원본 유지
            return u;
        }
    }

    /** 소문자 호스트. 없으면 빈 문자열 */
    public static String hostOf(URI u) {
        if (u == null || u.getHost() == null) return "";
        return u.getHost().toLowerCase(Locale.ROOT);
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return (s.equals("http") || s.equals("https")) && u.getHost() != null;
    }

    /** 절대 URL 문자열을 http(s) URI 로. 잘못된 값이면 empty */
    public static Optional<URI> parseHttp(String abs) {
        if (abs == null || abs.isBlank()) return Optional.empty();
        try {
            URI u = new URI(abs.trim());
            return isHttp(u) ? Optional.of(u) : Optional.empty();
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameHost(URI a, URI b) {
        if (a == null || b == null) return false;
        return hostOf(a).equals(hostOf(b));
    }

    /** host:port 키(포트 없으면 스킴 기본 포트) */
    public static String hostKey(URI u) {
        String scheme = (u.getScheme() == null ? "https" : u.getScheme().toLowerCase(Locale.ROOT));
        int port = u.getPort();
        if (port < 0) port = scheme.equals("http") ? 80 : 443;
        return hostOf(u) + ":" + port;
    }
}
