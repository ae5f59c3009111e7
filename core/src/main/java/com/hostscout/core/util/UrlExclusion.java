package com.hostscout.core.util;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** 방문하지 않을 URL 판정 */
public final class UrlExclusion {
    private UrlExclusion(){}

    /**
     * patterns 지원:
     * <ul>
     *   <li>접두(prefix): {@code "/account"} 또는 {@code "https://host/path"}</li>
     *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "*&#47;login*"})</li>
     *   <li>정규식: {@code "re:"} 접두</li>
     * </ul>
     */
    public static boolean isExcluded(URI url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        final String s = url.toString();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;

            if (p.startsWith("re:")) {
                if (Pattern.compile(p.substring(3), Pattern.CASE_INSENSITIVE).matcher(s).find()) return true;
            } else if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
                if (Pattern.compile(globToRegex(p), Pattern.CASE_INSENSITIVE).matcher(s).find()) return true;
            } else {
                if (s.startsWith(p)) return true;
                // 호스트 상대 prefix
                if (p.startsWith("/")) {
                    String path = url.getRawPath() == null ? "/" : url.getRawPath();
                    if (path.startsWith(p)) return true;
                }
            }
        }
        return false;
    }

    /** 호스트가 목록의 도메인 자체이거나 그 하위 도메인이면 true (www.google.com ⊂ google.com) */
    public static boolean isExcludedHost(URI url, List<String> hosts) {
        if (url == null || hosts == null || hosts.isEmpty()) return false;
        String h = UrlUtils.hostOf(url);
        if (h.isEmpty()) return false;
        for (String raw : hosts) {
            if (raw == null || raw.isBlank()) continue;
            String d = raw.trim().toLowerCase(Locale.ROOT);
            if (h.equals(d) || h.endsWith("." + d)) return true;
        }
        return false;
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
