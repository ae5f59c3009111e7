package com.hostscout.core.crawler.robots;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 한 User-agent 그룹의 Allow/Disallow 규칙(컴파일 완료).
 * 매칭:
 *  - 대상은 rawPath + ("?" + rawQuery), 퍼센트 HEX 는 대문자로 통일(디코드하지 않음)
 *  - 기본 접두 매칭, '*' 는 임의 길이, 끝의 '$' 는 끝 고정
 *  - 가장 구체적인(길이가 긴) 규칙이 이기고, 같으면 Allow
 *  - 매칭 규칙이 없으면 허용
 */
public final class RuleSet {

    public static final RuleSet EMPTY = new RuleSet(List.of());

    record Rule(boolean allow, String raw, int specificity, Pattern regex) {

        static Rule compile(boolean allow, String value) {
            String r = normalize(value);
            boolean anchored = r.endsWith("$");
            String body = anchored ? r.substring(0, r.length() - 1) : r;
            Pattern rx = null;
            if (anchored || body.indexOf('*') >= 0) {
                StringBuilder sb = new StringBuilder("^");
                for (String part : body.split("\\*", -1)) {
                    if (sb.length() > 1) sb.append(".*");
                    sb.append(Pattern.quote(part));
                }
                if (anchored) sb.append('$');
                rx = Pattern.compile(sb.toString(), Pattern.DOTALL);
            }
            return new Rule(allow, r, body.replace("*", "").length(), rx);
        }

        boolean matches(String path) {
            return (regex != null) ? regex.matcher(path).lookingAt() : path.startsWith(raw);
        }
    }

    private final List<Rule> rules;

    RuleSet(List<Rule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public boolean isEmpty() { return rules.isEmpty(); }

    int size() { return rules.size(); }

    public boolean allows(URI uri) {
        return allowsPath(matchTarget(uri));
    }

    boolean allowsPath(String path) {
        Rule best = null;
        for (Rule r : rules) {
            if (!r.matches(path)) continue;
            if (best == null
                    || r.specificity() > best.specificity()
                    || (r.specificity() == best.specificity() && r.allow() && !best.allow())) {
                best = r;
            }
        }
        return best == null || best.allow();
    }

    /** rawPath(+rawQuery), 빈 경로는 "/" */
    static String matchTarget(URI uri) {
        String p = uri.getRawPath();
        if (p == null || p.isEmpty()) p = "/";
        if (uri.getRawQuery() != null) p = p + "?" + uri.getRawQuery();
        return uppercasePctHex(p);
    }

    static String normalize(String rule) {
        String r = (rule == null) ? "" : rule.trim();
        if (!r.isEmpty() && !r.startsWith("/") && !r.startsWith("*")) r = "/" + r;
        return uppercasePctHex(r);
    }

    static String uppercasePctHex(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                out.append('%')
                   .append(Character.toUpperCase(s.charAt(i + 1)))
                   .append(Character.toUpperCase(s.charAt(i + 2)));
                i += 2;
                continue;
            }
            out.append(ch);
        }
        return out.toString();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
