package com.hostscout.core.crawler.robots;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서
 * - 지시어: User-agent / Allow / Disallow / Crawl-delay (키 대소문자 무시)
 * - 연속된 User-agent 라인은 한 그룹. 같은 agent 가 여러 그룹에 나오면 규칙을 합친다
 * - 첫 User-agent 이전의 규칙은 무시
 * - 빈 Disallow 는 규칙이 아니다(= 전체 허용)
 */
public final class RobotsParser {

    private RobotsParser() {}

    static final String UA_ALL = "*";
    /** Crawl-delay 상한 */
    static final Duration MAX_CRAWL_DELAY = Duration.ofSeconds(30);

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";
        if (robotsTxt.startsWith("\uFEFF")) robotsTxt = robotsTxt.substring(1);

        Map<String, List<RuleSet.Rule>> rulesByUa = new LinkedHashMap<>();
        Map<String, Duration> delayByUa = new LinkedHashMap<>();
        List<String> current = new ArrayList<>();
        boolean lastWasUA = false;

        for (String rawLine : robotsTxt.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            switch (key) {
                case "user-agent" -> {
                    if (!lastWasUA) current = new ArrayList<>();
                    String ua = val.isEmpty() ? UA_ALL : val.toLowerCase(Locale.ROOT);
                    current.add(ua);
                    rulesByUa.computeIfAbsent(ua, k -> new ArrayList<>());
                    lastWasUA = true;
                }
                case "allow", "disallow" -> {
                    lastWasUA = false;
                    if (current.isEmpty() || val.isEmpty()) continue;
                    RuleSet.Rule rule = RuleSet.Rule.compile(key.equals("allow"), val);
                    for (String ua : current) rulesByUa.get(ua).add(rule);
                }
                case "crawl-delay" -> {
                    lastWasUA = false;
                    if (current.isEmpty()) continue;
                    Optional<Duration> delay = parseDelay(val);
                    if (delay.isEmpty()) continue;
                    for (String ua : current) delayByUa.put(ua, delay.get());
                }
                default -> lastWasUA = false; // sitemap 등 기타 지시어 무시
            }
        }

        Map<String, Group> groups = new LinkedHashMap<>();
        rulesByUa.forEach((ua, rules) -> groups.put(ua, new Group(new RuleSet(rules), delayByUa.get(ua))));
        return new ParsedRobots(groups);
    }

    static Optional<Duration> parseDelay(String v) {
        try {
            double sec = Double.parseDouble(v);
            if (sec < 0 || Double.isNaN(sec)) return Optional.empty();
            Duration d = Duration.ofMillis((long) (sec * 1000));
            return Optional.of(d.compareTo(MAX_CRAWL_DELAY) > 0 ? MAX_CRAWL_DELAY : d);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** agent 그룹 하나. crawlDelay 는 없으면 null */
    public record Group(RuleSet rules, Duration crawlDelay) {}

    /** 파싱 결과: agent(소문자) → 그룹 */
    public record ParsedRobots(Map<String, Group> groups) {

        /** 제품 토큰 정확 일치(대소문자 무시), 없으면 "*" 그룹, 그것도 없으면 빈 그룹 */
        public Group select(String agentToken) {
            String t = (agentToken == null) ? UA_ALL : agentToken.toLowerCase(Locale.ROOT);
            Group exact = groups.get(t);
            if (exact != null) return exact;
            Group star = groups.get(UA_ALL);
            return (star != null) ? star : new Group(RuleSet.EMPTY, null);
        }
    }
}
