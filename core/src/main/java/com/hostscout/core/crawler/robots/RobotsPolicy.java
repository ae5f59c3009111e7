package com.hostscout.core.crawler.robots;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/** 한 호스트에 대해 선택된 robots 그룹. 실패/없음이면 allowAll */
public final class RobotsPolicy {

    private static final RobotsPolicy ALLOW_ALL = new RobotsPolicy(RuleSet.EMPTY, null, true);

    private final RuleSet rules;
    private final Duration crawlDelay;
    private final boolean allowAll;

    private RobotsPolicy(RuleSet rules, Duration crawlDelay, boolean allowAll) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.crawlDelay = crawlDelay;
        this.allowAll = allowAll;
    }

    /** robots.txt 본문 파싱 후 agentToken 그룹을 고른다 */
    public static RobotsPolicy parse(String robotsTxt, String agentToken) {
        RobotsParser.Group g = RobotsParser.parse(robotsTxt).select(agentToken);
        return new RobotsPolicy(g.rules(), g.crawlDelay(), false);
    }

    public static RobotsPolicy allowAll() {
        return ALLOW_ALL;
    }

    public boolean allows(URI url) {
        return allowAll || rules.allows(url);
    }

    public Optional<Duration> crawlDelay() {
        return Optional.ofNullable(crawlDelay);
    }

    public boolean isAllowAll() {
        return allowAll;
    }
}
