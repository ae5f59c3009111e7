package com.hostscout.core.http;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * User-Agent 목록을 라운드로빈으로 돌린다.
 * robots 토큰은 순환과 무관하게 고정된 crawler 이름을 쓴다.
 */
public final class RotatingIdentity implements RequestIdentity {
    private final List<String> agents;
    private final String robotsAgent;
    private final AtomicInteger next = new AtomicInteger(0);

    public RotatingIdentity(List<String> agents, String robotsAgent) {
        if (agents == null || agents.isEmpty()) throw new IllegalArgumentException("agents must not be empty");
        this.agents = List.copyOf(agents);
        this.robotsAgent = robotsAgent;
    }

    @Override public String userAgent() {
        int i = Math.floorMod(next.getAndIncrement(), agents.size());
        return agents.get(i);
    }

    @Override public String robotsToken() {
        return RequestIdentity.productToken(robotsAgent);
    }
}
