package com.hostscout.core.crawler.politeness;

import com.hostscout.core.crawler.robots.RobotsPolicy;
import com.hostscout.core.model.FetchStatus;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * 호스트별 예절 상태. 처음 접촉할 때 생성되고 연산 단위로 원자적으로 교체된다(ConcurrentHashMap.compute).
 * 네트워크 호출은 절대 compute 안에서 하지 않는다.
 */
public final class HostPolicyCache {

    /** lastRequestAt 이 없으면 -1 */
    public record HostState(String host, RobotsPolicy robots, long lastRequestAt, int consecutiveFailures) {

        static HostState fresh(String host) {
            return new HostState(host, null, -1L, 0);
        }

        HostState withRobots(RobotsPolicy p) {
            return (robots != null) ? this : new HostState(host, p, lastRequestAt, consecutiveFailures);
        }

        HostState withLastRequestAt(long at) {
            return new HostState(host, robots, at, consecutiveFailures);
        }

        HostState withOutcome(FetchStatus status) {
            if (status == FetchStatus.SUCCESS) return new HostState(host, robots, lastRequestAt, 0);
            if (status.isHostFailure()) return new HostState(host, robots, lastRequestAt, consecutiveFailures + 1);
            return this;
        }
    }

    private final ConcurrentHashMap<String, HostState> byHost = new ConcurrentHashMap<>();

    public HostState get(String hostKey) {
        return byHost.computeIfAbsent(hostKey, HostState::fresh);
    }

    /** 원자적 갱신. 반환값은 갱신 후 상태 */
    public HostState update(String hostKey, UnaryOperator<HostState> fn) {
        return byHost.compute(hostKey, (k, cur) -> fn.apply(cur == null ? HostState.fresh(k) : cur));
    }

    public int size() { return byHost.size(); }

    public Map<String, HostState> snapshot() {
        return Map.copyOf(byHost);
    }
}
