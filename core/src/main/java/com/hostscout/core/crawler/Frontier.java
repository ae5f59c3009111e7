package com.hostscout.core.crawler;

import com.hostscout.core.model.CrawlConfig;
import com.hostscout.core.model.FrontierItem;
import com.hostscout.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 명시적 순회 큐(재귀 대신).
 * - 쿼리(sourceTag)별 FIFO, 쿼리 간에는 라운드로빈
 * - 방문 집합 키 = (정규화 target, sourceTag). 한 번 들어간 쌍은 다시 들어가지 않는다
 * - 쿼리 하나가 꺼낼 수 있는 아이템은 최대 maxDepth × maxPagesPerQuery 개
 * - 누적 수용량 maxFrontierSize 를 넘는 아이템은 버린다(경고 로그)
 * - take() 는 큐가 비었어도 처리 중인 아이템이 있으면 기다리고, 둘 다 0이면 null(소진)
 * 모든 상태는 하나의 ReentrantLock 으로 보호된다.
 */
public final class Frontier {

    private static final Logger LOG = LoggerFactory.getLogger(Frontier.class);

    public enum OfferResult { ACCEPTED, DUPLICATE, OUT_OF_SCOPE, QUERY_STOPPED, OVERFLOW, CLOSED }

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final Map<String, ArrayDeque<FrontierItem>> queues = new HashMap<>();
    private final ArrayDeque<String> rotation = new ArrayDeque<>();
    private final Set<String> inRotation = new HashSet<>();
    private final Set<String> visited = new HashSet<>();
    private final Map<String, QueryState> queries = new LinkedHashMap<>();

    private final int maxDepth;
    private final int maxPagesPerQuery;
    private final int emptyPageLimit;
    private final long maxSize;
    private final long perQueryBudget;

    private long accepted;
    private long pending;
    private int inFlight;
    private boolean closed;
    private boolean overflowWarned;

    public Frontier(CrawlConfig.Scope scope) {
        this(scope.getMaxDepth(), scope.getMaxPagesPerQuery(), scope.getEmptyPageLimit(), scope.getMaxFrontierSize());
    }

    public Frontier(int maxDepth, int maxPagesPerQuery, int emptyPageLimit, long maxSize) {
        this.maxDepth = maxDepth;
        this.maxPagesPerQuery = maxPagesPerQuery;
        this.emptyPageLimit = emptyPageLimit;
        this.maxSize = maxSize;
        this.perQueryBudget = (long) maxDepth * (long) maxPagesPerQuery;
    }

    public OfferResult offer(FrontierItem item) {
        lock.lock();
        try {
            if (closed) return OfferResult.CLOSED;
            if (item.depth() > maxDepth || item.pageIndex() > maxPagesPerQuery) return OfferResult.OUT_OF_SCOPE;

            QueryState qs = queries.computeIfAbsent(item.sourceTag(), QueryState::new);
            if (qs.isStopped()) return OfferResult.QUERY_STOPPED;

            String key = visitKey(item);
            if (visited.contains(key)) return OfferResult.DUPLICATE;

            if (accepted >= maxSize) {
                if (!overflowWarned) {
                    overflowWarned = true;
                    LOG.warn("Frontier cap {} reached, dropping further items (first dropped: {})", maxSize, item.target());
                } else {
                    LOG.debug("Frontier overflow, dropped {}", item.target());
                }
                return OfferResult.OVERFLOW;
            }

            visited.add(key);
            accepted++;
            pending++;
            queues.computeIfAbsent(item.sourceTag(), t -> new ArrayDeque<>()).addLast(item);
            if (inRotation.add(item.sourceTag())) rotation.addLast(item.sourceTag());
            changed.signalAll();
            return OfferResult.ACCEPTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 다음 아이템. 닫혔거나 소진되면 null.
     * 꺼낸 아이템은 반드시 complete() 로 돌려줘야 한다.
     */
    public FrontierItem take() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (closed) return null;
                FrontierItem next = pollRoundRobin();
                if (next != null) {
                    inFlight++;
                    return next;
                }
                if (inFlight == 0) {
                    changed.signalAll();
                    return null;
                }
                changed.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public void complete(FrontierItem item) {
        lock.lock();
        try {
            if (inFlight > 0) inFlight--;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 처리된 페이지 결과 기록. 연속 빈 페이지가 한도에 닿으면 해당 쿼리를 멈춘다.
     * @return 이번 호출로 쿼리가 멈췄으면 true
     */
    public boolean recordPage(String tag, int newEntities) {
        lock.lock();
        try {
            QueryState qs = queries.computeIfAbsent(tag, QueryState::new);
            int empty = qs.onPage(newEntities);
            if (!qs.isStopped() && empty >= emptyPageLimit) {
                stopLocked(qs, "empty-pages");
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public void stopQuery(String tag, String reason) {
        lock.lock();
        try {
            stopLocked(queries.computeIfAbsent(tag, QueryState::new), reason);
        } finally {
            lock.unlock();
        }
    }

    public boolean isQueryActive(String tag) {
        lock.lock();
        try {
            QueryState qs = queries.get(tag);
            return qs == null || !qs.isStopped();
        } finally {
            lock.unlock();
        }
    }

    /** 취소: 더 이상 꺼내지 않는다. 기다리는 워커를 깨운다 */
    public void close() {
        lock.lock();
        try {
            closed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public long pendingCount() {
        lock.lock();
        try { return pending; } finally { lock.unlock(); }
    }

    public int inFlightCount() {
        lock.lock();
        try { return inFlight; } finally { lock.unlock(); }
    }

    public long acceptedCount() {
        lock.lock();
        try { return accepted; } finally { lock.unlock(); }
    }

    /** 쿼리 상태 스냅샷(복사본) */
    public Map<String, QueryState> queryStates() {
        lock.lock();
        try {
            Map<String, QueryState> out = new LinkedHashMap<>();
            queries.forEach((k, v) -> out.put(k, v.copy()));
            return out;
        } finally {
            lock.unlock();
        }
    }

    // ---------- 락 안에서만 호출 ----------

    private FrontierItem pollRoundRobin() {
        int spins = rotation.size();
        for (int i = 0; i < spins; i++) {
            String tag = rotation.pollFirst();
            ArrayDeque<FrontierItem> q = queues.get(tag);
            QueryState qs = queries.get(tag);
            if (q == null || q.isEmpty()) {
                inRotation.remove(tag);
                continue;
            }
            FrontierItem item = q.pollFirst();
            pending--;
            qs.onDequeued();
            if (qs.dequeued() >= perQueryBudget) {
                stopLocked(qs, "page-budget");
            } else if (!q.isEmpty()) {
                rotation.addLast(tag);
            } else {
                inRotation.remove(tag);
            }
            return item;
        }
        return null;
    }

    private void stopLocked(QueryState qs, String reason) {
        if (qs.isStopped()) return;
        qs.stop(reason);
        ArrayDeque<FrontierItem> q = queues.remove(qs.tag());
        int purged = (q == null) ? 0 : q.size();
        pending -= purged;
        rotation.remove(qs.tag());
        inRotation.remove(qs.tag());
        LOG.debug("Query '{}' stopped ({}), purged {} pending item(s)", qs.tag(), reason, purged);
        changed.signalAll();
    }

    private static String visitKey(FrontierItem item) {
        return UrlUtils.normalize(item.target()) + " " + item.sourceTag();
    }
}
