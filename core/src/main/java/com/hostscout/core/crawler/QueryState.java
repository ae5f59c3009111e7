package com.hostscout.core.crawler;

/**
 * 쿼리(sourceTag) 하나의 진행 상태. Frontier 락 안에서만 변경된다.
 */
public final class QueryState {
    private final String tag;
    private int consecutiveEmpty;
    private long dequeued;
    private long pages;
    private boolean stopped;
    private String stopReason;

    QueryState(String tag) { this.tag = tag; }

    public String tag() { return tag; }
    public int consecutiveEmpty() { return consecutiveEmpty; }
    public long dequeued() { return dequeued; }
    public long pages() { return pages; }
    public boolean isStopped() { return stopped; }
    public String stopReason() { return stopReason; }

    void onDequeued() { dequeued++; }

    /** @return 갱신 후 연속 빈 페이지 수 */
    int onPage(int newEntities) {
        pages++;
        consecutiveEmpty = (newEntities > 0) ? 0 : consecutiveEmpty + 1;
        return consecutiveEmpty;
    }

    void stop(String reason) {
        if (!stopped) {
            stopped = true;
            stopReason = reason;
        }
    }

    QueryState copy() {
        QueryState c = new QueryState(tag);
        c.consecutiveEmpty = consecutiveEmpty;
        c.dequeued = dequeued;
        c.pages = pages;
        c.stopped = stopped;
        c.stopReason = stopReason;
        return c;
    }
}
