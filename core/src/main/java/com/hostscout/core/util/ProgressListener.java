package com.hostscout.core.util;

@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0~1.0 (모르면 0.0)
     * @param phase    "crawl" | "verify" | "export"
     * @param done     처리된 프런티어 아이템 수(모르면 -1)
     * @param total    지금까지 프런티어에 들어간 아이템 수(모르면 -1). 크롤 중에는 계속 늘어난다
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
