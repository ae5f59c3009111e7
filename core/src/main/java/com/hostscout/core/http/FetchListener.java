package com.hostscout.core.http;

import com.hostscout.core.model.FetchOutcome;
import com.hostscout.core.model.FetchStatus;

import java.net.URI;
import java.time.Duration;

/** fetcher 가 시도/재시도마다 알려주는 훅. 크롤 통계 집계용 */
public interface FetchListener {
    default void onAttempt(URI uri, FetchOutcome outcome) {}
    default void onRetry(URI uri, FetchStatus status, int attempt, Duration delay) {}

    FetchListener NONE = new FetchListener() {};
}
