package com.hostscout.core.http;

import com.hostscout.core.model.FetchStatus;

import java.time.Duration;

/** 분류 결과별 재시도 여부/지연을 결정하는 정책. 시도 횟수 상한은 호출자가 넘기는 예산이 정한다. */
public interface RetryPolicy {
    /** true면 예산이 남아 있을 때 지연 후 재시도. */
    boolean shouldRetry(FetchStatus status);
    /** attempt는 방금 끝난 시도 번호(1부터). */
    Duration nextDelay(FetchStatus status, int attempt);
}
