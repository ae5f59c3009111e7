// IFetcher.java
package com.hostscout.core.api;

import com.hostscout.core.http.FetchListener;
import com.hostscout.core.model.FetchOutcome;

import java.net.URI;
import java.util.function.BooleanSupplier;

/** fetch 최소 계약: URL 하나를 최대 attemptBudget 번 시도하고 마지막 결과를 돌려준다. */
public interface IFetcher extends AutoCloseable {
    FetchOutcome fetch(URI uri, int attemptBudget) throws InterruptedException;

    /** 실행 단위 바인딩: 시도 계측 + 중단 플래그(재시도 대기 전에 확인). 기본 구현은 무시 */
    default void bind(FetchListener listener, BooleanSupplier stopRequested) {}

    @Override default void close() throws Exception {}
}
