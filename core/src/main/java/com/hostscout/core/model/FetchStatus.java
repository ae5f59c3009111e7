package com.hostscout.core.model;

/** 단일 fetch 시도의 분류 결과 */
public enum FetchStatus {
    SUCCESS,
    /** 403: 사이트 차원 거부. 재시도 없음 */
    BLOCKED,
    /** 429 */
    RATE_LIMITED,
    /** 403/429 외 4xx, 따라가지 않은 3xx */
    CLIENT_ERROR,
    SERVER_ERROR,
    NETWORK_ERROR,
    TIMEOUT;

    public boolean isRetryable() {
        return switch (this) {
            case RATE_LIMITED, SERVER_ERROR, NETWORK_ERROR, TIMEOUT -> true;
            default -> false;
        };
    }

    /** 호스트 연속 실패 카운트에 포함되는지 여부(CLIENT_ERROR 는 대상 URL 문제라 제외) */
    public boolean isHostFailure() {
        return this != SUCCESS && this != CLIENT_ERROR;
    }
}
