package com.hostscout.core.model;

/** 크롤 실행 상태 머신: IDLE → RUNNING → (DRAINING → ABORTED | EXHAUSTED) */
public enum RunState {
    IDLE,
    RUNNING,
    DRAINING,
    EXHAUSTED,
    ABORTED;

    public boolean isTerminal() {
        return this == EXHAUSTED || this == ABORTED;
    }
}
