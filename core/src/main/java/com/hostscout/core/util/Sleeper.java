package com.hostscout.core.util;

import java.time.Duration;

/** 백오프/예절 대기 추상화. 테스트에서는 기록용 구현을 주입한다. */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;
}
