package com.hostscout.core.crawler.politeness;

/** 호스트 간격 계산용 시계. 테스트에서는 고정 시계를 주입한다. */
@FunctionalInterface
public interface PolitenessClock {
    long nowMillis();

    PolitenessClock SYSTEM = System::currentTimeMillis;
}
