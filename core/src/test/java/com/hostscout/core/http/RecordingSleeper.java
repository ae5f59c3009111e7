package com.hostscout.core.http;

import com.hostscout.core.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** 실제로 자지 않고 요청된 대기만 기록 */
final class RecordingSleeper implements Sleeper {
    final List<Duration> sleeps = new ArrayList<>();

    @Override public synchronized void sleep(Duration d) {
        sleeps.add(d);
    }

    List<Long> millis() {
        return sleeps.stream().map(Duration::toMillis).toList();
    }
}
