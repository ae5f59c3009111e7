package com.hostscout.app;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 종료 훅 본체(Ctrl-C).
 * 취소를 요청한 뒤, 본 스레드가 드레인과 저장을 마치고 finished() 를 부를 때까지 훅을 붙잡는다.
 * 훅이 끝나면 JVM 이 바로 멈추므로 기다림이 없으면 결과 파일이 남지 않는다. 상한은 maxWait.
 */
final class ShutdownDrain implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(ShutdownDrain.class);

    static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(60);

    private final Runnable cancel;
    private final Duration maxWait;
    private final CountDownLatch finished = new CountDownLatch(1);

    ShutdownDrain(Runnable cancel, Duration maxWait) {
        this.cancel = Objects.requireNonNull(cancel, "cancel");
        this.maxWait = Objects.requireNonNull(maxWait, "maxWait");
    }

    @Override
    public void run() {
        LOG.info("Shutdown requested, cancelling crawl and waiting up to {}s for results", maxWait.toSeconds());
        cancel.run();
        try {
            if (!finished.await(maxWait.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Run did not finish within {}s, exiting without waiting further", maxWait.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** 본 스레드: 실행(성공/실패 무관)이 끝났음을 알린다 */
    void finished() {
        finished.countDown();
    }

    boolean isFinished() {
        return finished.getCount() == 0;
    }
}
