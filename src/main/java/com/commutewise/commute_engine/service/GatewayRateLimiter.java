package com.commutewise.commute_engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * 외부 지도 API 호출 간격 제한기. 마지막 호출 시각 하나를 모든 호출 종류가 공유하며,
 * 호출 종류마다 최소 간격만 다르다. 간격이 모자라면 남은 시간만큼 대기한 뒤 통과시킨다.
 * <p>
 * 대기 중에도 락을 쥐고 있으므로 동시 호출은 한 번에 하나씩 직렬화된다.
 */
public class GatewayRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(GatewayRateLimiter.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Clock clock;
    private final Sleeper sleeper;
    private Instant lastCallAt; // guarded by this

    public GatewayRateLimiter(Clock clock) {
        this(clock, GatewayRateLimiter::sleepAtLeast);
    }

    public GatewayRateLimiter(Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * 직전 호출로부터 minInterval이 지날 때까지 대기하고 호출 시각을 기록한다.
     *
     * @return 실제로 대기한 시간
     */
    public synchronized Duration acquire(Duration minInterval) throws InterruptedException {
        Duration waited = Duration.ZERO;
        if (lastCallAt != null) {
            Duration sinceLast = Duration.between(lastCallAt, clock.instant());
            if (sinceLast.compareTo(minInterval) < 0) {
                log.debug("[THROTTLE] 직전 호출 후 {}ms 경과, {}ms 대기합니다.",
                        sinceLast.toMillis(), minInterval.minus(sinceLast).toMillis());
            }
            // 시계 기준으로 간격이 찰 때까지 반복
            while (sinceLast.compareTo(minInterval) < 0) {
                Duration remaining = minInterval.minus(sinceLast);
                sleeper.sleep(remaining);
                waited = waited.plus(remaining);
                sinceLast = Duration.between(lastCallAt, clock.instant());
            }
        }
        lastCallAt = clock.instant();
        return waited;
    }

    // 밀리초 미만은 올림
    private static void sleepAtLeast(Duration duration) throws InterruptedException {
        long nanos = duration.toNanos();
        TimeUnit.MILLISECONDS.sleep((nanos + 999_999) / 1_000_000);
    }

    public synchronized Instant getLastCallAt() {
        return lastCallAt;
    }
}
