package com.commutewise.commute_engine.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 입력 필드 하나(검색창, 지도 중심)에 대한 디바운스 조회.
 * <p>
 * 새 입력이 들어오면 대기 중인 작업을 취소하고 quietPeriod 뒤에 실행될 작업을 다시 예약한다.
 * 살아남은 작업만 실제 조회를 수행한다. 각 입력에는 증가하는 순번이 붙고,
 * 조회가 끝났을 때 더 새로운 입력이 있었다면 결과를 버린다.
 *
 * @param <Q> 입력 (검색어, 좌표)
 * @param <R> 조회 결과
 */
public class DebouncedLookup<Q, R> {

    private static final Logger log = LoggerFactory.getLogger(DebouncedLookup.class);

    private final TaskScheduler scheduler;
    private final Duration quietPeriod;
    private final Function<Q, R> lookup;
    private final Consumer<R> onResult;
    private final AtomicLong sequence = new AtomicLong();
    private ScheduledFuture<?> pending; // guarded by this

    public DebouncedLookup(TaskScheduler scheduler, Duration quietPeriod, Function<Q, R> lookup,
                           Consumer<R> onResult) {
        this.scheduler = scheduler;
        this.quietPeriod = quietPeriod;
        this.lookup = lookup;
        this.onResult = onResult;
    }

    /**
     * 입력 이벤트를 등록한다.
     *
     * @return 이 입력에 부여된 순번
     */
    public synchronized long submit(Q input) {
        if (pending != null) {
            // 이미 실행 중인 조회는 끊지 않는다. 결과는 순번 비교로 버려진다.
            pending.cancel(false);
        }
        long token = sequence.incrementAndGet();
        pending = scheduler.schedule(() -> fire(token, input), scheduler.getClock().instant().plus(quietPeriod));
        return token;
    }

    /**
     * 대기 중인 작업을 취소하고, 이미 실행 중인 조회의 결과도 버리게 한다.
     */
    public synchronized void cancel() {
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        sequence.incrementAndGet();
    }

    public long currentToken() {
        return sequence.get();
    }

    private void fire(long token, Q input) {
        if (token != sequence.get()) {
            return;
        }
        R result = lookup.apply(input);
        if (token != sequence.get()) {
            log.debug("[DEBOUNCE] 순번 {}의 결과는 더 새로운 입력(순번 {})이 있어 버립니다.", token, sequence.get());
            return;
        }
        onResult.accept(result);
    }
}
