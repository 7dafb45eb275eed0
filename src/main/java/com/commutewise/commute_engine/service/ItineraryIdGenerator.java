package com.commutewise.commute_engine.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 경로 id 발급기. 같은 밀리초 안에서도 카운터로 구분된다.
 */
@Component
public class ItineraryIdGenerator {

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public ItineraryIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        return "route-" + clock.millis() + "-" + sequence.incrementAndGet();
    }
}
