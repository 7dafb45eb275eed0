package com.commutewise.commute_engine.config;

import com.commutewise.commute_engine.service.GatewayRateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class CommuteEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OrsSettings orsSettings(@Value("${ors.api.key:}") String apiKey,
                                   @Value("${ors.base-url:https://api.openrouteservice.org}") String baseUrl,
                                   @Value("${ors.country:PH}") String country,
                                   @Value("${ors.search.size:5}") int searchSize,
                                   @Value("${gateway.throttle.interval-ms:1000}") long throttleMs,
                                   @Value("${gateway.throttle.reverse-interval-ms:500}") long reverseThrottleMs) {
        return new OrsSettings(apiKey, baseUrl, country, searchSize,
                Duration.ofMillis(throttleMs), Duration.ofMillis(reverseThrottleMs));
    }

    /**
     * 모든 게이트웨이 호출이 공유하는 단일 호출 간격 제한기.
     */
    @Bean
    public GatewayRateLimiter gatewayRateLimiter(Clock clock) {
        return new GatewayRateLimiter(clock);
    }

    @Bean
    public RestTemplate orsRestTemplate(RestTemplateBuilder builder,
                                        @Value("${ors.connect-timeout-ms:3000}") long connectTimeoutMs,
                                        @Value("${ors.read-timeout-ms:5000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    // 입력창/지도 이동 디바운스 작업 전용. 단일 스레드로 순서대로 실행한다.
    @Bean
    public ThreadPoolTaskScheduler debounceScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("commute-debounce-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
