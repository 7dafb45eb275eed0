package com.commutewise.commute_engine.config;

import java.time.Duration;

/**
 * OpenRouteService 연동 설정. application.properties 의 ors.* / gateway.throttle.* 값.
 */
public class OrsSettings {
    private final String apiKey;
    private final String baseUrl;
    private final String country;
    private final int searchSize;
    private final Duration throttleInterval;
    private final Duration reverseThrottleInterval;

    public OrsSettings(String apiKey, String baseUrl, String country, int searchSize,
                       Duration throttleInterval, Duration reverseThrottleInterval) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.country = country;
        this.searchSize = searchSize;
        this.throttleInterval = throttleInterval;
        this.reverseThrottleInterval = reverseThrottleInterval;
    }

    public String getApiKey() { return apiKey; }
    public String getBaseUrl() { return baseUrl; }
    public String getCountry() { return country; }
    public int getSearchSize() { return searchSize; }
    // 장소 검색, 길찾기
    public Duration getThrottleInterval() { return throttleInterval; }
    // 지도 이동 시 역지오코딩은 더 촘촘한 간격 허용
    public Duration getReverseThrottleInterval() { return reverseThrottleInterval; }

    @Override
    public String toString() {
        // api key는 출력하지 않는다
        return "OrsSettings{baseUrl=" + baseUrl + ", country=" + country + ", searchSize=" + searchSize
                + ", throttle=" + throttleInterval.toMillis() + "ms, reverseThrottle="
                + reverseThrottleInterval.toMillis() + "ms}";
    }
}
