package com.commutewise.commute_engine.service;

/**
 * 라이브 경로의 요금 모델: 기본요금 13, 처음 4km 이후 km당 2, 올림.
 */
public final class FareCalculator {

    public static final double BASE_FARE = 13;
    public static final double BASE_DISTANCE_KM = 4;
    public static final double FARE_PER_EXTRA_KM = 2;

    private FareCalculator() {}

    public static double fareFor(double distanceKm) {
        double fare = BASE_FARE + Math.max(0, (distanceKm - BASE_DISTANCE_KM) * FARE_PER_EXTRA_KM);
        return Math.ceil(fare);
    }
}
