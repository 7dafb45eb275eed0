package com.commutewise.commute_engine.dto;

import com.commutewise.commute_engine.model.TransportMode;

/**
 * 경로의 한 구간(step). 거리는 미터, 시간은 초 단위.
 */
public class RouteLegDto {
    private final String instruction;
    private final TransportMode mode;
    private final double distanceMeters;
    private final double durationSeconds;
    private final int fromWayPoint;
    private final int toWayPoint;

    public RouteLegDto(String instruction, TransportMode mode, double distanceMeters, double durationSeconds,
                       int fromWayPoint, int toWayPoint) {
        if (distanceMeters < 0 || durationSeconds < 0) {
            throw new IllegalArgumentException("Leg distance and duration must be non-negative");
        }
        this.instruction = instruction;
        this.mode = mode;
        this.distanceMeters = distanceMeters;
        this.durationSeconds = durationSeconds;
        this.fromWayPoint = fromWayPoint;
        this.toWayPoint = toWayPoint;
    }

    // --- Getters ---
    public String getInstruction() { return instruction; }
    public TransportMode getMode() { return mode; }
    public double getDistanceMeters() { return distanceMeters; }
    public double getDurationSeconds() { return durationSeconds; }

    // path 좌표 배열 안에서의 [시작, 끝] 인덱스
    public int[] getWayPoints() { return new int[]{fromWayPoint, toWayPoint}; }
}
