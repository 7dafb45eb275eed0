package com.commutewise.commute_engine.model;

import java.util.Locale;

/**
 * 경로 구간(leg)에 표시되는 이동 수단.
 */
public enum TransportMode {
    BUS, JEEP, E_JEEP, TRICYCLE, MIXED, WALK, CAR;

    /**
     * 간선의 차량 종류 문자열을 이동 수단으로 변환한다. 알 수 없는 값은 CAR.
     */
    public static TransportMode fromVehicleKind(String vehicleKind) {
        if (vehicleKind == null || vehicleKind.isBlank()) {
            return CAR;
        }
        try {
            return TransportMode.valueOf(vehicleKind.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return CAR;
        }
    }
}
