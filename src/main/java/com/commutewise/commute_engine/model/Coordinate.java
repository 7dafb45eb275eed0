package com.commutewise.commute_engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * WGS84 위치 값. 범위 검사는 하지 않는다 (|lat| > 90 같은 값도 그대로 보존).
 * 범위를 확인하고 싶은 호출자는 {@link #isWithinRange()}를 쓴다.
 */
public final class Coordinate {
    public final double lat;
    public final double lng;

    @JsonCreator
    public Coordinate(@JsonProperty("lat") double lat, @JsonProperty("lng") double lng) {
        this.lat = lat;
        this.lng = lng;
    }

    public double getLat() { return lat; }
    public double getLng() { return lng; }

    @JsonIgnore
    public boolean isWithinRange() {
        return Math.abs(lat) <= 90 && Math.abs(lng) <= 180;
    }

    /**
     * 위경도 도(degree) 단위의 제곱 유클리드 거리. 측지 거리가 아니다.
     */
    public double squaredDegreeDistanceTo(Coordinate other) {
        double dLat = lat - other.lat;
        double dLng = lng - other.lng;
        return dLat * dLat + dLng * dLng;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Coordinate that = (Coordinate) o;
        return Double.compare(that.lat, lat) == 0 && Double.compare(that.lng, lng) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(lat, lng);
    }

    @Override
    public String toString() {
        return "(" + lat + ", " + lng + ")";
    }
}
