package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.ReverseGeocodeDto;
import com.commutewise.commute_engine.dto.ors.GeocodeResponse;
import com.commutewise.commute_engine.model.Coordinate;

import java.util.Locale;

/**
 * 역지오코딩 응답을 화면용 라벨로 바꾸는 규칙.
 * 이름은 바랑가이(neighbourhood)를 우선한다.
 */
public final class PlaceLabelPolicy {

    static final String UNKNOWN_LOCATION = "Unknown Location";
    static final String UNKNOWN_AREA = "Unknown Area";
    static final String ADDRESS_NOT_FOUND = "Address not found";
    static final String COORDINATE_FALLBACK_NAME = "Location Coordinates";

    private PlaceLabelPolicy() {}

    public static ReverseGeocodeDto fromProperties(GeocodeResponse.Properties props) {
        if (props == null) {
            return new ReverseGeocodeDto(UNKNOWN_LOCATION, UNKNOWN_AREA);
        }
        String shortName = firstNonEmpty(UNKNOWN_LOCATION,
                props.getNeighbourhood(), props.getLocality(), props.getBorough(), props.getCounty(),
                props.getRegion());
        String areaLabel = firstNonEmpty(UNKNOWN_AREA, props.getName(), props.getStreet(), props.getLabel());
        return new ReverseGeocodeDto(shortName, areaLabel);
    }

    public static ReverseGeocodeDto notFound() {
        return new ReverseGeocodeDto(UNKNOWN_LOCATION, ADDRESS_NOT_FOUND);
    }

    public static ReverseGeocodeDto fromCoordinate(Coordinate position) {
        return new ReverseGeocodeDto(COORDINATE_FALLBACK_NAME,
                String.format(Locale.ROOT, "%.4f, %.4f", position.lat, position.lng));
    }

    private static String firstNonEmpty(String defaultValue, String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isEmpty()) {
                return candidate;
            }
        }
        return defaultValue;
    }
}
