package com.commutewise.commute_engine.dto;

/**
 * 역지오코딩 결과. shortName은 바랑가이/지역 이름, areaLabel은 거리/건물 수준의 라벨.
 */
public class ReverseGeocodeDto {
    private final String shortName;
    private final String areaLabel;

    public ReverseGeocodeDto(String shortName, String areaLabel) {
        this.shortName = shortName;
        this.areaLabel = areaLabel;
    }

    public String getShortName() { return shortName; }
    public String getAreaLabel() { return areaLabel; }

    @Override
    public String toString() {
        return shortName + " / " + areaLabel;
    }
}
