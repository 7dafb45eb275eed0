package com.commutewise.commute_engine.dto;

import java.util.Objects;

/**
 * 장소 검색 결과 한 건.
 */
public class PlaceDto {
    private String name;
    private String address;
    private double lat;
    private double lng;

    public PlaceDto() {}

    public PlaceDto(String name, String address, double lat, double lng) {
        this.name = name;
        this.address = address;
        this.lat = lat;
        this.lng = lng;
    }

    // --- Getters and Setters ---
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
    public double getLat() { return lat; }
    public void setLat(double lat) { this.lat = lat; }
    public double getLng() { return lng; }
    public void setLng(double lng) { this.lng = lng; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlaceDto placeDto = (PlaceDto) o;
        return Double.compare(placeDto.lat, lat) == 0 && Double.compare(placeDto.lng, lng) == 0
                && Objects.equals(name, placeDto.name) && Objects.equals(address, placeDto.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, address, lat, lng);
    }

    @Override
    public String toString() {
        return name + " (" + address + ")";
    }
}
