package com.commutewise.commute_engine.dto;

public class LocationSuggestionDto {

    public enum SuggestionType { TERMINAL, LOCATION }

    private final String name;
    private final String address;
    private final SuggestionType type;

    public LocationSuggestionDto(String name, String address, SuggestionType type) {
        this.name = name;
        this.address = address;
        this.type = type;
    }

    public String getName() { return name; }
    public String getAddress() { return address; }
    public SuggestionType getType() { return type; }
}
