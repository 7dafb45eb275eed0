package com.commutewise.commute_engine.dto;

import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.TerminalCategory;

/**
 * 지도에 표시할 터미널(그래프 노드) 정보.
 */
public class TerminalDto {
    private final String id;
    private final String name;
    private final String address;
    private final Coordinate location;
    private final TerminalCategory type;
    private final double rating;
    private final int routeCount;

    public TerminalDto(String id, String name, String address, Coordinate location, TerminalCategory type,
                       double rating, int routeCount) {
        this.id = id;
        this.name = name;
        this.address = address;
        this.location = location;
        this.type = type;
        this.rating = rating;
        this.routeCount = routeCount;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getAddress() { return address; }
    public Coordinate getLocation() { return location; }
    public TerminalCategory getType() { return type; }
    public double getRating() { return rating; }
    public int getRouteCount() { return routeCount; }
}
