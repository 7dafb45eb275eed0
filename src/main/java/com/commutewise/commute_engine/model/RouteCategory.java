package com.commutewise.commute_engine.model;

public enum RouteCategory {
    FASTEST("Fastest"),
    CHEAPEST("Cheapest"),
    SHORTEST("Shortest");

    private final String label;

    RouteCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
