package com.commutewise.commute_engine.model;

/**
 * 경로 탐색 시 최소화할 가중치 차원.
 */
public enum RouteMetric {
    TIME(RouteCategory.FASTEST),
    DISTANCE(RouteCategory.SHORTEST),
    COST(RouteCategory.CHEAPEST);

    private final RouteCategory category;

    RouteMetric(RouteCategory category) {
        this.category = category;
    }

    public RouteCategory getCategory() {
        return category;
    }

    public double weightOf(GraphEdge edge) {
        switch (this) {
            case TIME:
                return edge.timeMin;
            case DISTANCE:
                return edge.distanceKm;
            case COST:
                return edge.cost;
            default:
                throw new IllegalStateException("Unknown metric: " + this);
        }
    }
}
