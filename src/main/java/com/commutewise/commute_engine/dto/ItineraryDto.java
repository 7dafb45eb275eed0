package com.commutewise.commute_engine.dto;

import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.RouteCategory;

import java.util.List;

/**
 * 계산된 경로 한 건. 생성 후 변경되지 않으며, 변형(variant)은 {@link #derive}로 새 객체를 만든다.
 */
public class ItineraryDto {
    private final String id;
    private final double totalTimeMinutes;
    private final double totalDistanceKm;
    private final double totalCost;
    private final List<Coordinate> path;
    private final List<RouteLegDto> legs;
    private final RouteCategory category;
    private final List<String> labels;

    public ItineraryDto(String id, double totalTimeMinutes, double totalDistanceKm, double totalCost,
                        List<Coordinate> path, List<RouteLegDto> legs, RouteCategory category, List<String> labels) {
        if (path == null || path.size() < 2) {
            throw new IllegalArgumentException("Itinerary path needs at least 2 points");
        }
        this.id = id;
        this.totalTimeMinutes = totalTimeMinutes;
        this.totalDistanceKm = totalDistanceKm;
        this.totalCost = totalCost;
        this.path = List.copyOf(path);
        this.legs = List.copyOf(legs);
        this.category = category;
        this.labels = List.copyOf(labels);
    }

    /**
     * path/legs는 공유하고 요약 값과 라벨만 바꾼 새 경로를 만든다.
     */
    public ItineraryDto derive(String newId, double newTimeMinutes, double newDistanceKm, double newCost,
                               RouteCategory newCategory, List<String> newLabels) {
        return new ItineraryDto(newId, newTimeMinutes, newDistanceKm, newCost, path, legs, newCategory, newLabels);
    }

    // --- Getters ---
    public String getId() { return id; }
    public double getTotalTimeMinutes() { return totalTimeMinutes; }
    public double getTotalDistanceKm() { return totalDistanceKm; }
    public double getTotalCost() { return totalCost; }
    public List<Coordinate> getPath() { return path; }
    public List<RouteLegDto> getLegs() { return legs; }
    public RouteCategory getCategory() { return category; }
    public List<String> getLabels() { return labels; }

    @Override
    public String toString() {
        return "ItineraryDto{" + id + ", " + category + ", " + totalTimeMinutes + "min, "
                + totalDistanceKm + "km, cost " + totalCost + ", legs " + legs.size() + "}";
    }
}
