package com.commutewise.commute_engine.dto.ors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * OpenRouteService /v2/directions/{profile}/geojson 응답.
 * units=km 로 요청하므로 summary.distance 와 step.distance 모두 km 단위다. duration 은 초.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DirectionsResponse {
    private List<Feature> features;

    public List<Feature> getFeatures() { return features; }
    public void setFeatures(List<Feature> features) { this.features = features; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Feature {
        private Geometry geometry;
        private Properties properties;

        public Geometry getGeometry() { return geometry; }
        public void setGeometry(Geometry geometry) { this.geometry = geometry; }
        public Properties getProperties() { return properties; }
        public void setProperties(Properties properties) { this.properties = properties; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Geometry {
        // LineString 꼭짓점 목록, 각 원소는 [lng, lat]
        private List<List<Double>> coordinates;

        public List<List<Double>> getCoordinates() { return coordinates; }
        public void setCoordinates(List<List<Double>> coordinates) { this.coordinates = coordinates; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {
        private List<Segment> segments;
        private Summary summary;

        public List<Segment> getSegments() { return segments; }
        public void setSegments(List<Segment> segments) { this.segments = segments; }
        public Summary getSummary() { return summary; }
        public void setSummary(Summary summary) { this.summary = summary; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Segment {
        private List<Step> steps;

        public List<Step> getSteps() { return steps; }
        public void setSteps(List<Step> steps) { this.steps = steps; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Step {
        private String instruction;
        private double distance;
        private double duration;
        @JsonProperty("way_points")
        private List<Integer> wayPoints;

        public String getInstruction() { return instruction; }
        public void setInstruction(String instruction) { this.instruction = instruction; }
        public double getDistance() { return distance; }
        public void setDistance(double distance) { this.distance = distance; }
        public double getDuration() { return duration; }
        public void setDuration(double duration) { this.duration = duration; }
        public List<Integer> getWayPoints() { return wayPoints; }
        public void setWayPoints(List<Integer> wayPoints) { this.wayPoints = wayPoints; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Summary {
        private Double distance;
        private Double duration;

        public Double getDistance() { return distance; }
        public void setDistance(Double distance) { this.distance = distance; }
        public Double getDuration() { return duration; }
        public void setDuration(Double duration) { this.duration = duration; }
    }
}
