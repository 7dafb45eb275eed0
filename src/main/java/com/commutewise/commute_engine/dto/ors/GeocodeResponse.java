package com.commutewise.commute_engine.dto.ors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * OpenRouteService /geocode/search, /geocode/reverse 응답 (GeoJSON FeatureCollection).
 * 필요한 필드만 매핑하고 나머지는 무시한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GeocodeResponse {
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
        // [lng, lat]
        private List<Double> coordinates;

        public List<Double> getCoordinates() { return coordinates; }
        public void setCoordinates(List<Double> coordinates) { this.coordinates = coordinates; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Properties {
        private String name;
        private String label;
        private String street;
        private String neighbourhood;
        private String locality;
        private String borough;
        private String county;
        private String region;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
        public String getStreet() { return street; }
        public void setStreet(String street) { this.street = street; }
        public String getNeighbourhood() { return neighbourhood; }
        public void setNeighbourhood(String neighbourhood) { this.neighbourhood = neighbourhood; }
        public String getLocality() { return locality; }
        public void setLocality(String locality) { this.locality = locality; }
        public String getBorough() { return borough; }
        public void setBorough(String borough) { this.borough = borough; }
        public String getCounty() { return county; }
        public void setCounty(String county) { this.county = county; }
        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }
    }
}
