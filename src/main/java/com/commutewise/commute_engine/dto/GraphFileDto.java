package com.commutewise.commute_engine.dto;

import com.commutewise.commute_engine.model.EdgeMode;
import com.commutewise.commute_engine.model.TerminalCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * classpath 그래프 리소스(JSON)의 형태. 로드 직후 TransitGraph 아레나로 변환된다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphFileDto {
    private List<NodeEntry> nodes = new ArrayList<>();

    public List<NodeEntry> getNodes() { return nodes; }
    public void setNodes(List<NodeEntry> nodes) { this.nodes = nodes; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NodeEntry {
        private String id;
        private String name;
        private String address;
        private Double lat;
        private Double lng;
        private TerminalCategory terminalType;
        private List<ConnectionEntry> connections = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getAddress() { return address; }
        public void setAddress(String address) { this.address = address; }
        public Double getLat() { return lat; }
        public void setLat(Double lat) { this.lat = lat; }
        public Double getLng() { return lng; }
        public void setLng(Double lng) { this.lng = lng; }
        public TerminalCategory getTerminalType() { return terminalType; }
        public void setTerminalType(TerminalCategory terminalType) { this.terminalType = terminalType; }
        public List<ConnectionEntry> getConnections() { return connections; }
        public void setConnections(List<ConnectionEntry> connections) { this.connections = connections; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConnectionEntry {
        private String targetId;
        private double distanceKm;
        private double timeMin;
        private double cost;
        private EdgeMode type;
        private String vehicleType;

        public String getTargetId() { return targetId; }
        public void setTargetId(String targetId) { this.targetId = targetId; }
        public double getDistanceKm() { return distanceKm; }
        public void setDistanceKm(double distanceKm) { this.distanceKm = distanceKm; }
        public double getTimeMin() { return timeMin; }
        public void setTimeMin(double timeMin) { this.timeMin = timeMin; }
        public double getCost() { return cost; }
        public void setCost(double cost) { this.cost = cost; }
        public EdgeMode getType() { return type; }
        public void setType(EdgeMode type) { this.type = type; }
        public String getVehicleType() { return vehicleType; }
        public void setVehicleType(String vehicleType) { this.vehicleType = vehicleType; }
    }
}
