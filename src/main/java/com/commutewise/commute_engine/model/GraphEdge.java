package com.commutewise.commute_engine.model;

/**
 * 방향 간선. 대상 노드는 아레나 인덱스로 가리킨다 (id는 표시/디버깅용).
 */
public final class GraphEdge {
    public final int targetIndex;
    public final String targetId;
    public final double distanceKm;
    public final double timeMin;
    public final double cost;
    public final EdgeMode mode;
    public final String vehicleKind; // WALK 간선은 null

    public GraphEdge(int targetIndex, String targetId, double distanceKm, double timeMin, double cost,
                     EdgeMode mode, String vehicleKind) {
        this.targetIndex = targetIndex;
        this.targetId = targetId;
        this.distanceKm = distanceKm;
        this.timeMin = timeMin;
        this.cost = cost;
        this.mode = mode;
        this.vehicleKind = vehicleKind;
    }

    public TransportMode transportMode() {
        return mode == EdgeMode.WALK ? TransportMode.WALK : TransportMode.fromVehicleKind(vehicleKind);
    }

    @Override
    public String toString() {
        return "-> " + targetId + " (" + mode + (vehicleKind != null ? " " + vehicleKind : "") + ")";
    }
}
