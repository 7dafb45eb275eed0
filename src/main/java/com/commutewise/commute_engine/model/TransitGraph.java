package com.commutewise.commute_engine.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 불변 환승 그래프. 노드는 밀집 배열(아레나)에 저장되고 간선은 대상 노드의 인덱스를 가진다.
 * id -> index 맵은 생성 시 한 번만 만든다. 노드 순서는 등록 순서를 그대로 따른다.
 */
public final class TransitGraph {

    private final List<GraphNode> nodes;
    private final Map<String, Integer> indexById;

    private TransitGraph(List<GraphNode> nodes, Map<String, Integer> indexById) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.indexById = Collections.unmodifiableMap(indexById);
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public GraphNode node(int index) {
        return nodes.get(index);
    }

    public List<GraphNode> nodes() {
        return nodes;
    }

    public Optional<GraphNode> findById(String id) {
        Integer index = indexById.get(id);
        return index == null ? Optional.empty() : Optional.of(nodes.get(index));
    }

    public static final class Builder {
        private final Map<String, NodeSpec> specs = new LinkedHashMap<>();

        private Builder() {}

        public Builder addNode(String id, String name, String address, Coordinate position,
                               TerminalCategory category) {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Graph node id must be non-blank");
            }
            if (position == null) {
                throw new IllegalStateException("Graph node " + id + " has no position");
            }
            if (specs.containsKey(id)) {
                throw new IllegalStateException("Duplicate graph node id: " + id);
            }
            specs.put(id, new NodeSpec(id, name, address, position,
                    category != null ? category : TerminalCategory.MIXED));
            return this;
        }

        public Builder addEdge(String fromId, String targetId, double distanceKm, double timeMin, double cost,
                               EdgeMode mode, String vehicleKind) {
            NodeSpec from = specs.get(fromId);
            if (from == null) {
                throw new IllegalStateException("Edge from unknown node: " + fromId);
            }
            from.edges.add(new EdgeSpec(targetId, distanceKm, timeMin, cost, mode, vehicleKind));
            return this;
        }

        public TransitGraph build() {
            Map<String, Integer> indexById = new HashMap<>();
            int next = 0;
            for (String id : specs.keySet()) {
                indexById.put(id, next++);
            }

            List<GraphNode> nodes = new ArrayList<>(specs.size());
            for (NodeSpec spec : specs.values()) {
                List<GraphEdge> edges = new ArrayList<>(spec.edges.size());
                for (EdgeSpec e : spec.edges) {
                    Integer target = indexById.get(e.targetId);
                    if (target == null) {
                        throw new IllegalStateException(
                                "Edge " + spec.id + " -> " + e.targetId + " points to an unknown node");
                    }
                    edges.add(new GraphEdge(target, e.targetId, e.distanceKm, e.timeMin, e.cost,
                            e.mode != null ? e.mode : EdgeMode.RIDE, e.vehicleKind));
                }
                nodes.add(new GraphNode(indexById.get(spec.id), spec.id, spec.name, spec.address,
                        spec.position, spec.category, edges));
            }
            return new TransitGraph(nodes, indexById);
        }
    }

    private static final class NodeSpec {
        final String id;
        final String name;
        final String address;
        final Coordinate position;
        final TerminalCategory category;
        final List<EdgeSpec> edges = new ArrayList<>();

        NodeSpec(String id, String name, String address, Coordinate position, TerminalCategory category) {
            this.id = id;
            this.name = name;
            this.address = address;
            this.position = position;
            this.category = category;
        }
    }

    private static final class EdgeSpec {
        final String targetId;
        final double distanceKm;
        final double timeMin;
        final double cost;
        final EdgeMode mode;
        final String vehicleKind;

        EdgeSpec(String targetId, double distanceKm, double timeMin, double cost, EdgeMode mode, String vehicleKind) {
            this.targetId = targetId;
            this.distanceKm = distanceKm;
            this.timeMin = timeMin;
            this.cost = cost;
            this.mode = mode;
            this.vehicleKind = vehicleKind;
        }
    }
}
