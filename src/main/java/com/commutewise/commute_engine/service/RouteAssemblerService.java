package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.dto.RouteLegDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.EdgeMode;
import com.commutewise.commute_engine.model.GraphEdge;
import com.commutewise.commute_engine.model.GraphNode;
import com.commutewise.commute_engine.model.RouteMetric;
import com.commutewise.commute_engine.model.TransitGraph;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 노드 경로를 사용자에게 보여줄 경로(ItineraryDto)로 조립한다.
 */
@Service
public class RouteAssemblerService {

    private final TransitGraphService transitGraphService;
    private final ItineraryIdGenerator idGenerator;

    public RouteAssemblerService(TransitGraphService transitGraphService, ItineraryIdGenerator idGenerator) {
        this.transitGraphService = transitGraphService;
        this.idGenerator = idGenerator;
    }

    public ItineraryDto assemble(List<String> nodePath, RouteMetric metric) {
        TransitGraph graph = transitGraphService.getGraph();
        int[] indices = new int[nodePath.size()];
        for (int i = 0; i < indices.length; i++) {
            String id = nodePath.get(i);
            indices[i] = graph.findById(id)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown graph node: " + id))
                    .index;
        }
        return assembleIndices(indices, metric);
    }

    ItineraryDto assembleIndices(int[] nodePath, RouteMetric metric) {
        TransitGraph graph = transitGraphService.getGraph();

        List<Coordinate> path = new ArrayList<>(nodePath.length);
        for (int index : nodePath) {
            path.add(graph.node(index).position);
        }

        List<RouteLegDto> legs = new ArrayList<>();
        double totalTime = 0;
        double totalDistance = 0;
        double totalCost = 0;

        for (int i = 0; i < nodePath.length - 1; i++) {
            GraphNode from = graph.node(nodePath[i]);
            GraphNode to = graph.node(nodePath[i + 1]);
            GraphEdge edge = findEdge(from, to.index, metric);
            if (edge == null) {
                throw new IllegalArgumentException("No edge " + from.id + " -> " + to.id);
            }

            totalTime += edge.timeMin;
            totalDistance += edge.distanceKm;
            totalCost += edge.cost;

            legs.add(new RouteLegDto(
                    instructionFor(edge, to),
                    edge.transportMode(),
                    edge.distanceKm * 1000, // km -> m
                    edge.timeMin * 60,      // min -> s
                    i, i + 1));
        }

        return new ItineraryDto(idGenerator.nextId(), totalTime, totalDistance, totalCost, path, legs,
                metric.getCategory(), List.of(metric.getCategory().getLabel()));
    }

    /**
     * from -> target 간선 중 선택된 지표 가중치가 가장 작은 것. 동률이면 먼저 등록된 간선.
     * 탐색기가 완화에 쓴 간선과 같아야 경로 합계가 최단 거리와 일치한다.
     */
    private static GraphEdge findEdge(GraphNode from, int targetIndex, RouteMetric metric) {
        GraphEdge best = null;
        for (GraphEdge edge : from.edges) {
            if (edge.targetIndex != targetIndex) continue;
            if (best == null || metric.weightOf(edge) < metric.weightOf(best)) {
                best = edge;
            }
        }
        return best;
    }

    private static String instructionFor(GraphEdge edge, GraphNode destination) {
        if (edge.mode == EdgeMode.WALK) {
            return "Walk to " + destination.name;
        }
        if (edge.vehicleKind == null || edge.vehicleKind.isBlank()) {
            return "Ride to " + destination.name;
        }
        return "Ride " + edge.vehicleKind + " to " + destination.name;
    }
}
