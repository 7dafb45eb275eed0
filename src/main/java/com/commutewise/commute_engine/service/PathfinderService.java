package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.GraphEdge;
import com.commutewise.commute_engine.model.GraphNode;
import com.commutewise.commute_engine.model.RouteMetric;
import com.commutewise.commute_engine.model.TransitGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Optional;

/**
 * 정적 그래프 위의 단일 출발 최단 경로 탐색 (다익스트라).
 * <p>
 * 최소 거리 노드 선택은 배열 선형 스캔(O(V^2))으로 한다. 동률이면 인덱스가 작은 노드가 먼저 선택된다.
 * "경로 없음"은 예외가 아니라 {@link Optional#empty()}로 표현한다.
 */
@Service
public class PathfinderService {

    private static final Logger log = LoggerFactory.getLogger(PathfinderService.class);

    private final TransitGraphService transitGraphService;
    private final NearestNodeResolver nearestNodeResolver;
    private final RouteAssemblerService routeAssemblerService;

    public PathfinderService(TransitGraphService transitGraphService, NearestNodeResolver nearestNodeResolver,
                             RouteAssemblerService routeAssemblerService) {
        this.transitGraphService = transitGraphService;
        this.nearestNodeResolver = nearestNodeResolver;
        this.routeAssemblerService = routeAssemblerService;
    }

    public Optional<ItineraryDto> shortestPath(Coordinate startPoint, Coordinate endPoint, RouteMetric metric) {
        RouteMetric effectiveMetric = metric != null ? metric : RouteMetric.TIME;

        Optional<GraphNode> startNode = nearestNodeResolver.resolve(startPoint);
        Optional<GraphNode> endNode = nearestNodeResolver.resolve(endPoint);
        if (startNode.isEmpty() || endNode.isEmpty()) {
            log.info("[ROUTE LOG] 출발지 또는 도착지를 그래프 노드에 매칭하지 못했습니다. start={}, end={}",
                    startPoint, endPoint);
            return Optional.empty();
        }
        if (startNode.get().index == endNode.get().index) {
            log.info("[ROUTE LOG] 출발지와 도착지가 같은 노드({})로 매칭되어 경로를 만들지 않습니다.", startNode.get().id);
            return Optional.empty();
        }

        Optional<int[]> nodePath = findNodePath(startNode.get().index, endNode.get().index, effectiveMetric);
        if (nodePath.isEmpty()) {
            log.info("[ROUTE LOG] {} -> {} 연결 경로가 없습니다 ({}).", startNode.get().id, endNode.get().id,
                    effectiveMetric);
            return Optional.empty();
        }

        ItineraryDto itinerary = routeAssemblerService.assembleIndices(nodePath.get(), effectiveMetric);
        log.info("[ROUTE LOG] {} -> {} 경로 계산 완료: {}", startNode.get().id, endNode.get().id, itinerary);
        return Optional.of(itinerary);
    }

    /**
     * 노드 인덱스 사이의 최단 경로를 출발 -> 도착 순서의 인덱스 배열로 반환한다.
     */
    public Optional<int[]> findNodePath(int startIndex, int endIndex, RouteMetric metric) {
        TransitGraph graph = transitGraphService.getGraph();
        int n = graph.size();

        double[] distances = new double[n];
        int[] previous = new int[n];
        boolean[] processed = new boolean[n];
        Arrays.fill(distances, Double.POSITIVE_INFINITY);
        Arrays.fill(previous, -1);
        distances[startIndex] = 0;

        while (true) {
            int current = -1;
            double best = Double.POSITIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                if (!processed[i] && distances[i] < best) {
                    best = distances[i];
                    current = i;
                }
            }
            // 남은 노드가 모두 도달 불가능하거나 도착 노드가 확정되면 종료
            if (current == -1 || current == endIndex) {
                break;
            }

            for (GraphEdge edge : graph.node(current).edges) {
                if (processed[edge.targetIndex]) continue;
                double alt = distances[current] + metric.weightOf(edge);
                if (alt < distances[edge.targetIndex]) {
                    distances[edge.targetIndex] = alt;
                    previous[edge.targetIndex] = current;
                }
            }
            processed[current] = true;
        }

        return reconstruct(previous, startIndex, endIndex, n);
    }

    private static Optional<int[]> reconstruct(int[] previous, int startIndex, int endIndex, int nodeCount) {
        int[] reversed = new int[nodeCount];
        int length = 0;
        int current = endIndex;
        while (current != -1 && length < nodeCount) {
            reversed[length++] = current;
            current = previous[current];
        }
        if (reversed[length - 1] != startIndex) {
            return Optional.empty();
        }

        int[] path = new int[length];
        for (int i = 0; i < length; i++) {
            path[i] = reversed[length - 1 - i];
        }
        return Optional.of(path);
    }
}
