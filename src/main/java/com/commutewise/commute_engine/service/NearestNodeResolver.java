package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.GraphNode;
import com.commutewise.commute_engine.model.TransitGraph;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 임의의 좌표를 가장 가까운 그래프 노드로 스냅한다.
 * 거리 기준은 위경도 평면의 유클리드 거리(제곱)이며 하버사인을 쓰지 않는다.
 */
@Service
public class NearestNodeResolver {

    private final TransitGraphService transitGraphService;

    public NearestNodeResolver(TransitGraphService transitGraphService) {
        this.transitGraphService = transitGraphService;
    }

    public Optional<GraphNode> resolve(Coordinate point) {
        if (point == null) {
            return Optional.empty();
        }
        TransitGraph graph = transitGraphService.getGraph();
        GraphNode nearest = null;
        double minDistance = Double.POSITIVE_INFINITY;
        for (GraphNode node : graph.nodes()) {
            double d = node.position.squaredDegreeDistanceTo(point);
            // 동률이면 먼저 나온 노드 유지
            if (d < minDistance) {
                minDistance = d;
                nearest = node;
            }
        }
        return Optional.ofNullable(nearest);
    }
}
