package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.GraphFileDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.TransitGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * 프로세스 시작 시 classpath 리소스에서 환승 그래프를 한 번 읽어 보관한다.
 * 이후 그래프는 변경되지 않는다.
 */
@Service
public class TransitGraphService {

    private static final Logger log = LoggerFactory.getLogger(TransitGraphService.class);

    private final TransitGraph graph;

    @Autowired
    public TransitGraphService(@Value("${graph.resource:graph/tandang_sora.json}") String graphResource,
                               ObjectMapper objectMapper) {
        this.graph = loadGraph(graphResource, objectMapper);
    }

    public TransitGraphService(TransitGraph graph) {
        this.graph = graph;
    }

    public TransitGraph getGraph() {
        return graph;
    }

    private static TransitGraph loadGraph(String graphResource, ObjectMapper objectMapper) {
        GraphFileDto definition;
        try (InputStream inputStream = new ClassPathResource(graphResource).getInputStream()) {
            definition = objectMapper.readValue(inputStream, GraphFileDto.class);
        } catch (IOException e) {
            // 읽기 실패는 기동 실패
            throw new IllegalStateException("Failed to read transit graph resource " + graphResource, e);
        }

        TransitGraph graph = toGraph(definition);
        log.info("[GRAPH LOG] {} 로부터 노드 {}개를 로드했습니다.", graphResource, graph.size());
        return graph;
    }

    static TransitGraph toGraph(GraphFileDto definition) {
        TransitGraph.Builder builder = TransitGraph.builder();
        if (definition == null || definition.getNodes() == null) {
            return builder.build();
        }
        for (GraphFileDto.NodeEntry node : definition.getNodes()) {
            if (node.getLat() == null || node.getLng() == null) {
                throw new IllegalStateException("Graph node " + node.getId() + " has no position");
            }
            builder.addNode(node.getId(), node.getName(), node.getAddress(),
                    new Coordinate(node.getLat(), node.getLng()), node.getTerminalType());
        }
        // 간선은 모든 노드를 등록한 뒤 추가해야 대상 id를 검증할 수 있다
        for (GraphFileDto.NodeEntry node : definition.getNodes()) {
            if (node.getConnections() == null) continue;
            for (GraphFileDto.ConnectionEntry c : node.getConnections()) {
                builder.addEdge(node.getId(), c.getTargetId(), c.getDistanceKm(), c.getTimeMin(), c.getCost(),
                        c.getType(), c.getVehicleType());
            }
        }
        return builder.build();
    }
}
