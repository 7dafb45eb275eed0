package com.commutewise.commute_engine.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

public class TransitGraphTest {

    private static final Coordinate A = new Coordinate(14.0, 121.0);
    private static final Coordinate B = new Coordinate(14.1, 121.1);

    @Test
    @DisplayName("간선은 대상 노드의 아레나 인덱스를 가지며 노드 순서는 등록 순서를 따른다")
    void edgesPointToArenaIndices() {
        TransitGraph graph = TransitGraph.builder()
                .addNode("b", "B", "addr b", B, TerminalCategory.BUS)
                .addNode("a", "A", "addr a", A, null)
                .addEdge("b", "a", 1.0, 2.0, 3.0, EdgeMode.WALK, null)
                .build();

        assertEquals(2, graph.size());
        assertEquals("b", graph.node(0).id);
        assertEquals("a", graph.node(1).id);
        assertEquals(1, graph.node(0).edges.get(0).targetIndex);
        // 지정하지 않은 터미널 종류는 MIXED
        assertEquals(TerminalCategory.MIXED, graph.node(1).terminalCategory);
        assertEquals(1, graph.findById("a").orElseThrow().index);
        assertTrue(graph.findById("missing").isEmpty());
    }

    @Test
    @DisplayName("간선은 방향성을 가진다: A->B 가 있어도 B->A 는 생기지 않는다")
    void edgesAreDirected() {
        TransitGraph graph = TransitGraph.builder()
                .addNode("a", "A", "", A, TerminalCategory.JEEP)
                .addNode("b", "B", "", B, TerminalCategory.JEEP)
                .addEdge("a", "b", 1, 1, 1, EdgeMode.RIDE, "JEEP")
                .build();

        assertEquals(1, graph.findById("a").orElseThrow().edges.size());
        assertTrue(graph.findById("b").orElseThrow().edges.isEmpty());
    }

    @Test
    @DisplayName("중복 id, 알 수 없는 대상, 위치 없는 노드는 그래프 생성 단계에서 거부된다")
    void rejectsMalformedDefinitions() {
        assertThrows(IllegalStateException.class, () -> TransitGraph.builder()
                .addNode("a", "A", "", A, null)
                .addNode("a", "A2", "", B, null));

        assertThrows(IllegalStateException.class, () -> TransitGraph.builder()
                .addNode("a", "A", "", A, null)
                .addEdge("a", "nowhere", 1, 1, 1, EdgeMode.RIDE, "BUS")
                .build());

        assertThrows(IllegalStateException.class, () -> TransitGraph.builder()
                .addNode("a", "A", "", null, null));
    }

    @Test
    @DisplayName("차량 종류 문자열은 이동 수단으로 변환되고, 모르는 값은 CAR 가 된다")
    void vehicleKindMapsToTransportMode() {
        assertEquals(TransportMode.JEEP, TransportMode.fromVehicleKind("JEEP"));
        assertEquals(TransportMode.E_JEEP, TransportMode.fromVehicleKind("e_jeep"));
        assertEquals(TransportMode.CAR, TransportMode.fromVehicleKind("FERRY"));
        assertEquals(TransportMode.CAR, TransportMode.fromVehicleKind(null));
    }

    @Test
    @DisplayName("소문자 차량 종류는 기본 로케일과 관계없이 변환된다 (터키어 로케일)")
    void vehicleKindIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(TransportMode.TRICYCLE, TransportMode.fromVehicleKind("tricycle"));
            assertEquals(TransportMode.MIXED, TransportMode.fromVehicleKind("mixed"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("범위를 벗어난 좌표도 그대로 보존된다")
    void outOfRangeCoordinatesArePreserved() {
        Coordinate odd = new Coordinate(123.0, -200.0);

        assertEquals(123.0, odd.lat);
        assertEquals(-200.0, odd.lng);
        assertFalse(odd.isWithinRange());
        assertTrue(A.isWithinRange());
        assertEquals(new Coordinate(14.0, 121.0), A);
    }
}
