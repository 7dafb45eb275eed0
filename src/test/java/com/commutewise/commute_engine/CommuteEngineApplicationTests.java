package com.commutewise.commute_engine;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.RouteMetric;
import com.commutewise.commute_engine.service.CommuteRoutingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 전체 컨텍스트 기동 확인. 외부 API 는 호출하지 않는다.
 */
@SpringBootTest
class CommuteEngineApplicationTests {

    @Autowired
    private CommuteRoutingService routingService;

    @Test
    @DisplayName("컨텍스트가 뜨고 배포용 그래프로 경로를 계산한다")
    void contextLoadsWithShippedGraph() {
        assertEquals(5, routingService.getTerminals().size());

        ItineraryDto route = routingService.computeGraphRoute(
                new Coordinate(14.6741, 121.0359), new Coordinate(14.6575, 121.0580), RouteMetric.TIME)
                .orElseThrow();

        // 팔렝케 -> Commonwealth (지프니 20분) -> 테크노허브 (도보 5분)
        assertEquals(25, route.getTotalTimeMinutes());
        assertEquals(15, route.getTotalCost());
        assertEquals(3, route.getPath().size());
    }
}
