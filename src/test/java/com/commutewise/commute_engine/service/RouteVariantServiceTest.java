package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.dto.RouteLegDto;
import com.commutewise.commute_engine.dto.RouteVariantsDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.RouteCategory;
import com.commutewise.commute_engine.model.TransportMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RouteVariantServiceTest {

    private final RouteVariantService variantService = new RouteVariantService();

    private static ItineraryDto base(double timeMin, double distanceKm, double cost) {
        return new ItineraryDto("route-1", timeMin, distanceKm, cost,
                List.of(new Coordinate(14.6741, 121.0359), new Coordinate(14.6575, 121.0580)),
                List.of(new RouteLegDto("Head north", TransportMode.CAR, 6000, 900, 0, 1)),
                RouteCategory.FASTEST, List.of("Fare", "Distance", "Time"));
    }

    @Test
    @DisplayName("빠른/저렴한/짧은 변형의 요약 값과 id 접미사가 정해진 규칙을 따른다")
    void expandsIntoThreeVariants() {
        RouteVariantsDto variants = variantService.expand(base(15, 6.0, 33));

        ItineraryDto fastest = variants.getFastest();
        assertEquals("route-1_fast", fastest.getId());
        assertEquals(RouteCategory.FASTEST, fastest.getCategory());
        assertEquals(15, fastest.getTotalTimeMinutes());
        assertEquals(33, fastest.getTotalCost());
        assertEquals(List.of("Fastest", "Comfort"), fastest.getLabels());

        ItineraryDto cheapest = variants.getCheapest();
        assertEquals("route-1_cheap", cheapest.getId());
        assertEquals(RouteCategory.CHEAPEST, cheapest.getCategory());
        assertEquals(23, cheapest.getTotalCost());          // floor(33 * 0.7)
        assertEquals(20, cheapest.getTotalTimeMinutes());   // ceil(15 * 1.3)
        assertEquals(6.0, cheapest.getTotalDistanceKm());
        assertEquals(List.of("Budget", "Saver"), cheapest.getLabels());

        ItineraryDto shortest = variants.getShortest();
        assertEquals("route-1_short", shortest.getId());
        assertEquals(RouteCategory.SHORTEST, shortest.getCategory());
        assertEquals(5.7, shortest.getTotalDistanceKm());   // 6.0 * 0.95
        assertEquals(17, shortest.getTotalTimeMinutes());   // ceil(15 * 1.1)
        assertEquals(33, shortest.getTotalCost());
        assertEquals(List.of("Eco", "Direct"), shortest.getLabels());

        assertEquals(List.of(fastest, cheapest, shortest), variants.asList());
    }

    @Test
    @DisplayName("저렴한 변형의 요금은 13 아래로 내려가지 않는다")
    void cheapestFareFloor() {
        ItineraryDto cheapest = variantService.expand(base(15, 6.0, 17)).getCheapest();

        assertEquals(13, cheapest.getTotalCost());
    }

    @Test
    @DisplayName("세 변형 모두 기본 경로의 path 와 legs 를 그대로 공유한다")
    void variantsSharePathAndLegs() {
        ItineraryDto base = base(15, 6.0, 33);
        RouteVariantsDto variants = variantService.expand(base);

        for (ItineraryDto variant : variants.asList()) {
            assertSame(base.getPath(), variant.getPath());
            assertSame(base.getLegs(), variant.getLegs());
        }
    }

    @Test
    @DisplayName("저렴한 변형은 요금 감소/시간 증가, 짧은 변형은 거리 감소/시간 증가")
    void variantMonotonicity() {
        double[][] samples = {
                {15, 6.0, 33}, {40, 6.5, 33}, {25, 4.5, 15}, {7, 1.23, 13}, {93, 31.17, 68}, {1, 0.01, 100}
        };
        for (double[] s : samples) {
            ItineraryDto base = base(s[0], s[1], s[2]);
            RouteVariantsDto variants = variantService.expand(base);

            assertTrue(variants.getCheapest().getTotalCost() <= base.getTotalCost());
            assertTrue(variants.getCheapest().getTotalCost() >= 13);
            assertTrue(variants.getCheapest().getTotalTimeMinutes() >= base.getTotalTimeMinutes());
            assertTrue(variants.getShortest().getTotalDistanceKm() <= base.getTotalDistanceKm());
            assertTrue(variants.getShortest().getTotalTimeMinutes() >= base.getTotalTimeMinutes());
        }
    }
}
