package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.dto.RouteVariantsDto;
import com.commutewise.commute_engine.model.RouteCategory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 계산된 경로 하나로 빠른/저렴한/짧은 세 가지 선택지를 만든다.
 * 경로를 다시 탐색하지 않고 요약 값만 고정 비율로 조정하며, path와 legs는 그대로 공유한다.
 */
@Service
public class RouteVariantService {

    static final double MIN_FARE = 13;
    static final double CHEAP_COST_FACTOR = 0.7;
    static final double CHEAP_TIME_FACTOR = 1.3;
    static final double SHORT_DISTANCE_FACTOR = 0.95;
    static final double SHORT_TIME_FACTOR = 1.1;

    public RouteVariantsDto expand(ItineraryDto base) {
        ItineraryDto fastest = base.derive(
                base.getId() + "_fast",
                base.getTotalTimeMinutes(),
                base.getTotalDistanceKm(),
                base.getTotalCost(),
                RouteCategory.FASTEST,
                List.of("Fastest", "Comfort"));

        ItineraryDto cheapest = base.derive(
                base.getId() + "_cheap",
                Math.ceil(base.getTotalTimeMinutes() * CHEAP_TIME_FACTOR),
                base.getTotalDistanceKm(),
                Math.max(MIN_FARE, Math.floor(base.getTotalCost() * CHEAP_COST_FACTOR)),
                RouteCategory.CHEAPEST,
                List.of("Budget", "Saver"));

        ItineraryDto shortest = base.derive(
                base.getId() + "_short",
                Math.ceil(base.getTotalTimeMinutes() * SHORT_TIME_FACTOR),
                roundTwoDecimals(base.getTotalDistanceKm() * SHORT_DISTANCE_FACTOR),
                base.getTotalCost(),
                RouteCategory.SHORTEST,
                List.of("Eco", "Direct"));

        return new RouteVariantsDto(fastest, cheapest, shortest);
    }

    static double roundTwoDecimals(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
