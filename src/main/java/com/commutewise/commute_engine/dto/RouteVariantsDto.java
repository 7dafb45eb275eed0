package com.commutewise.commute_engine.dto;

import java.util.List;

public class RouteVariantsDto {
    private final ItineraryDto fastest;
    private final ItineraryDto cheapest;
    private final ItineraryDto shortest;

    public RouteVariantsDto(ItineraryDto fastest, ItineraryDto cheapest, ItineraryDto shortest) {
        this.fastest = fastest;
        this.cheapest = cheapest;
        this.shortest = shortest;
    }

    public ItineraryDto getFastest() { return fastest; }
    public ItineraryDto getCheapest() { return cheapest; }
    public ItineraryDto getShortest() { return shortest; }

    // 화면에 보여주는 순서 (빠른, 저렴한, 짧은)
    public List<ItineraryDto> asList() {
        return List.of(fastest, cheapest, shortest);
    }
}
