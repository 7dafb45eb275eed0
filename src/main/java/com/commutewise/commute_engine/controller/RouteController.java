package com.commutewise.commute_engine.controller;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.dto.LocationSuggestionDto;
import com.commutewise.commute_engine.dto.PlaceDto;
import com.commutewise.commute_engine.dto.ReverseGeocodeDto;
import com.commutewise.commute_engine.dto.RouteRequestDto;
import com.commutewise.commute_engine.dto.RouteVariantsDto;
import com.commutewise.commute_engine.dto.TerminalDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.service.CommuteRoutingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api")
public class RouteController {

    private final CommuteRoutingService routingService;

    @Autowired
    public RouteController(CommuteRoutingService routingService) {
        this.routingService = routingService;
    }

    @GetMapping("/terminals")
    public ResponseEntity<List<TerminalDto>> getTerminals() {
        return ResponseEntity.ok(routingService.getTerminals());
    }

    /**
     * 외부 API 없이 터미널/주소 목록에서 찾는 자동완성.
     */
    @GetMapping("/locations")
    public ResponseEntity<List<LocationSuggestionDto>> searchLocations(@RequestParam("query") String query) {
        return ResponseEntity.ok(routingService.searchLocations(query));
    }

    @GetMapping("/places")
    public ResponseEntity<List<PlaceDto>> searchPlaces(@RequestParam("query") String query) {
        return ResponseEntity.ok(routingService.search(query));
    }

    @GetMapping("/reverse-geocode")
    public ResponseEntity<ReverseGeocodeDto> reverseGeocode(@RequestParam("lat") double lat,
                                                            @RequestParam("lng") double lng) {
        return ResponseEntity.of(routingService.reverseGeocode(new Coordinate(lat, lng)));
    }

    /**
     * 정적 그래프 경로. 경로가 없으면 404 (화면에서 실패 메시지 표시).
     */
    @PostMapping("/routes/graph")
    public ResponseEntity<ItineraryDto> computeGraphRoute(@RequestBody RouteRequestDto request) {
        if (request.getStart() == null || request.getEnd() == null) {
            return ResponseEntity.badRequest().build();
        }
        Optional<ItineraryDto> route = routingService.computeGraphRoute(
                request.getStart(), request.getEnd(), request.getMetric());
        return ResponseEntity.of(route);
    }

    /**
     * 실시간 길찾기 + 세 가지 변형. 외부 API 실패 시 404 (화면에서 재시도 안내).
     */
    @PostMapping("/routes/live")
    public ResponseEntity<RouteVariantsDto> computeLiveRoute(@RequestBody RouteRequestDto request) {
        if (request.getStart() == null || request.getEnd() == null) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.of(routingService.computeLiveRoute(request.getStart(), request.getEnd()));
    }
}
