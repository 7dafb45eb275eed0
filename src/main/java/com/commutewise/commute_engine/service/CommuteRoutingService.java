package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.dto.LocationSuggestionDto;
import com.commutewise.commute_engine.dto.PlaceDto;
import com.commutewise.commute_engine.dto.ReverseGeocodeDto;
import com.commutewise.commute_engine.dto.RouteVariantsDto;
import com.commutewise.commute_engine.dto.TerminalDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.RouteMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * 화면(외부 UI)이 사용하는 경로/지오코딩 진입점.
 * 정적 그래프 경로, 실시간 길찾기 + 변형 생성, 장소 검색과 역지오코딩을 묶는다.
 */
@Service
public class CommuteRoutingService {

    private static final Logger log = LoggerFactory.getLogger(CommuteRoutingService.class);

    private final PathfinderService pathfinderService;
    private final RouteVariantService routeVariantService;
    private final OpenRouteServiceGateway gateway;
    private final TerminalDirectoryService terminalDirectoryService;
    private final TaskScheduler debounceScheduler;
    private final Duration quietPeriod;

    public CommuteRoutingService(PathfinderService pathfinderService, RouteVariantService routeVariantService,
                                 OpenRouteServiceGateway gateway, TerminalDirectoryService terminalDirectoryService,
                                 @Qualifier("debounceScheduler") TaskScheduler debounceScheduler,
                                 @Value("${debounce.quiet-period-ms:5000}") long quietPeriodMs) {
        this.pathfinderService = pathfinderService;
        this.routeVariantService = routeVariantService;
        this.gateway = gateway;
        this.terminalDirectoryService = terminalDirectoryService;
        this.debounceScheduler = debounceScheduler;
        this.quietPeriod = Duration.ofMillis(quietPeriodMs);
    }

    public Optional<ItineraryDto> computeGraphRoute(Coordinate start, Coordinate end, RouteMetric metric) {
        return pathfinderService.shortestPath(start, end, metric);
    }

    /**
     * 실시간 길찾기 결과 하나를 빠른/저렴한/짧은 세 가지로 확장한다.
     * 길찾기에 실패하면 빈 결과 (호출자가 재시도 안내를 띄운다).
     */
    public Optional<RouteVariantsDto> computeLiveRoute(Coordinate start, Coordinate end) {
        Optional<ItineraryDto> base = gateway.fetchDirections(start, end);
        if (base.isEmpty()) {
            log.info("[ROUTE LOG] 실시간 경로를 찾지 못했습니다: {} -> {}", start, end);
            return Optional.empty();
        }
        return Optional.of(routeVariantService.expand(base.get()));
    }

    public List<PlaceDto> search(String query) {
        return gateway.searchPlaces(query);
    }

    public Optional<ReverseGeocodeDto> reverseGeocode(Coordinate point) {
        return gateway.reverseGeocode(point);
    }

    public List<TerminalDto> getTerminals() {
        return terminalDirectoryService.getTerminals();
    }

    public List<LocationSuggestionDto> searchLocations(String query) {
        return terminalDirectoryService.searchLocations(query);
    }

    /**
     * 검색창 하나에 대한 디바운스 자동완성. 입력창마다 하나씩 만들어 쓴다.
     */
    public DebouncedLookup<String, List<PlaceDto>> placeSearchField(Consumer<List<PlaceDto>> onSuggestions) {
        return new DebouncedLookup<>(debounceScheduler, quietPeriod, gateway::searchPlaces, onSuggestions);
    }

    /**
     * 지도 이동이 멈춘 뒤 중심 좌표의 주소를 조회하는 디바운스 필드.
     */
    public DebouncedLookup<Coordinate, Optional<ReverseGeocodeDto>> mapCenterField(
            Consumer<Optional<ReverseGeocodeDto>> onAddress) {
        return new DebouncedLookup<>(debounceScheduler, quietPeriod, gateway::reverseGeocode, onAddress);
    }
}
