package com.commutewise.commute_engine.controller;

import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.dto.LocationSuggestionDto;
import com.commutewise.commute_engine.dto.LocationSuggestionDto.SuggestionType;
import com.commutewise.commute_engine.dto.PlaceDto;
import com.commutewise.commute_engine.dto.ReverseGeocodeDto;
import com.commutewise.commute_engine.dto.RouteLegDto;
import com.commutewise.commute_engine.dto.RouteVariantsDto;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.RouteCategory;
import com.commutewise.commute_engine.model.RouteMetric;
import com.commutewise.commute_engine.model.TransportMode;
import com.commutewise.commute_engine.service.CommuteRoutingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class RouteControllerTest {

    private static final Coordinate PALENGKE = new Coordinate(14.6741, 121.0359);
    private static final Coordinate TECHNOHUB = new Coordinate(14.6575, 121.0580);

    private CommuteRoutingService routingService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        routingService = mock(CommuteRoutingService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new RouteController(routingService)).build();
    }

    private static ItineraryDto sampleRoute(String id) {
        return new ItineraryDto(id, 25, 4.5, 15, List.of(PALENGKE, TECHNOHUB),
                List.of(new RouteLegDto("Walk to UP Ayala Technohub", TransportMode.WALK, 1500, 300, 0, 1)),
                RouteCategory.FASTEST, List.of("Fastest"));
    }

    @Test
    @DisplayName("정적 그래프 경로 요청: 지표를 그대로 전달하고 경로를 JSON으로 응답")
    void graphRouteReturnsItinerary() throws Exception {
        when(routingService.computeGraphRoute(PALENGKE, TECHNOHUB, RouteMetric.COST))
                .thenReturn(Optional.of(sampleRoute("route-1")));

        mockMvc.perform(post("/api/routes/graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"start": {"lat": 14.6741, "lng": 121.0359},
                                 "end": {"lat": 14.6575, "lng": 121.0580},
                                 "metric": "COST"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("route-1"))
                .andExpect(jsonPath("$.totalTimeMinutes").value(25.0))
                .andExpect(jsonPath("$.path[1].lat").value(14.6575))
                .andExpect(jsonPath("$.legs[0].mode").value("WALK"))
                .andExpect(jsonPath("$.legs[0].wayPoints[1]").value(1))
                .andExpect(jsonPath("$.category").value("FASTEST"));
    }

    @Test
    @DisplayName("경로가 없으면 404")
    void graphRouteNotFound() throws Exception {
        when(routingService.computeGraphRoute(any(), any(), any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/routes/graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\": {\"lat\": 14.6741, \"lng\": 121.0359}, \"end\": {\"lat\": 14.6620, \"lng\": 121.0500}}"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("출발지나 도착지가 빠진 요청은 400")
    void missingEndpointIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/routes/graph")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\": {\"lat\": 14.6741, \"lng\": 121.0359}}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/routes/live")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"end\": {\"lat\": 14.6575, \"lng\": 121.0580}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(routingService);
    }

    @Test
    @DisplayName("실시간 경로 요청은 세 가지 변형을 응답, 실패하면 404")
    void liveRouteVariants() throws Exception {
        RouteVariantsDto variants = new RouteVariantsDto(
                sampleRoute("route-2_fast"), sampleRoute("route-2_cheap"), sampleRoute("route-2_short"));
        when(routingService.computeLiveRoute(PALENGKE, TECHNOHUB)).thenReturn(Optional.of(variants));

        String body = "{\"start\": {\"lat\": 14.6741, \"lng\": 121.0359}, \"end\": {\"lat\": 14.6575, \"lng\": 121.0580}}";
        mockMvc.perform(post("/api/routes/live").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fastest.id").value("route-2_fast"))
                .andExpect(jsonPath("$.cheapest.id").value("route-2_cheap"))
                .andExpect(jsonPath("$.shortest.id").value("route-2_short"));

        when(routingService.computeLiveRoute(PALENGKE, TECHNOHUB)).thenReturn(Optional.empty());
        mockMvc.perform(post("/api/routes/live").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("역지오코딩은 좌표로 라벨을 응답")
    void reverseGeocode() throws Exception {
        when(routingService.reverseGeocode(PALENGKE))
                .thenReturn(Optional.of(new ReverseGeocodeDto("Tandang Sora", "Tandang Sora Palengke")));

        mockMvc.perform(get("/api/reverse-geocode").param("lat", "14.6741").param("lng", "121.0359"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shortName").value("Tandang Sora"))
                .andExpect(jsonPath("$.areaLabel").value("Tandang Sora Palengke"));
    }

    @Test
    @DisplayName("장소 검색과 로컬 위치 검색")
    void searches() throws Exception {
        when(routingService.search("Trinoma"))
                .thenReturn(List.of(new PlaceDto("Trinoma Mall", "North Avenue, Quezon City", 14.6540, 121.0330)));
        when(routingService.searchLocations("Culiat"))
                .thenReturn(List.of(new LocationSuggestionDto("Culiat Tricycle Toda",
                        "Culiat High School, Tandang Sora Ave, Quezon City, 1128 Metro Manila", SuggestionType.TERMINAL)));

        mockMvc.perform(get("/api/places").param("query", "Trinoma"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Trinoma Mall"))
                .andExpect(jsonPath("$[0].lng").value(121.0330));
        mockMvc.perform(get("/api/locations").param("query", "Culiat"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("TERMINAL"));
    }

    @Test
    @DisplayName("터미널 목록")
    void terminals() throws Exception {
        when(routingService.getTerminals()).thenReturn(List.of());

        mockMvc.perform(get("/api/terminals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray());
    }
}
