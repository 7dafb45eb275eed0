package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.config.OrsSettings;
import com.commutewise.commute_engine.dto.ItineraryDto;
import com.commutewise.commute_engine.dto.PlaceDto;
import com.commutewise.commute_engine.dto.ReverseGeocodeDto;
import com.commutewise.commute_engine.dto.RouteLegDto;
import com.commutewise.commute_engine.dto.ors.DirectionsResponse;
import com.commutewise.commute_engine.dto.ors.GeocodeResponse;
import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.RouteCategory;
import com.commutewise.commute_engine.model.TransportMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * OpenRouteService 연동 게이트웨이 (장소 검색, 역지오코딩, 길찾기).
 * <p>
 * 모든 호출은 공유 {@link GatewayRateLimiter}를 통과한다. 검색/길찾기는 1초, 역지오코딩은 0.5초 간격.
 * 통신/파싱 오류는 호출자에게 전달하지 않는다: 검색은 로컬 장소 목록, 역지오코딩은 좌표 라벨,
 * 길찾기는 빈 결과로 대체한다.
 */
@Service
public class OpenRouteServiceGateway {

    private static final Logger log = LoggerFactory.getLogger(OpenRouteServiceGateway.class);

    static final int MIN_QUERY_LENGTH = 3;
    static final String DIRECTIONS_PROFILE = "driving-car";

    // API 장애 시 검색 대체 데이터
    static final List<PlaceDto> FALLBACK_PLACES = List.of(
            new PlaceDto("Tandang Sora Palengke", "Tandang Sora Ave, Quezon City", 14.6741, 121.0359),
            new PlaceDto("Visayas Avenue Junction", "Visayas Ave, Quezon City", 14.6650, 121.0450),
            new PlaceDto("Commonwealth Market", "Commonwealth Ave, Quezon City", 14.6680, 121.0550),
            new PlaceDto("UP Ayala Technohub", "Commonwealth Ave, Diliman, QC", 14.6575, 121.0580),
            new PlaceDto("SM City North EDSA", "North Avenue, Quezon City", 14.6560, 121.0290),
            new PlaceDto("Trinoma Mall", "North Avenue, Quezon City", 14.6540, 121.0330),
            new PlaceDto("Quezon City Hall", "Kalayaan Ave, Quezon City", 14.6460, 121.0490),
            new PlaceDto("Iglesia Ni Cristo (Central)", "Commonwealth Ave, Quezon City", 14.6610, 121.0540),
            new PlaceDto("Culiat High School", "Tandang Sora Ave, Quezon City", 14.6620, 121.0500)
    );

    private final RestTemplate restTemplate;
    private final OrsSettings settings;
    private final GatewayRateLimiter rateLimiter;
    private final ItineraryIdGenerator idGenerator;

    public OpenRouteServiceGateway(@Qualifier("orsRestTemplate") RestTemplate restTemplate, OrsSettings settings,
                                   GatewayRateLimiter rateLimiter, ItineraryIdGenerator idGenerator) {
        this.restTemplate = restTemplate;
        this.settings = settings;
        this.rateLimiter = rateLimiter;
        this.idGenerator = idGenerator;
    }

    /**
     * 자유 텍스트 장소 검색. 3글자 미만이면 호출하지 않고 빈 목록.
     */
    public List<PlaceDto> searchPlaces(String query) {
        if (query == null || query.length() < MIN_QUERY_LENGTH) {
            return List.of();
        }

        try {
            throttle(settings.getThrottleInterval());
            URI uri = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                    .path("/geocode/search")
                    .queryParam("api_key", settings.getApiKey())
                    .queryParam("text", query)
                    .queryParam("boundary.country", settings.getCountry())
                    .queryParam("size", settings.getSearchSize())
                    .build()
                    .encode()
                    .toUri();

            GeocodeResponse body = restTemplate.getForObject(uri, GeocodeResponse.class);
            if (body == null || body.getFeatures() == null) {
                return List.of();
            }

            List<PlaceDto> places = new ArrayList<>();
            for (GeocodeResponse.Feature feature : body.getFeatures()) {
                places.add(toPlace(feature));
            }
            log.debug("[GATEWAY] 장소 검색 '{}' 결과 {}건", query, places.size());
            return places;
        } catch (RestClientException | GatewayUnavailableException e) {
            log.warn("[GATEWAY] 장소 검색 실패, 로컬 데이터로 대체합니다. query='{}', 원인: {}", query, e.getMessage());
            return fallbackSearch(query);
        }
    }

    /**
     * 좌표에 가장 가까운 장소 라벨. 실패하면 좌표 문자열 라벨로 대체되므로 입력이 있으면 항상 값이 있다.
     */
    public Optional<ReverseGeocodeDto> reverseGeocode(Coordinate position) {
        if (position == null) {
            return Optional.empty();
        }

        try {
            throttle(settings.getReverseThrottleInterval());
            URI uri = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                    .path("/geocode/reverse")
                    .queryParam("api_key", settings.getApiKey())
                    .queryParam("point.lat", position.lat)
                    .queryParam("point.lon", position.lng)
                    .queryParam("size", 1)
                    .queryParam("boundary.country", settings.getCountry())
                    .build()
                    .encode()
                    .toUri();

            GeocodeResponse body = restTemplate.getForObject(uri, GeocodeResponse.class);
            if (body == null || body.getFeatures() == null || body.getFeatures().isEmpty()) {
                return Optional.of(PlaceLabelPolicy.notFound());
            }
            return Optional.of(PlaceLabelPolicy.fromProperties(body.getFeatures().get(0).getProperties()));
        } catch (RestClientException | GatewayUnavailableException e) {
            log.warn("[GATEWAY] 역지오코딩 실패, 좌표 라벨로 대체합니다. position={}, 원인: {}", position, e.getMessage());
            return Optional.of(PlaceLabelPolicy.fromCoordinate(position));
        }
    }

    /**
     * 두 지점 간 실시간 길찾기. 실패하면 빈 결과이며 대체 경로는 없다.
     */
    public Optional<ItineraryDto> fetchDirections(Coordinate start, Coordinate end) {
        if (start == null || end == null) {
            return Optional.empty();
        }

        try {
            throttle(settings.getThrottleInterval());
            URI uri = UriComponentsBuilder.fromHttpUrl(settings.getBaseUrl())
                    .path("/v2/directions/{profile}/geojson")
                    .buildAndExpand(DIRECTIONS_PROFILE)
                    .toUri();

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.set(HttpHeaders.AUTHORIZATION, settings.getApiKey());

            Map<String, Object> requestBody = new LinkedHashMap<>();
            requestBody.put("coordinates", List.of(List.of(start.lng, start.lat), List.of(end.lng, end.lat)));
            requestBody.put("instructions", true);
            requestBody.put("language", "en");
            requestBody.put("units", "km");

            ResponseEntity<DirectionsResponse> response = restTemplate.exchange(
                    uri, HttpMethod.POST, new HttpEntity<>(requestBody, headers), DirectionsResponse.class);

            Optional<ItineraryDto> itinerary = toItinerary(response.getBody());
            log.info("[GATEWAY] 길찾기 {} -> {} 결과: {}", start, end, itinerary.map(Object::toString).orElse("없음"));
            return itinerary;
        } catch (RestClientException | GatewayUnavailableException e) {
            log.warn("[GATEWAY] 길찾기 실패: {} -> {} | 원인: {}", start, end, e.getMessage());
            return Optional.empty();
        }
    }

    private void throttle(Duration interval) {
        try {
            rateLimiter.acquire(interval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayUnavailableException("Interrupted while waiting for the call slot", e);
        }
    }

    private static PlaceDto toPlace(GeocodeResponse.Feature feature) {
        if (feature == null || feature.getGeometry() == null || feature.getProperties() == null) {
            throw new GatewayUnavailableException("Geocode feature without geometry or properties");
        }
        List<Double> coords = feature.getGeometry().getCoordinates();
        if (coords == null || coords.size() < 2 || coords.get(0) == null || coords.get(1) == null) {
            throw new GatewayUnavailableException("Geocode feature with malformed coordinates");
        }
        GeocodeResponse.Properties props = feature.getProperties();
        return new PlaceDto(props.getName(), props.getLabel(), coords.get(1), coords.get(0));
    }

    private Optional<ItineraryDto> toItinerary(DirectionsResponse body) {
        if (body == null || body.getFeatures() == null || body.getFeatures().isEmpty()) {
            return Optional.empty();
        }
        DirectionsResponse.Feature feature = body.getFeatures().get(0);
        if (feature == null || feature.getGeometry() == null || feature.getProperties() == null
                || feature.getProperties().getSummary() == null) {
            throw new GatewayUnavailableException("Directions feature without geometry or summary");
        }

        List<Coordinate> path = new ArrayList<>();
        List<List<Double>> vertices = feature.getGeometry().getCoordinates();
        if (vertices != null) {
            for (List<Double> vertex : vertices) {
                if (vertex == null || vertex.size() < 2 || vertex.get(0) == null || vertex.get(1) == null) {
                    throw new GatewayUnavailableException("Directions geometry with malformed vertex");
                }
                path.add(new Coordinate(vertex.get(1), vertex.get(0)));
            }
        }
        if (path.size() < 2) {
            // 꼭짓점이 두 개 미만이면 그릴 수 있는 경로가 아님
            return Optional.empty();
        }

        List<RouteLegDto> legs = new ArrayList<>();
        List<DirectionsResponse.Segment> segments = feature.getProperties().getSegments();
        if (segments != null) {
            for (DirectionsResponse.Segment segment : segments) {
                if (segment == null || segment.getSteps() == null) continue;
                for (DirectionsResponse.Step step : segment.getSteps()) {
                    if (step == null) {
                        throw new GatewayUnavailableException("Directions segment with an empty step");
                    }
                    List<Integer> wayPoints = step.getWayPoints();
                    if (wayPoints != null && wayPoints.contains(null)) {
                        throw new GatewayUnavailableException("Directions step with malformed way_points");
                    }
                    int from = wayPoints != null && wayPoints.size() > 0 ? wayPoints.get(0) : 0;
                    int to = wayPoints != null && wayPoints.size() > 1 ? wayPoints.get(1) : from;
                    legs.add(new RouteLegDto(
                            step.getInstruction(),
                            TransportMode.CAR,
                            Math.max(0, step.getDistance() * 1000), // km -> m
                            Math.max(0, step.getDuration()),
                            from, to));
                }
            }
        }

        DirectionsResponse.Summary summary = feature.getProperties().getSummary();
        if (summary.getDistance() == null || summary.getDuration() == null) {
            throw new GatewayUnavailableException("Directions summary without distance or duration");
        }
        double distanceKm = summary.getDistance();
        double durationSec = summary.getDuration();

        return Optional.of(new ItineraryDto(
                idGenerator.nextId(),
                Math.ceil(durationSec / 60),
                RouteVariantService.roundTwoDecimals(distanceKm),
                FareCalculator.fareFor(distanceKm),
                path,
                legs,
                RouteCategory.FASTEST,
                List.of("Fare", "Distance", "Time")));
    }

    private static List<PlaceDto> fallbackSearch(String query) {
        String lowerQuery = query.toLowerCase(Locale.ROOT);
        List<PlaceDto> matches = new ArrayList<>();
        for (PlaceDto place : FALLBACK_PLACES) {
            if (place.getName().toLowerCase(Locale.ROOT).contains(lowerQuery)
                    || place.getAddress().toLowerCase(Locale.ROOT).contains(lowerQuery)) {
                // 공유 목록의 객체를 내보내지 않는다
                matches.add(new PlaceDto(place.getName(), place.getAddress(), place.getLat(), place.getLng()));
            }
        }
        return matches;
    }
}
