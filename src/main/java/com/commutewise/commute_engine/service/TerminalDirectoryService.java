package com.commutewise.commute_engine.service;

import com.commutewise.commute_engine.dto.LocationSuggestionDto;
import com.commutewise.commute_engine.dto.LocationSuggestionDto.SuggestionType;
import com.commutewise.commute_engine.dto.TerminalDto;
import com.commutewise.commute_engine.model.GraphNode;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 터미널 목록과 외부 API 없이 동작하는 로컬 위치 검색.
 */
@Service
public class TerminalDirectoryService {

    static final double DEFAULT_RATING = 4.5;
    static final int MIN_QUERY_LENGTH = 2;

    // 자동완성용 주소 목록
    static final List<String> KNOWN_STREETS = List.of(
            "1 Sampaguita Ave, Quezon City, 1107 Metro Manila",
            "25 Banlat Road, Tandang Sora, Quezon City, 1116 Metro Manila",
            "St. James College, Mindanao Ave, Quezon City, 1100 Metro Manila",
            "Cherry Foodarama, Congressional Ave, Quezon City, 1100 Metro Manila",
            "Project 6, Quezon City, 1100 Metro Manila",
            "SM City North EDSA, North Avenue, corner Epifanio de los Santos Ave, Quezon City, 1100 Metro Manila"
    );

    private final TransitGraphService transitGraphService;

    public TerminalDirectoryService(TransitGraphService transitGraphService) {
        this.transitGraphService = transitGraphService;
    }

    public List<TerminalDto> getTerminals() {
        return transitGraphService.getGraph().nodes().stream()
                .map(node -> new TerminalDto(node.id, node.name, node.address, node.position,
                        node.terminalCategory, DEFAULT_RATING, node.edges.size()))
                .collect(Collectors.toList());
    }

    /**
     * 터미널(이름/주소)을 먼저, 그다음 주소 목록을 대소문자 구분 없이 부분 일치로 찾는다.
     */
    public List<LocationSuggestionDto> searchLocations(String query) {
        if (query == null || query.length() < MIN_QUERY_LENGTH) {
            return List.of();
        }
        String lowerQuery = query.toLowerCase(Locale.ROOT);
        List<LocationSuggestionDto> results = new ArrayList<>();

        for (GraphNode node : transitGraphService.getGraph().nodes()) {
            if (contains(node.name, lowerQuery) || contains(node.address, lowerQuery)) {
                results.add(new LocationSuggestionDto(node.name, node.address, SuggestionType.TERMINAL));
            }
        }

        for (String street : KNOWN_STREETS) {
            if (contains(street, lowerQuery)) {
                String name = street.split(",")[0];
                results.add(new LocationSuggestionDto(name, street, SuggestionType.LOCATION));
            }
        }
        return results;
    }

    private static boolean contains(String text, String lowerQuery) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerQuery);
    }
}
