package com.commutewise.commute_engine.dto;

import com.commutewise.commute_engine.model.Coordinate;
import com.commutewise.commute_engine.model.RouteMetric;

public class RouteRequestDto {
    private Coordinate start;
    private Coordinate end;
    private RouteMetric metric; // 라이브 경로에서는 무시됨

    // 1. 기본 생성자
    public RouteRequestDto() {}

    // 2. 테스트/내부 호출용 생성자
    public RouteRequestDto(Coordinate start, Coordinate end, RouteMetric metric) {
        this.start = start;
        this.end = end;
        this.metric = metric;
    }

    // --- Getters and Setters ---
    public Coordinate getStart() { return start; }
    public void setStart(Coordinate start) { this.start = start; }
    public Coordinate getEnd() { return end; }
    public void setEnd(Coordinate end) { this.end = end; }
    public RouteMetric getMetric() { return metric; }
    public void setMetric(RouteMetric metric) { this.metric = metric; }
}
