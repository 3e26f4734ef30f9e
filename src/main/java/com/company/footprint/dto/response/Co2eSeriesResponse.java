package com.company.footprint.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CO2e per period, one column per series. Series are ordered by total, largest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Co2eSeriesResponse {

    public static final String OTHERS = "Others";

    private String groupBy;
    private String unit;
    @Builder.Default
    private List<String> series = new ArrayList<>();
    @Builder.Default
    private List<Point> points = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Point {
        private LocalDate period;
        private Map<String, Double> values = new LinkedHashMap<>();
    }
}
