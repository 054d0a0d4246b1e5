package com.ictskills.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Dashboard payload for one year range.
 *
 * Every section is always present. When the range holds no data the lists
 * and the trend map are empty, the divide is zero and snapshotYear is null.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DashboardResponse {

    int startYear;
    int endYear;
    Integer snapshotYear;

    @Builder.Default
    List<TopAdvancedEntry> topAdvanced = Collections.emptyList();

    @Builder.Default
    DigitalDivide digitalDivide = DigitalDivide.NONE;

    @Builder.Default
    List<CorrelationPoint> correlation = Collections.emptyList();

    @Builder.Default
    List<DepthLeader> depthLeaders = Collections.emptyList();

    @Builder.Default
    Map<String, List<TrendPoint>> regionalTrends = Collections.emptyMap();

    public static DashboardResponse empty(DashboardQuery query) {
        return DashboardResponse.builder()
                .startYear(query.getStartYear())
                .endYear(query.getEndYear())
                .build();
    }
}
