package com.ictskills.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * Basic vs above-basic pair for the scatter chart.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CorrelationPoint {

    String countryName;
    double pctBasic;
    double pctAboveBasic;
}
