package com.ictskills.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Value;

/**
 * Mean growth of the five most and five least advanced countries.
 * A tier without growth data reports 0.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DigitalDivide {

    public static final DigitalDivide NONE = new DigitalDivide(0.0, 0.0);

    double topTierAvgGrowth;
    double bottomTierAvgGrowth;
}
