package com.ictskills.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One long-format survey row as read from the source file.
 *
 * The observed value is kept as raw text; numeric coercion belongs to the reshaper.
 */
@Value
@Builder
public class RawObservation {

    String entityCode;
    String entityLabel;
    String period;
    String skillCategory;
    String observedValue;
}
