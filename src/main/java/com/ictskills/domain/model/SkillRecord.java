package com.ictskills.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Normalized skill percentages for one entity in one year.
 *
 * Natural key is (entityCode, year). Percentages are null only between the
 * reshaper and the store; persisted records always carry a number.
 */
@Value
@Builder
public class SkillRecord {

    String entityCode;
    String entityLabel;
    int year;
    Double pctBasic;
    Double pctAboveBasic;
}
