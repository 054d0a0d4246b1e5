package com.ictskills.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite natural key of {@link SkillRecordEntity}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkillRecordId implements Serializable {

    private String countryIsoCode;
    private Integer year;
}
