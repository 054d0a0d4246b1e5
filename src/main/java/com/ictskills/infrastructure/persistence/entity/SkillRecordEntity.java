package com.ictskills.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One row of the normalized skills table.
 *
 * Keyed by (country_iso_code, year). The table is created outside this service;
 * Hibernate only validates it.
 *
 * Percentages are written as 0 when the source had no value, so readers never see null.
 */
@Entity
@Table(name = "ict_skills_stats", indexes = {
    @Index(name = "idx_skills_year", columnList = "year")
})
@IdClass(SkillRecordId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillRecordEntity {

    @Id
    @Column(name = "country_iso_code", nullable = false, columnDefinition = "TEXT")
    private String countryIsoCode;

    @Id
    @Column(name = "year", nullable = false)
    private Integer year;

    @Column(name = "country_name", nullable = false, columnDefinition = "TEXT")
    private String countryName;

    @Column(name = "pct_basic")
    private Double pctBasic;

    @Column(name = "pct_above_basic")
    private Double pctAboveBasic;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
