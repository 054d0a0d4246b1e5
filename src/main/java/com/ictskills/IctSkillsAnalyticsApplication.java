package com.ictskills;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * ICT Skills Analytics Backend
 *
 * Loads the ITU digital-skills survey into a normalized table and serves
 * dashboard aggregates computed on demand.
 *
 * Architecture:
 * - ETL: CSV extract, pivot to one row per (entity, year), upsert
 * - Queued ETL runs processed by a scheduled poller
 * - Dashboard: rankings, growth, digital divide, correlation, trend series
 * - Every query recomputes from the full table; no aggregate is stored
 */
@SpringBootApplication
@EnableScheduling
public class IctSkillsAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(IctSkillsAnalyticsApplication.class, args);
    }
}
