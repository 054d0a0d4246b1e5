package com.ictskills.config;

import com.ictskills.domain.service.RegionCatalog;
import com.ictskills.domain.service.SkillsDashboardCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AnalyticsConfig {

    @Bean
    public RegionCatalog regionCatalog() {
        return RegionCatalog.defaults();
    }

    @Bean
    public SkillsDashboardCalculator skillsDashboardCalculator(RegionCatalog regionCatalog) {
        return new SkillsDashboardCalculator(regionCatalog);
    }
}
