package com.ictskills.domain.service;

import com.ictskills.domain.model.DashboardQuery;
import com.ictskills.domain.model.DashboardResult;
import com.ictskills.domain.model.SkillRecord;
import com.ictskills.infrastructure.persistence.SkillRecordStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Dashboard query service.
 *
 * Query Flow:
 * 1. Load the full skills table
 * 2. Recompute every aggregate for the requested range
 * 3. Record metrics and return the result
 *
 * Nothing is cached: the table is small and each request recomputes from scratch.
 * A store failure is turned into a DATA_SOURCE error result instead of propagating,
 * so the presentation layer can render a degraded state.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final SkillRecordStore skillRecordStore;
    private final SkillsDashboardCalculator calculator;
    private final MeterRegistry meterRegistry;

    public DashboardResult getDashboard(DashboardQuery query) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();

        DashboardResult result;
        try {
            List<SkillRecord> records = skillRecordStore.readAll();
            result = calculator.compute(records, query);

        } catch (Exception e) {
            log.error("Error loading skill records: {}", e.getMessage(), e);
            result = DashboardResult.failure(DashboardResult.ErrorKind.DATA_SOURCE,
                    "Unable to load skill records: " + e.getMessage());
        }

        sample.stop(Timer.builder("dashboard.latency")
                .tag("form", query.isSingleYear() ? "year" : "range")
                .register(meterRegistry));

        Counter.builder("dashboard.query")
                .tag("result", result.isOk() ? "ok" : result.getErrorKind().name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();

        if (result.isOk()) {
            log.info("Dashboard computed for {}-{} (snapshot {}): {} ms",
                    query.getStartYear(), query.getEndYear(),
                    result.getResponse().getSnapshotYear(), System.currentTimeMillis() - startTime);
        } else {
            log.warn("Dashboard query {}-{} failed [{}]: {}",
                    query.getStartYear(), query.getEndYear(), result.getErrorKind(), result.getErrorMessage());
        }
        return result;
    }
}
