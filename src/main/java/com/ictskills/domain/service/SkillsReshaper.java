package com.ictskills.domain.service;

import com.ictskills.domain.exception.DataSourceException;
import com.ictskills.domain.model.RawObservation;
import com.ictskills.domain.model.SkillRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pivots long-format survey observations into one {@link SkillRecord} per (entity, year).
 *
 * Transform Steps:
 * 1. Keep only BASIC and ABOVE_BASIC observations
 * 2. Coerce observed values to numbers (unparseable → missing)
 * 3. Group by (entity code, year); first label and first numeric value per category win
 * 4. Emit both percentage columns on every row, null where nothing was observed
 *
 * Missing values are left null here. The store turns them into 0 when it writes.
 */
@Slf4j
@Component
public class SkillsReshaper {

    public static final String BASIC = "BASIC";
    public static final String ABOVE_BASIC = "ABOVE_BASIC";

    private static final Set<String> RETAINED_CATEGORIES = Set.of(BASIC, ABOVE_BASIC);

    public List<SkillRecord> reshape(List<RawObservation> observations) {
        Map<String, PivotCell> cells = new LinkedHashMap<>();
        int retained = 0;

        for (RawObservation observation : observations) {
            String category = observation.getSkillCategory();
            if (category == null || !RETAINED_CATEGORIES.contains(category.trim())) {
                continue;
            }
            retained++;

            String code = observation.getEntityCode();
            int year = parsePeriod(observation);
            Double value = parseValue(observation.getObservedValue());

            PivotCell cell = cells.computeIfAbsent(code + "|" + year,
                    key -> new PivotCell(code, observation.getEntityLabel(), year));

            if (BASIC.equals(category.trim())) {
                cell.basic = merge(cell, category, cell.basic, value);
            } else {
                cell.aboveBasic = merge(cell, category, cell.aboveBasic, value);
            }
        }

        List<SkillRecord> records = new ArrayList<>(cells.size());
        for (PivotCell cell : cells.values()) {
            records.add(SkillRecord.builder()
                    .entityCode(cell.code)
                    .entityLabel(cell.label)
                    .year(cell.year)
                    .pctBasic(cell.basic)
                    .pctAboveBasic(cell.aboveBasic)
                    .build());
        }
        records.sort(Comparator.comparing(SkillRecord::getEntityCode, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
                .thenComparingInt(SkillRecord::getYear));

        log.info("Reshaped {} observations ({} retained) into {} records",
                observations.size(), retained, records.size());
        return records;
    }

    private Double merge(PivotCell cell, String category, Double current, Double incoming) {
        if (current == null) {
            return incoming;
        }
        if (incoming != null) {
            log.debug("Ignoring duplicate {} value {} for {}/{} (keeping {})",
                    category, incoming, cell.code, cell.year, current);
        }
        return current;
    }

    private int parsePeriod(RawObservation observation) {
        String period = observation.getPeriod();
        try {
            return Integer.parseInt(period == null ? "" : period.trim());
        } catch (NumberFormatException e) {
            throw new DataSourceException("Invalid period '" + period + "' for entity "
                    + observation.getEntityCode(), e);
        }
    }

    static Double parseValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            double value = new BigDecimal(raw.trim()).doubleValue();
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static final class PivotCell {
        private final String code;
        private final String label;
        private final int year;
        private Double basic;
        private Double aboveBasic;

        private PivotCell(String code, String label, int year) {
            this.code = code;
            this.label = label;
            this.year = year;
        }
    }
}
