package com.ictskills.domain.service;

import com.ictskills.domain.exception.ComputationException;
import com.ictskills.domain.model.CorrelationPoint;
import com.ictskills.domain.model.DashboardQuery;
import com.ictskills.domain.model.DashboardResponse;
import com.ictskills.domain.model.DashboardResult;
import com.ictskills.domain.model.DepthLeader;
import com.ictskills.domain.model.DigitalDivide;
import com.ictskills.domain.model.SkillRecord;
import com.ictskills.domain.model.TopAdvancedEntry;
import com.ictskills.domain.model.TrendPoint;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Computes the dashboard aggregates from the full normalized table.
 *
 * Computation Flow:
 * 1. Coerce percentages (missing → 0) and derive the skill-depth ratio
 * 2. Restrict to the requested year range
 * 3. Pick the snapshot year: end year if it has data, else the latest year in range
 * 4. Split countries from aggregate regions
 * 5. Growth per country between the requested start and end years
 * 6. Snapshot sections: top advanced, digital divide, correlation, depth leaders
 * 7. Trend sections over the whole range: global, frontier, emerging, regions
 *
 * Stateless and total. Any failure comes back as {@link DashboardResult#failure}.
 */
@Slf4j
public class SkillsDashboardCalculator {

    public static final String GLOBAL_AVERAGE = "Global Average";
    public static final String FRONTIER_TREND = "Frontier (Top 10)";
    public static final String EMERGING_TREND = "Emerging (Bottom 10)";

    static final int RANKING_SIZE = 10;
    static final int TIER_SIZE = 5;
    static final int MIN_REGION_POINTS = 2;

    private static final Comparator<ScoredRecord> BY_ABOVE_BASIC =
            Comparator.comparingDouble(ScoredRecord::getPctAboveBasic);

    private final RegionCatalog regionCatalog;

    public SkillsDashboardCalculator(RegionCatalog regionCatalog) {
        this.regionCatalog = Objects.requireNonNull(regionCatalog, "regionCatalog");
    }

    public DashboardResult compute(List<SkillRecord> records, DashboardQuery query) {
        if (query == null) {
            return DashboardResult.failure(DashboardResult.ErrorKind.INVALID_QUERY, "No dashboard query given");
        }
        if (query.getStartYear() > query.getEndYear()) {
            return DashboardResult.failure(DashboardResult.ErrorKind.INVALID_QUERY,
                    "start_year " + query.getStartYear() + " is after end_year " + query.getEndYear());
        }

        try {
            return DashboardResult.ok(assemble(records == null ? List.of() : records, query));

        } catch (ComputationException e) {
            log.warn("Dashboard computation rejected for {}-{}: {}",
                    query.getStartYear(), query.getEndYear(), e.getMessage());
            return DashboardResult.failure(DashboardResult.ErrorKind.COMPUTATION, e.getMessage());

        } catch (RuntimeException e) {
            log.error("Dashboard computation failed for {}-{}: {}",
                    query.getStartYear(), query.getEndYear(), e.getMessage(), e);
            return DashboardResult.failure(DashboardResult.ErrorKind.COMPUTATION,
                    "Dashboard computation failed: " + e.getMessage());
        }
    }

    private DashboardResponse assemble(List<SkillRecord> records, DashboardQuery query) {
        List<ScoredRecord> scored = score(records);
        List<ScoredRecord> inRange = restrict(scored, query);

        if (inRange.isEmpty()) {
            log.debug("No records between {} and {}", query.getStartYear(), query.getEndYear());
            return DashboardResponse.empty(query);
        }

        int snapshotYear = snapshotYear(inRange, query.getEndYear());
        List<ScoredRecord> countries = select(inRange, r -> regionCatalog.isCountry(r.getEntityCode()));
        List<ScoredRecord> regions = select(inRange, r -> regionCatalog.isRegion(r.getEntityCode()));
        List<ScoredRecord> snapshot = select(countries, r -> r.getYear() == snapshotYear);

        Map<String, Double> growth = query.isSingleYear()
                ? sequentialGrowthAt(select(scored, r -> regionCatalog.isCountry(r.getEntityCode())), snapshotYear)
                : rangeGrowth(countries, query);

        return DashboardResponse.builder()
                .startYear(query.getStartYear())
                .endYear(query.getEndYear())
                .snapshotYear(snapshotYear)
                .topAdvanced(topAdvanced(snapshot))
                .digitalDivide(digitalDivide(snapshot, growth))
                .correlation(correlation(snapshot))
                .depthLeaders(depthLeaders(snapshot))
                .regionalTrends(trends(countries, regions))
                .build();
    }

    // Preparation

    private List<ScoredRecord> score(List<SkillRecord> records) {
        List<ScoredRecord> scored = new ArrayList<>(records.size());
        for (SkillRecord record : records) {
            if (record == null) {
                continue;
            }
            double basic = SkillMetrics.coerce(record.getPctBasic());
            double aboveBasic = SkillMetrics.coerce(record.getPctAboveBasic());
            String label = record.getEntityLabel() != null ? record.getEntityLabel() : record.getEntityCode();
            scored.add(new ScoredRecord(record.getEntityCode(), label, record.getYear(),
                    basic, aboveBasic, SkillMetrics.skillDepthRatio(basic, aboveBasic)));
        }
        return scored;
    }

    private List<ScoredRecord> restrict(List<ScoredRecord> scored, DashboardQuery query) {
        List<ScoredRecord> inRange = select(scored, r -> query.contains(r.getYear()));
        Set<String> keys = new HashSet<>();
        for (ScoredRecord record : inRange) {
            if (!keys.add(record.getEntityCode() + "|" + record.getYear())) {
                throw new ComputationException("Duplicate record for entity "
                        + record.getEntityCode() + " in " + record.getYear());
            }
        }
        return inRange;
    }

    static int snapshotYear(List<ScoredRecord> inRange, int endYear) {
        int latest = Integer.MIN_VALUE;
        for (ScoredRecord record : inRange) {
            if (record.getYear() == endYear) {
                return endYear;
            }
            latest = Math.max(latest, record.getYear());
        }
        return latest;
    }

    // Growth

    private Map<String, Double> rangeGrowth(List<ScoredRecord> countries, DashboardQuery query) {
        Map<String, Double> startValues = new HashMap<>();
        Map<String, Double> endValues = new HashMap<>();
        for (ScoredRecord record : countries) {
            if (record.getYear() == query.getStartYear()) {
                startValues.put(record.getEntityCode(), record.getPctAboveBasic());
            }
            if (record.getYear() == query.getEndYear()) {
                endValues.put(record.getEntityCode(), record.getPctAboveBasic());
            }
        }

        Set<String> codes = new HashSet<>(startValues.keySet());
        codes.addAll(endValues.keySet());

        Map<String, Double> growth = new HashMap<>();
        for (String code : codes) {
            growth.put(code, SkillMetrics.rangeGrowth(startValues.get(code), endValues.get(code)));
        }
        return growth;
    }

    private Map<String, Double> sequentialGrowthAt(List<ScoredRecord> countries, int year) {
        Map<String, List<ScoredRecord>> byEntity = countries.stream()
                .collect(Collectors.groupingBy(ScoredRecord::getEntityCode, LinkedHashMap::new, Collectors.toList()));

        Map<String, Double> growth = new HashMap<>();
        for (Map.Entry<String, List<ScoredRecord>> entry : byEntity.entrySet()) {
            List<ScoredRecord> history = new ArrayList<>(entry.getValue());
            history.sort(Comparator.comparingInt(ScoredRecord::getYear));

            List<Double> values = history.stream().map(ScoredRecord::getPctAboveBasic).collect(Collectors.toList());
            List<Double> changes = SkillMetrics.sequentialGrowth(values);
            for (int i = 0; i < history.size(); i++) {
                if (history.get(i).getYear() == year) {
                    growth.put(entry.getKey(), changes.get(i));
                }
            }
        }
        return growth;
    }

    // Snapshot sections

    private List<TopAdvancedEntry> topAdvanced(List<ScoredRecord> snapshot) {
        return largest(snapshot, BY_ABOVE_BASIC, RANKING_SIZE).stream()
                .map(r -> new TopAdvancedEntry(r.getEntityLabel(), r.getPctAboveBasic()))
                .collect(Collectors.toList());
    }

    private DigitalDivide digitalDivide(List<ScoredRecord> snapshot, Map<String, Double> growth) {
        List<ScoredRecord> topTier = largest(snapshot, BY_ABOVE_BASIC, TIER_SIZE);
        List<ScoredRecord> bottomTier = smallest(snapshot, BY_ABOVE_BASIC, TIER_SIZE);
        return new DigitalDivide(tierGrowth(topTier, growth), tierGrowth(bottomTier, growth));
    }

    private double tierGrowth(List<ScoredRecord> tier, Map<String, Double> growth) {
        List<Double> values = new ArrayList<>();
        for (ScoredRecord record : tier) {
            Double value = growth.get(record.getEntityCode());
            if (value != null) {
                values.add(value);
            }
        }
        return SkillMetrics.mean(values);
    }

    private List<CorrelationPoint> correlation(List<ScoredRecord> snapshot) {
        return snapshot.stream()
                .filter(r -> r.getPctBasic() != 0.0 || r.getPctAboveBasic() != 0.0)
                .map(r -> new CorrelationPoint(r.getEntityLabel(), r.getPctBasic(), r.getPctAboveBasic()))
                .collect(Collectors.toList());
    }

    private List<DepthLeader> depthLeaders(List<ScoredRecord> snapshot) {
        List<ScoredRecord> withRatio = select(snapshot, r -> r.getSkillDepthRatio() != 0.0);
        return largest(withRatio, Comparator.comparingDouble(ScoredRecord::getSkillDepthRatio), RANKING_SIZE).stream()
                .map(r -> new DepthLeader(r.getEntityLabel(), r.getSkillDepthRatio()))
                .collect(Collectors.toList());
    }

    // Trend sections

    private Map<String, List<TrendPoint>> trends(List<ScoredRecord> countries, List<ScoredRecord> regions) {
        Map<Integer, List<ScoredRecord>> countriesByYear = countries.stream()
                .collect(Collectors.groupingBy(ScoredRecord::getYear, TreeMap::new, Collectors.toList()));

        List<TrendPoint> global = new ArrayList<>();
        List<TrendPoint> frontier = new ArrayList<>();
        List<TrendPoint> emerging = new ArrayList<>();

        for (Map.Entry<Integer, List<ScoredRecord>> entry : countriesByYear.entrySet()) {
            int year = entry.getKey();
            List<ScoredRecord> cohort = entry.getValue();

            global.add(new TrendPoint(year, meanAboveBasic(cohort)));
            frontier.add(new TrendPoint(year, meanAboveBasic(largest(cohort, BY_ABOVE_BASIC, RANKING_SIZE))));

            List<ScoredRecord> nonZero = select(cohort, r -> r.getPctAboveBasic() != 0.0);
            if (!nonZero.isEmpty()) {
                emerging.add(new TrendPoint(year, meanAboveBasic(smallest(nonZero, BY_ABOVE_BASIC, RANKING_SIZE))));
            }
        }

        Map<String, List<TrendPoint>> trends = new LinkedHashMap<>();
        putIfPresent(trends, GLOBAL_AVERAGE, global);
        putIfPresent(trends, FRONTIER_TREND, frontier);
        putIfPresent(trends, EMERGING_TREND, emerging);
        trends.putAll(regionSeries(regions));
        return trends;
    }

    private Map<String, List<TrendPoint>> regionSeries(List<ScoredRecord> regions) {
        Map<String, TreeMap<Integer, List<Double>>> byRegion = new LinkedHashMap<>();
        for (ScoredRecord record : regions) {
            byRegion.computeIfAbsent(record.getEntityLabel(), name -> new TreeMap<>())
                    .computeIfAbsent(record.getYear(), year -> new ArrayList<>())
                    .add(record.getPctAboveBasic());
        }

        Map<String, List<TrendPoint>> series = new LinkedHashMap<>();
        for (Map.Entry<String, TreeMap<Integer, List<Double>>> entry : byRegion.entrySet()) {
            if (entry.getValue().size() < MIN_REGION_POINTS) {
                log.debug("Skipping region {} with a single data point", entry.getKey());
                continue;
            }
            List<TrendPoint> points = new ArrayList<>();
            entry.getValue().forEach((year, values) -> points.add(new TrendPoint(year, SkillMetrics.mean(values))));
            series.put(entry.getKey(), points);
        }
        return series;
    }

    private static void putIfPresent(Map<String, List<TrendPoint>> trends, String name, List<TrendPoint> points) {
        if (!points.isEmpty()) {
            trends.put(name, points);
        }
    }

    // Helpers

    private static double meanAboveBasic(List<ScoredRecord> records) {
        return SkillMetrics.mean(records.stream().map(ScoredRecord::getPctAboveBasic).collect(Collectors.toList()));
    }

    /**
     * Highest {@code n} by the comparator. List.sort is stable, so ties keep input order.
     */
    private static List<ScoredRecord> largest(List<ScoredRecord> records, Comparator<ScoredRecord> order, int n) {
        List<ScoredRecord> sorted = new ArrayList<>(records);
        sorted.sort(order.reversed());
        return sorted.subList(0, Math.min(n, sorted.size()));
    }

    private static List<ScoredRecord> smallest(List<ScoredRecord> records, Comparator<ScoredRecord> order, int n) {
        List<ScoredRecord> sorted = new ArrayList<>(records);
        sorted.sort(order);
        return sorted.subList(0, Math.min(n, sorted.size()));
    }

    private static List<ScoredRecord> select(List<ScoredRecord> records, Predicate<ScoredRecord> filter) {
        return records.stream().filter(filter).collect(Collectors.toList());
    }

    /**
     * A record after coercion, with its depth ratio attached.
     */
    @Value
    static class ScoredRecord {
        String entityCode;
        String entityLabel;
        int year;
        double pctBasic;
        double pctAboveBasic;
        double skillDepthRatio;
    }
}
