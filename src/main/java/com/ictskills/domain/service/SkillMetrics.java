package com.ictskills.domain.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Derived KPI arithmetic shared by the dashboard sections.
 *
 * Every function is total: division by zero, missing inputs and non-finite
 * intermediates all collapse to 0.
 */
public final class SkillMetrics {

    private SkillMetrics() {
    }

    /**
     * Missing or non-finite percentage becomes 0.
     */
    public static double coerce(Double value) {
        if (value == null || !Double.isFinite(value)) {
            return 0.0;
        }
        return value;
    }

    /**
     * Above-basic share relative to basic, rounded to 2 decimals; 0 when basic is not positive.
     */
    public static double skillDepthRatio(double pctBasic, double pctAboveBasic) {
        if (pctBasic <= 0) {
            return 0.0;
        }
        double ratio = pctAboveBasic / pctBasic;
        if (!Double.isFinite(ratio)) {
            return 0.0;
        }
        return new BigDecimal(ratio).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    /**
     * Percent change from {@code start} to {@code end}.
     */
    public static double rangeGrowth(Double start, Double end) {
        if (start == null || end == null || start == 0.0) {
            return 0.0;
        }
        return finiteOrZero((end - start) / start * 100);
    }

    /**
     * Year-over-year percent change for values already ordered by year.
     * The first element is always 0.
     */
    public static List<Double> sequentialGrowth(List<Double> valuesByYear) {
        List<Double> growth = new ArrayList<>(valuesByYear.size());
        for (int i = 0; i < valuesByYear.size(); i++) {
            if (i == 0) {
                growth.add(0.0);
                continue;
            }
            double previous = coerce(valuesByYear.get(i - 1));
            double current = coerce(valuesByYear.get(i));
            growth.add(finiteOrZero((current - previous) / previous * 100));
        }
        return growth;
    }

    public static double mean(Collection<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Double value : values) {
            sum += value;
        }
        return finiteOrZero(sum / values.size());
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
