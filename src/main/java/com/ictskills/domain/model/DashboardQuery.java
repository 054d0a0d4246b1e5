package com.ictskills.domain.model;

import lombok.Value;

/**
 * Year range for a dashboard query, inclusive on both ends.
 *
 * The legacy single-year form is the degenerate range {@code [year, year]}.
 */
@Value
public class DashboardQuery {

    int startYear;
    int endYear;

    public static DashboardQuery range(int startYear, int endYear) {
        return new DashboardQuery(startYear, endYear);
    }

    public static DashboardQuery singleYear(int year) {
        return new DashboardQuery(year, year);
    }

    public boolean isSingleYear() {
        return startYear == endYear;
    }

    public boolean contains(int year) {
        return year >= startYear && year <= endYear;
    }
}
