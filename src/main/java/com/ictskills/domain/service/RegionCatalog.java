package com.ictskills.domain.service;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Closed set of aggregate-region codes. Any other entity code is a country.
 *
 * The production set is fixed; tests may build a catalog with their own codes.
 */
public class RegionCatalog {

    public static final List<String> DEFAULT_REGION_CODES = List.of(
            "EMU", "EUU", "OED", "CEB", "EAS", "LCN", "MEA", "NAC", "SAS", "SSF", "WLD");

    private final Set<String> regionCodes;

    public RegionCatalog(Collection<String> regionCodes) {
        this.regionCodes = Collections.unmodifiableSet(new LinkedHashSet<>(regionCodes));
    }

    public static RegionCatalog defaults() {
        return new RegionCatalog(DEFAULT_REGION_CODES);
    }

    public boolean isRegion(String entityCode) {
        return entityCode != null && regionCodes.contains(entityCode);
    }

    public boolean isCountry(String entityCode) {
        return !isRegion(entityCode);
    }
}
