package com.example.servicerota.availability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CoverageReport(List<String> rolesWithEmptyPool, List<DateCoverage> dates) {

    public CoverageReport {
        rolesWithEmptyPool = List.copyOf(rolesWithEmptyPool);
        dates = List.copyOf(dates);
    }

    public long issueCount() {
        return dates.stream().mapToLong(d -> d.issues().size()).sum();
    }

    /**
     * @param availableCount people marked available that date
     * @param eligible role to number of available and qualified people
     * @param issues role to issue label, only for roles with a problem
     */
    public record DateCoverage(String date, int availableCount, Map<String, Integer> eligible, Map<String, String> issues) {
        public DateCoverage {
            eligible = Collections.unmodifiableMap(new LinkedHashMap<>(eligible));
            issues = Collections.unmodifiableMap(new LinkedHashMap<>(issues));
        }
    }
}
