package com.example.servicerota.availability;

import com.example.servicerota.role.RoleCatalog;
import com.example.servicerota.role.RoleDefinition;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pre-generation check of how many available and qualified people each role has on each date.
 */
public class CoverageChecker {

    public static final String NO_ONE_AVAILABLE = "No one available";
    public static final String LIMITED_AVAILABILITY = "Limited availability";

    private final int limitedThreshold;

    public CoverageChecker(int limitedThreshold) {
        if (limitedThreshold < 1) {
            throw new IllegalArgumentException("limitedThreshold must be >= 1");
        }
        this.limitedThreshold = limitedThreshold;
    }

    public CoverageReport check(AvailabilityTable availability, RoleCatalog catalog) {
        List<CoverageReport.DateCoverage> dates = new ArrayList<>();
        for (String date : availability.dates()) {
            Set<String> available = availability.availablePeople(date);
            Map<String, Integer> eligible = new LinkedHashMap<>();
            Map<String, String> issues = new LinkedHashMap<>();
            for (RoleDefinition role : catalog.definitions().inPriorityOrder()) {
                Set<String> qualified = catalog.qualifiedPeople(role.name());
                int n = (int) available.stream().filter(qualified::contains).count();
                eligible.put(role.name(), n);
                if (n == 0) {
                    issues.put(role.name(), NO_ONE_AVAILABLE);
                } else if (n < limitedThreshold) {
                    issues.put(role.name(), LIMITED_AVAILABILITY);
                }
            }
            dates.add(new CoverageReport.DateCoverage(date, available.size(), eligible, issues));
        }
        return new CoverageReport(catalog.rolesWithEmptyPool(), dates);
    }
}
