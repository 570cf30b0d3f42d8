package com.example.servicerota.availability;

import com.example.servicerota.role.RoleCatalog;
import com.example.servicerota.role.RoleDefinitions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CoverageCheckerTest {

    @Test
    void flagsEmptyAndThinRolesPerDate() {
        RoleDefinitions defs = RoleDefinitions.standard();
        RoleCatalog catalog = new RoleCatalog(defs, Map.of(
                "vocal_main", List.of("Alice", "Bob"),
                "piano", List.of("Carol")));
        AvailabilityTable table = AvailabilityTable.parse(
                List.of("Name List", "05/01", "12/01"),
                List.of(List.of("Alice", "yes", "yes"),
                        List.of("Bob", "yes", "no"),
                        List.of("Carol", "no", "yes")));

        CoverageReport report = new CoverageChecker(2).check(table, catalog);

        CoverageReport.DateCoverage first = report.dates().get(0);
        assertThat(first.availableCount()).isEqualTo(2);
        assertThat(first.eligible()).containsEntry("vocal_main", 2).containsEntry("piano", 0);
        assertThat(first.issues()).doesNotContainKey("vocal_main")
                .containsEntry("piano", CoverageChecker.NO_ONE_AVAILABLE);

        CoverageReport.DateCoverage second = report.dates().get(1);
        assertThat(second.issues())
                .containsEntry("vocal_main", CoverageChecker.LIMITED_AVAILABILITY)
                .containsEntry("piano", CoverageChecker.LIMITED_AVAILABILITY);

        assertThat(report.rolesWithEmptyPool()).contains("drum", "ppt").doesNotContain("piano");
    }
}
