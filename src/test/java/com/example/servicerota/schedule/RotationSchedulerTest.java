package com.example.servicerota.schedule;

import com.example.servicerota.availability.AvailabilityTable;
import com.example.servicerota.exception.ScheduleGenerationException;
import com.example.servicerota.fairness.FairnessTracker;
import com.example.servicerota.role.RoleCatalog;
import com.example.servicerota.role.RoleDefinition;
import com.example.servicerota.role.RoleDefinitions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RotationSchedulerTest {

    private static final List<String> PEOPLE = List.of(
            "Alice", "Bob", "Carol", "Dan", "Eve", "Frank", "Grace", "Heidi", "Ivan", "Judy", "Ken", "Lee");

    private final RoleDefinitions defs = RoleDefinitions.standard();

    private AvailabilityTable availability;
    private RoleCatalog catalog;

    @BeforeEach
    void setUp() {
        Random data = new Random(2024);
        List<String> dates = new ArrayList<>();
        for (int i = 0; i < 26; i++) {
            dates.add(String.format("D%02d", i + 1));
        }
        Map<String, List<Boolean>> rows = new LinkedHashMap<>();
        for (String person : PEOPLE) {
            List<Boolean> flags = new ArrayList<>();
            dates.forEach(d -> flags.add(data.nextInt(100) < 65));
            rows.put(person, flags);
        }
        availability = AvailabilityTable.of(dates, rows);

        Map<String, List<String>> pools = new HashMap<>();
        for (String pool : defs.poolKeys()) {
            if ("ppt".equals(pool)) continue; // nobody can run slides
            List<String> members = new ArrayList<>();
            for (String person : PEOPLE) {
                if (data.nextInt(100) < 40) members.add(person);
            }
            pools.put(pool, members);
        }
        catalog = new RoleCatalog(defs, pools);
    }

    @Test
    void everyDateRespectsUniquenessQualificationAvailabilityAndExclusivity() {
        ScheduleLedger ledger = new RotationScheduler(defs, catalog, new Random(11)).generate(availability);

        assertThat(ledger.dates()).containsExactlyElementsOf(availability.dates());
        for (DayAssignment day : ledger.days()) {
            List<String> filled = day.assignments().values().stream().filter(p -> p != null).toList();
            assertThat(new HashSet<>(filled)).hasSameSizeAs(filled);

            day.assignments().forEach((role, person) -> {
                if (person == null) return;
                assertThat(catalog.qualifiedPeople(role)).contains(person);
                assertThat(availability.isAvailable(person, day.date())).isTrue();
                RoleDefinition def = defs.require(role);
                for (String partner : def.exclusiveWith()) {
                    assertThat(day.assigneeOf(partner)).isNotEqualTo(java.util.Optional.of(person));
                }
            });
        }
    }

    @Test
    void trackerCountsMatchLedgerExactly() {
        FairnessTracker tracker = new FairnessTracker();
        ScheduleLedger ledger = new RotationScheduler(defs, catalog, new Random(11)).generate(availability, tracker);

        for (String role : defs.roleNames()) {
            for (String person : PEOPLE) {
                assertThat(tracker.countOf(role, person))
                        .as("%s / %s", role, person)
                        .isEqualTo(ledger.countOf(role, person));
            }
        }
    }

    @Test
    void everyPickHadTheMinimumCountAmongItsCandidates() {
        ScheduleLedger ledger = new RotationScheduler(defs, catalog, new Random(11)).generate(availability);

        for (DayAssignment day : ledger.days()) {
            for (SlotDecision decision : day.decisions()) {
                if (!decision.filled()) {
                    assertThat(decision.candidateCounts()).isEmpty();
                    continue;
                }
                int min = Collections.min(decision.candidateCounts().values());
                assertThat(decision.candidateCounts().get(decision.chosen())).isEqualTo(min);
            }
        }
    }

    @Test
    void roleWithEmptyPoolStaysUnassignedOnEveryDate() {
        FairnessTracker tracker = new FairnessTracker();
        ScheduleLedger ledger = new RotationScheduler(defs, catalog, new Random(11)).generate(availability, tracker);

        assertThat(ledger.assignmentsOf("ppt")).allSatisfy(slot -> assertThat(slot.assignee()).isEmpty());
        assertThat(ledger.toTable().row("ppt")).containsOnlyNulls();
        assertThat(tracker.snapshot()).doesNotContainKey("ppt");
    }

    @Test
    void sameSeedGivesSameRota() {
        ScheduleGrid a = new RotationScheduler(defs, catalog, new Random(99)).generate(availability).toTable();
        ScheduleGrid b = new RotationScheduler(defs, catalog, new Random(99)).generate(availability).toTable();

        assertThat(a.toRows()).isEqualTo(b.toRows());
    }

    @Test
    void alwaysAvailablePairAlternates() {
        RoleCatalog pianoOnly = new RoleCatalog(defs, Map.of("piano", List.of("Alice", "Bob")));
        List<String> dates = List.of("D1", "D2", "D3", "D4", "D5", "D6", "D7", "D8", "D9", "D10");
        Map<String, List<Boolean>> rows = new LinkedHashMap<>();
        rows.put("Alice", Collections.nCopies(dates.size(), true));
        rows.put("Bob", Collections.nCopies(dates.size(), true));

        ScheduleLedger ledger = new RotationScheduler(defs, pianoOnly, new Random(4))
                .generate(AvailabilityTable.of(dates, rows));

        assertThat(ledger.countOf("piano", "Alice")).isEqualTo(5);
        assertThat(ledger.countOf("piano", "Bob")).isEqualTo(5);
        List<ScheduleLedger.RoleSlot> slots = ledger.assignmentsOf("piano");
        for (int i = 0; i < slots.size(); i += 2) {
            assertThat(Set.of(slots.get(i).person(), slots.get(i + 1).person())).containsExactlyInAnyOrder("Alice", "Bob");
        }
    }

    @Test
    void seededHistoryCarriesIntoTheNewRun() {
        RoleCatalog leadOnly = new RoleCatalog(defs, Map.of("vocal_main", List.of("Alice", "Bob")));
        FairnessTracker tracker = new FairnessTracker();
        tracker.recordAssignment("vocal_main", "Alice");
        Map<String, List<Boolean>> rows = new LinkedHashMap<>();
        rows.put("Alice", List.of(true));
        rows.put("Bob", List.of(true));

        ScheduleLedger ledger = new RotationScheduler(defs, leadOnly, new Random(4))
                .generate(AvailabilityTable.of(List.of("D1"), rows), tracker);

        assertThat(ledger.day("D1").orElseThrow().assigneeOf("vocal_main")).contains("Bob");
        assertThat(tracker.countOf("vocal_main", "Alice")).isEqualTo(1);
        assertThat(tracker.countOf("vocal_main", "Bob")).isEqualTo(1);
    }

    @Test
    void missingAvailabilityHaltsBeforeAnyDate() {
        RotationScheduler scheduler = new RotationScheduler(defs, catalog, new Random(1));

        assertThatThrownBy(() -> scheduler.generate(null))
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting("errorCode").isEqualTo(ScheduleGenerationException.DATA_UNAVAILABLE);
    }

    @Test
    void ledgerIsClosedAfterGeneration() {
        ScheduleLedger ledger = new RotationScheduler(defs, catalog, new Random(1)).generate(availability);

        assertThat(ledger.isClosed()).isTrue();
        assertThatThrownBy(() -> ledger.append("D99", Map.of()))
                .isInstanceOf(IllegalStateException.class);
    }
}
