package com.example.servicerota.schedule;

import com.example.servicerota.availability.AvailabilityCellRepository;
import com.example.servicerota.availability.AvailabilityColumnRepository;
import com.example.servicerota.availability.AvailabilityService;
import com.example.servicerota.availability.AvailabilityTable;
import com.example.servicerota.exception.ScheduleGenerationException;
import com.example.servicerota.qualification.QualificationEntryRepository;
import com.example.servicerota.qualification.QualificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Transactional
class ScheduleServiceTest {

    @Autowired
    private ScheduleService scheduleService;

    @Autowired
    private AvailabilityService availabilityService;

    @Autowired
    private QualificationService qualificationService;

    @Autowired
    private AvailabilityColumnRepository columnRepository;

    @Autowired
    private AvailabilityCellRepository cellRepository;

    @Autowired
    private QualificationEntryRepository entryRepository;

    @Autowired
    private ScheduleSlotRecordRepository slotRepository;

    @BeforeEach
    void setUp() {
        cellRepository.deleteAll();
        columnRepository.deleteAll();
        entryRepository.deleteAll();
        slotRepository.deleteAll();
    }

    private void loadTeam() {
        availabilityService.replace(AvailabilityTable.parse(
                List.of("Name List", "05/01", "12/01", "19/01", "26/01"),
                List.of(List.of("Alice", "yes", "yes", "no", "yes"),
                        List.of("Bob", "yes", "no", "yes", "yes"),
                        List.of("Carol", "yes", "yes", "yes", "no"),
                        List.of("Dan", "no", "yes", "yes", "yes"),
                        List.of("Eve", "yes", "yes", "yes", "yes"))));
        qualificationService.replacePool("vocal_main", rows("Alice", "Bob"));
        qualificationService.replacePool("vocal_sub", rows("Carol", "Eve"));
        qualificationService.replacePool("piano", rows("Eve", "Alice"));
        qualificationService.replacePool("drum", rows("Dan"));
    }

    private static List<Map<String, String>> rows(String... names) {
        return Arrays.stream(names).map(n -> Map.of("name", n)).toList();
    }

    @Test
    void generate_withoutAvailability_haltsWithDataUnavailable() {
        assertThatThrownBy(() -> scheduleService.generate(1L, false))
                .isInstanceOf(ScheduleGenerationException.class)
                .extracting("errorCode").isEqualTo(ScheduleGenerationException.DATA_UNAVAILABLE);
    }

    @Test
    void generate_tableWithDatesButNoPeople_leavesEverySlotUnassigned() {
        availabilityService.replace(AvailabilityTable.parse(List.of("Name List", "05/01", "12/01"), List.of()));
        qualificationService.replacePool("vocal_main", rows("Alice"));

        GenerationResult result = scheduleService.generate(1L, false);

        assertThat(result.grid().dates()).containsExactly("05/01", "12/01");
        assertThat(result.grid().filledCount()).isZero();
        assertThat(result.grid().unassignedCount()).isEqualTo(16);
        assertThat(result.days()).hasSize(2);
    }

    @Test
    void generate_fillsEveryDateWithoutDoubleBooking() {
        loadTeam();

        GenerationResult result = scheduleService.generate(5L, false);
        ScheduleGrid grid = result.grid();

        assertThat(result.seed()).isEqualTo(5L);
        assertThat(grid.dates()).containsExactly("05/01", "12/01", "19/01", "26/01");
        assertThat(grid.roles()).hasSize(8);
        assertThat(result.rolesWithEmptyPool()).containsExactly("bass", "pa", "ppt");
        assertThat(grid.row("pa")).containsOnlyNulls();

        for (String date : grid.dates()) {
            List<String> filled = grid.roles().stream()
                    .map(role -> grid.cell(role, date).orElse(null))
                    .filter(Objects::nonNull)
                    .toList();
            assertThat(new HashSet<>(filled)).hasSameSizeAs(filled);
        }
        // Dan is the only drummer and is away on the first date
        assertThat(grid.row("drum")).containsExactly(null, "Dan", "Dan", "Dan");
    }

    @Test
    void generate_sameSeedSameResult() {
        loadTeam();

        ScheduleGrid a = scheduleService.generate(77L, false).grid();
        ScheduleGrid b = scheduleService.generate(77L, false).grid();

        assertThat(a.toRows()).isEqualTo(b.toRows());
    }

    @Test
    void saveFinal_thenLoadFinal_restoresGridInRoleOrder() {
        loadTeam();
        ScheduleGrid generated = scheduleService.generate(3L, false).grid();

        scheduleService.saveFinal(generated);
        ScheduleGrid loaded = scheduleService.loadFinal().orElseThrow();

        assertThat(loaded.toRows()).isEqualTo(generated.toRows());
    }

    @Test
    void generate_withHistory_favoursWhoeverLedLess() {
        availabilityService.replace(AvailabilityTable.parse(
                List.of("Name List", "02/02"),
                List.of(List.of("Alice", "yes"), List.of("Bob", "yes"))));
        qualificationService.replacePool("vocal_main", rows("Alice", "Bob"));
        scheduleService.saveFinal(ScheduleGrid.fromRows(List.of(
                List.of("role", "05/01", "12/01"),
                List.of("vocal_main", "Alice", "Alice"))));

        GenerationResult result = scheduleService.generate(9L, true);

        assertThat(result.seededFromHistory()).isTrue();
        assertThat(result.grid().cell("vocal_main", "02/02")).contains("Bob");
        assertThat(result.fairness().get("vocal_main")).containsEntry("Alice", 2).containsEntry("Bob", 1);
        assertThat(scheduleService.savedFairness().get("vocal_main")).containsOnly(Map.entry("Alice", 2));
    }
}
