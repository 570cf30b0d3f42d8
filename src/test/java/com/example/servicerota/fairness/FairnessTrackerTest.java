package com.example.servicerota.fairness;

import com.example.servicerota.schedule.ScheduleGrid;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FairnessTrackerTest {

    @Test
    void countsStartAtZeroAndIncreaseByOne() {
        FairnessTracker tracker = new FairnessTracker();

        assertThat(tracker.countsFor("piano", List.of("Alice", "Bob")))
                .containsExactly(Map.entry("Alice", 0), Map.entry("Bob", 0));

        tracker.recordAssignment("piano", "Alice");
        tracker.recordAssignment("piano", "Alice");

        assertThat(tracker.countOf("piano", "Alice")).isEqualTo(2);
        assertThat(tracker.countOf("drum", "Alice")).isZero();
    }

    @Test
    void minimalCandidates_keepsAllTiedAtMinimumInCandidateOrder() {
        FairnessTracker tracker = new FairnessTracker();
        tracker.recordAssignment("pa", "Bob");

        assertThat(tracker.minimalCandidates("pa", List.of("Carol", "Bob", "Alice")))
                .containsExactly("Carol", "Alice");
    }

    @Test
    void minimalCandidates_emptyInEmptyOut() {
        assertThat(new FairnessTracker().minimalCandidates("pa", List.of())).isEmpty();
    }

    @Test
    void fromHistory_talliesEveryFilledCell() {
        ScheduleGrid history = new ScheduleGrid(
                List.of("vocal_main", "piano"),
                List.of("01/06", "08/06", "15/06"),
                Map.of("vocal_main", List.of("Alice", "Bob", "Alice"),
                        "piano", Arrays.asList("Carol", null, "UNASSIGNED")));

        FairnessTracker tracker = FairnessTracker.fromHistory(history);

        assertThat(tracker.countOf("vocal_main", "Alice")).isEqualTo(2);
        assertThat(tracker.countOf("vocal_main", "Bob")).isEqualTo(1);
        assertThat(tracker.countOf("piano", "Carol")).isEqualTo(1);
        assertThat(tracker.snapshot().get("piano")).containsOnlyKeys("Carol");
    }
}
