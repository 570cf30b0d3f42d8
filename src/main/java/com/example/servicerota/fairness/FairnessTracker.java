package com.example.servicerota.fairness;

import com.example.servicerota.schedule.ScheduleGrid;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-role assignment counters for one generation run.
 * <p>
 * Counts only ever go up, one step per successful assignment. Roles are independent: a person's
 * count for {@code piano} says nothing about their count for {@code drum}. Not thread-safe; a
 * tracker belongs to exactly one run.
 */
public class FairnessTracker {

    private final Map<String, Map<String, Integer>> countsByRole = new HashMap<>();

    /**
     * Tracker seeded by tallying every (role, person) cell of a previously saved grid.
     */
    public static FairnessTracker fromHistory(ScheduleGrid history) {
        FairnessTracker tracker = new FairnessTracker();
        if (history == null) {
            return tracker;
        }
        for (String role : history.roles()) {
            for (String person : history.row(role)) {
                if (person != null) {
                    tracker.recordAssignment(role, person);
                }
            }
        }
        return tracker;
    }

    public int countOf(String role, String person) {
        Map<String, Integer> counts = countsByRole.get(role);
        return counts == null ? 0 : counts.getOrDefault(person, 0);
    }

    /**
     * Current count per candidate, in the candidates' iteration order.
     */
    public Map<String, Integer> countsFor(String role, Collection<String> candidates) {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (String person : candidates) {
            out.put(person, countOf(role, person));
        }
        return out;
    }

    /**
     * Candidates whose count for {@code role} equals the minimum among them. Preserves candidate
     * order so that a seeded tie-break is reproducible.
     */
    public Set<String> minimalCandidates(String role, Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Set.of();
        }
        Map<String, Integer> counts = countsFor(role, candidates);
        int min = Collections.min(counts.values());
        Set<String> best = new LinkedHashSet<>();
        counts.forEach((person, count) -> {
            if (count == min) best.add(person);
        });
        return best;
    }

    public void recordAssignment(String role, String person) {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(person, "person");
        countsByRole.computeIfAbsent(role, k -> new HashMap<>()).merge(person, 1, Integer::sum);
    }

    /**
     * Immutable copy of all non-zero counts, role to person to count.
     */
    public Map<String, Map<String, Integer>> snapshot() {
        Map<String, Map<String, Integer>> copy = new LinkedHashMap<>();
        countsByRole.forEach((role, counts) -> copy.put(role, Map.copyOf(counts)));
        return Collections.unmodifiableMap(copy);
    }
}
