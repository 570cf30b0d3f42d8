package com.example.servicerota.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Outcome of one date: role to person in priority order, {@code null} for an unassigned role.
 */
public record DayAssignment(String date, Map<String, String> assignments, List<SlotDecision> decisions) {

    public DayAssignment {
        if (date == null || date.isBlank()) {
            throw new IllegalArgumentException("date must not be blank");
        }
        assignments = assignments == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public Optional<String> assigneeOf(String role) {
        return Optional.ofNullable(assignments.get(role));
    }

    public Set<String> assignedPeople() {
        Set<String> people = new LinkedHashSet<>();
        assignments.values().forEach(p -> {
            if (p != null) people.add(p);
        });
        return people;
    }

    public long unassignedCount() {
        return assignments.values().stream().filter(p -> p == null).count();
    }
}
