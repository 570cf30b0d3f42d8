package com.example.servicerota.schedule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Accumulates the per-date results of one run in the order they were produced. Once
 * {@link #close() closed} the ledger is read-only.
 */
public class ScheduleLedger {

    private final List<String> roles;
    private final Map<String, DayAssignment> days = new LinkedHashMap<>();
    private boolean closed;

    public ScheduleLedger(List<String> roles) {
        this.roles = List.copyOf(Objects.requireNonNull(roles, "roles"));
    }

    public void append(DayAssignment day) {
        Objects.requireNonNull(day, "day");
        if (closed) {
            throw new IllegalStateException("ledger is closed; cannot append " + day.date());
        }
        if (days.containsKey(day.date())) {
            throw new IllegalStateException("date already recorded: " + day.date());
        }
        for (String role : day.assignments().keySet()) {
            if (!roles.contains(role)) {
                throw new IllegalArgumentException("unknown role in assignment: " + role);
            }
        }
        days.put(day.date(), day);
    }

    public void append(String date, Map<String, String> roleMap) {
        append(new DayAssignment(date, roleMap, List.of()));
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public List<String> roles() {
        return roles;
    }

    public List<String> dates() {
        return List.copyOf(days.keySet());
    }

    public List<DayAssignment> days() {
        return List.copyOf(days.values());
    }

    public Optional<DayAssignment> day(String date) {
        return Optional.ofNullable(days.get(date));
    }

    /**
     * One role's slots in date order; the person is {@code null} where the role went unfilled.
     */
    public List<RoleSlot> assignmentsOf(String role) {
        if (!roles.contains(role)) {
            throw new IllegalArgumentException("unknown role: " + role);
        }
        List<RoleSlot> slots = new ArrayList<>(days.size());
        days.forEach((date, day) -> slots.add(new RoleSlot(date, day.assignments().get(role))));
        return slots;
    }

    public int countOf(String role, String person) {
        Objects.requireNonNull(person, "person");
        int n = 0;
        for (DayAssignment day : days.values()) {
            if (person.equals(day.assignments().get(role))) n++;
        }
        return n;
    }

    public ScheduleGrid toTable() {
        Map<String, List<String>> cells = new HashMap<>();
        for (String role : roles) {
            List<String> row = new ArrayList<>(days.size());
            for (DayAssignment day : days.values()) {
                row.add(day.assignments().get(role));
            }
            cells.put(role, row);
        }
        return new ScheduleGrid(roles, List.copyOf(days.keySet()), cells);
    }

    public record RoleSlot(String date, String person) {
        public Optional<String> assignee() {
            return Optional.ofNullable(person);
        }
    }
}
