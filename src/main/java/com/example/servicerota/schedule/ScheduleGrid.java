package com.example.servicerota.schedule;

import com.example.servicerota.exception.BusinessException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Role x date grid: one row per role, one column per date, each cell the assigned person or
 * unassigned. This shape is what gets persisted and what history seeding reads back.
 */
public final class ScheduleGrid {

    public static final String UNASSIGNED = "UNASSIGNED";
    public static final String ROLE_HEADER = "role";

    private final List<String> roles;
    private final List<String> dates;
    private final Map<String, List<String>> cells;

    public ScheduleGrid(List<String> roles, List<String> dates, Map<String, List<String>> cells) {
        requireUnique(roles, "DUPLICATE_ROLE", "役割が重複しています: ");
        requireUnique(dates, "DUPLICATE_DATE", "日付が重複しています: ");
        this.roles = List.copyOf(roles);
        this.dates = List.copyOf(dates);
        Map<String, List<String>> copy = new LinkedHashMap<>();
        for (String role : this.roles) {
            List<String> source = cells == null ? null : cells.get(role);
            List<String> row = new ArrayList<>(this.dates.size());
            for (int i = 0; i < this.dates.size(); i++) {
                String value = source != null && i < source.size() ? source.get(i) : null;
                row.add(isUnassigned(value) ? null : value.trim());
            }
            copy.put(role, Collections.unmodifiableList(row));
        }
        this.cells = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads the tabular form produced by {@link #toRows()}: a header row of {@code role} plus date
     * labels, then one row per role.
     */
    public static ScheduleGrid fromRows(List<List<String>> rows) {
        if (rows == null || rows.isEmpty() || rows.get(0).isEmpty()) {
            throw new BusinessException("EMPTY_SCHEDULE", "スケジュール表が空です");
        }
        List<String> header = rows.get(0);
        List<String> dates = new ArrayList<>();
        for (String label : header.subList(1, header.size())) {
            if (label == null || label.isBlank()) {
                throw new BusinessException("BLANK_DATE", "日付見出しが空です");
            }
            dates.add(label.trim());
        }
        List<String> roles = new ArrayList<>();
        Map<String, List<String>> cells = new LinkedHashMap<>();
        for (List<String> row : rows.subList(1, rows.size())) {
            if (row.isEmpty() || row.get(0) == null || row.get(0).isBlank()) {
                continue;
            }
            String role = row.get(0).trim();
            roles.add(role);
            cells.put(role, new ArrayList<>(row.subList(1, row.size())));
        }
        return new ScheduleGrid(roles, dates, cells);
    }

    public static boolean isUnassigned(String value) {
        if (value == null) return true;
        String v = value.trim();
        return v.isEmpty()
                || UNASSIGNED.equalsIgnoreCase(v)
                || "None".equals(v)
                || "nan".equalsIgnoreCase(v);
    }

    public List<String> roles() {
        return roles;
    }

    public List<String> dates() {
        return dates;
    }

    /**
     * Cells of one role in date order; {@code null} marks an unassigned slot.
     */
    public List<String> row(String role) {
        List<String> row = cells.get(role);
        if (row == null) {
            throw new IllegalArgumentException("unknown role: " + role);
        }
        return row;
    }

    public Optional<String> cell(String role, String date) {
        int index = dates.indexOf(date);
        if (index < 0) {
            throw new IllegalArgumentException("unknown date: " + date);
        }
        return Optional.ofNullable(row(role).get(index));
    }

    public List<List<String>> toRows() {
        List<List<String>> out = new ArrayList<>(roles.size() + 1);
        List<String> header = new ArrayList<>(dates.size() + 1);
        header.add(ROLE_HEADER);
        header.addAll(dates);
        out.add(header);
        for (String role : roles) {
            List<String> line = new ArrayList<>(dates.size() + 1);
            line.add(role);
            for (String person : cells.get(role)) {
                line.add(person == null ? UNASSIGNED : person);
            }
            out.add(line);
        }
        return out;
    }

    public int filledCount() {
        int n = 0;
        for (List<String> row : cells.values()) {
            for (String person : row) {
                if (person != null) n++;
            }
        }
        return n;
    }

    public int unassignedCount() {
        return roles.size() * dates.size() - filledCount();
    }

    private static void requireUnique(List<String> values, String code, String message) {
        if (values == null) {
            throw new IllegalArgumentException(code);
        }
        Set<String> seen = new HashSet<>();
        for (String v : values) {
            if (!seen.add(v)) {
                throw new BusinessException(code, message + v, v);
            }
        }
    }
}
