package com.example.servicerota.schedule;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ScheduleGrid} のJSON表現。未割当セルは {@link ScheduleGrid#UNASSIGNED} で表す
 */
public record ScheduleGridDto(@NotNull List<String> dates, @NotNull @Valid List<RoleRow> rows) {

    public static ScheduleGridDto from(ScheduleGrid grid) {
        List<RoleRow> rows = new ArrayList<>(grid.roles().size());
        for (String role : grid.roles()) {
            List<String> cells = new ArrayList<>(grid.dates().size());
            for (String person : grid.row(role)) {
                cells.add(person == null ? ScheduleGrid.UNASSIGNED : person);
            }
            rows.add(new RoleRow(role, cells));
        }
        return new ScheduleGridDto(grid.dates(), rows);
    }

    public ScheduleGrid toGrid() {
        List<String> roles = new ArrayList<>(rows.size());
        Map<String, List<String>> cells = new HashMap<>();
        for (RoleRow row : rows) {
            roles.add(row.role().trim());
            cells.put(row.role().trim(), row.cells() == null ? List.of() : row.cells());
        }
        List<String> trimmedDates = dates.stream().map(d -> d == null ? "" : d.trim()).toList();
        return new ScheduleGrid(roles, trimmedDates, cells);
    }

    public record RoleRow(@NotBlank String role, List<String> cells) {
    }
}
