package com.example.servicerota.schedule;

import java.util.List;
import java.util.Map;

/**
 * A generated (not yet saved) rota plus what is needed to reproduce and explain it.
 *
 * @param seed tie-break seed the run used
 * @param fairness role to person to count after the run, seeded history included
 */
public record GenerationResult(ScheduleGrid grid,
                               long seed,
                               boolean seededFromHistory,
                               List<String> rolesWithEmptyPool,
                               Map<String, Map<String, Integer>> fairness,
                               List<DayAssignment> days) {

    public GenerationResult {
        rolesWithEmptyPool = List.copyOf(rolesWithEmptyPool);
        days = List.copyOf(days);
    }
}
