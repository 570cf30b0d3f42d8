package com.example.servicerota.schedule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Why a role got the person it got on one date: the candidates that survived availability,
 * qualification and exclusion, with their counts before the pick.
 */
public record SlotDecision(String role, Map<String, Integer> candidateCounts, String chosen) {

    public SlotDecision {
        candidateCounts = candidateCounts == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(candidateCounts));
    }

    public static SlotDecision noCandidates(String role) {
        return new SlotDecision(role, Map.of(), null);
    }

    public Optional<String> assignee() {
        return Optional.ofNullable(chosen);
    }

    public boolean filled() {
        return chosen != null;
    }
}
