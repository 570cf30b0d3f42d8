package com.example.servicerota.schedule;

import com.example.servicerota.fairness.FairnessTracker;
import com.example.servicerota.role.RoleCatalog;
import com.example.servicerota.role.RoleDefinition;
import com.example.servicerota.role.RoleDefinitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Fills the roles of a single date, greedily and in priority order.
 * <p>
 * For each role the candidates are the people who are available, not yet used today, qualified
 * for the role's pool and not already placed in one of the role's exclusive partners. Among them
 * the ones with the lowest count for that role win; ties are broken with the injected
 * {@link Random}. The chosen person is recorded in the {@link FairnessTracker} immediately.
 * <p>
 * An empty candidate set leaves the role unassigned for the date. That is data, not an error.
 */
public class AssignmentEngine {

    private static final Logger logger = LoggerFactory.getLogger(AssignmentEngine.class);

    private final RoleDefinitions definitions;
    private final RoleCatalog catalog;
    private final FairnessTracker tracker;
    private final Random random;

    public AssignmentEngine(RoleDefinitions definitions, RoleCatalog catalog, FairnessTracker tracker, Random random) {
        this.definitions = Objects.requireNonNull(definitions, "definitions");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.random = Objects.requireNonNull(random, "random");
    }

    public DayAssignment assign(String date, Collection<String> availablePeople) {
        Set<String> available = availablePeople == null ? Set.of() : new LinkedHashSet<>(availablePeople);
        Map<String, String> assignments = new LinkedHashMap<>();
        List<SlotDecision> decisions = new ArrayList<>(definitions.size());
        Set<String> assignedToday = new HashSet<>();

        for (RoleDefinition role : definitions.inPriorityOrder()) {
            List<String> candidates = candidatesFor(role, available, assignedToday, assignments);
            if (candidates.isEmpty()) {
                assignments.put(role.name(), null);
                decisions.add(SlotDecision.noCandidates(role.name()));
                logger.debug("{} / {}: no candidates", date, role.name());
                continue;
            }

            Map<String, Integer> counts = tracker.countsFor(role.name(), candidates);
            List<String> best = new ArrayList<>(tracker.minimalCandidates(role.name(), candidates));
            String chosen = best.size() == 1 ? best.get(0) : best.get(random.nextInt(best.size()));

            assignments.put(role.name(), chosen);
            decisions.add(new SlotDecision(role.name(), counts, chosen));
            assignedToday.add(chosen);
            tracker.recordAssignment(role.name(), chosen);
            logger.debug("{} / {}: {} (count {}, tied with {})",
                    date, role.name(), chosen, counts.get(chosen), best.size() - 1);
        }
        return new DayAssignment(date, assignments, decisions);
    }

    private List<String> candidatesFor(RoleDefinition role,
                                       Set<String> available,
                                       Set<String> assignedToday,
                                       Map<String, String> assignmentsSoFar) {
        Set<String> qualified = catalog.qualifiedPeople(role.name());
        if (qualified.isEmpty()) {
            return List.of();
        }
        Set<String> excluded = new HashSet<>();
        for (String partner : role.exclusiveWith()) {
            String partnerAssignee = assignmentsSoFar.get(partner);
            if (partnerAssignee != null) excluded.add(partnerAssignee);
        }
        List<String> candidates = new ArrayList<>();
        for (String person : available) {
            if (assignedToday.contains(person)) continue;
            if (!qualified.contains(person)) continue;
            if (excluded.contains(person)) continue;
            candidates.add(person);
        }
        return candidates;
    }
}
