package com.example.servicerota.schedule;

import com.example.servicerota.availability.AvailabilityTable;
import com.example.servicerota.exception.ScheduleGenerationException;
import com.example.servicerota.fairness.FairnessTracker;
import com.example.servicerota.role.RoleCatalog;
import com.example.servicerota.role.RoleDefinitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Runs the engine over every date of an availability table, left to right, threading one
 * {@link FairnessTracker} through the whole run. Date N sees exactly the counts left by dates
 * 1..N-1 (plus any seeded history).
 */
public class RotationScheduler {

    private static final Logger logger = LoggerFactory.getLogger(RotationScheduler.class);

    private final RoleDefinitions definitions;
    private final RoleCatalog catalog;
    private final Random random;

    public RotationScheduler(RoleDefinitions definitions, RoleCatalog catalog, Random random) {
        this.definitions = Objects.requireNonNull(definitions, "definitions");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.random = Objects.requireNonNull(random, "random");
    }

    public ScheduleLedger generate(AvailabilityTable availability) {
        return generate(availability, new FairnessTracker());
    }

    public ScheduleLedger generate(AvailabilityTable availability, FairnessTracker tracker) {
        if (availability == null) {
            throw ScheduleGenerationException.dataUnavailable();
        }
        Objects.requireNonNull(tracker, "tracker");

        List<String> gaps = catalog.rolesWithEmptyPool();
        if (!gaps.isEmpty()) {
            logger.warn("No qualified people for roles {}; they stay unassigned on every date", gaps);
        }

        AssignmentEngine engine = new AssignmentEngine(definitions, catalog, tracker, random);
        ScheduleLedger ledger = new ScheduleLedger(definitions.roleNames());
        for (String date : availability.dates()) {
            DayAssignment day = engine.assign(date, availability.availablePeople(date));
            ledger.append(day);
            if (day.unassignedCount() > 0) {
                logger.debug("{}: {} role(s) unassigned", date, day.unassignedCount());
            }
        }
        ledger.close();
        logger.info("Generated rota for {} dates x {} roles", ledger.dates().size(), definitions.size());
        return ledger;
    }
}
