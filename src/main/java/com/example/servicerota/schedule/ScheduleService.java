package com.example.servicerota.schedule;

import com.example.servicerota.availability.AvailabilityService;
import com.example.servicerota.availability.AvailabilityTable;
import com.example.servicerota.config.RotaSettings;
import com.example.servicerota.exception.BusinessException;
import com.example.servicerota.fairness.FairnessTracker;
import com.example.servicerota.qualification.QualificationService;
import com.example.servicerota.role.RoleCatalog;
import com.example.servicerota.role.RoleDefinitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;

@Service
public class ScheduleService {
    private static final Logger logger = LoggerFactory.getLogger(ScheduleService.class);

    private final AvailabilityService availabilityService;
    private final QualificationService qualificationService;
    private final ScheduleSlotRecordRepository slotRepository;
    private final RoleDefinitions roleDefinitions;
    private final RotaSettings settings;

    public ScheduleService(AvailabilityService availabilityService,
                           QualificationService qualificationService,
                           ScheduleSlotRecordRepository slotRepository,
                           RoleDefinitions roleDefinitions,
                           RotaSettings settings) {
        this.availabilityService = availabilityService;
        this.qualificationService = qualificationService;
        this.slotRepository = slotRepository;
        this.roleDefinitions = roleDefinitions;
        this.settings = settings;
    }

    /**
     * Generates a rota for every date of the stored availability table. Nothing is saved.
     *
     * @param seedOverride tie-break seed for this run, or null to use the configured one
     * @param useHistory seed fairness counts from the saved final schedule
     */
    @Transactional(readOnly = true)
    public GenerationResult generate(Long seedOverride, boolean useHistory) {
        AvailabilityTable availability = availabilityService.require();
        RoleCatalog catalog = qualificationService.loadCatalog();

        Optional<ScheduleGrid> history = useHistory ? loadFinal() : Optional.empty();
        FairnessTracker tracker = history.map(FairnessTracker::fromHistory).orElseGet(FairnessTracker::new);
        if (useHistory && history.isEmpty()) {
            logger.info("No saved schedule found; starting from zero counts");
        }

        long seed = settings.resolveSeed(seedOverride);
        logger.info("Generating rota: {} dates, {} people, seed={}, history={}",
                availability.dates().size(), availability.people().size(), seed, history.isPresent());

        RotationScheduler scheduler = new RotationScheduler(roleDefinitions, catalog, new Random(seed));
        ScheduleLedger ledger = scheduler.generate(availability, tracker);
        ScheduleGrid grid = ledger.toTable();
        logger.info("Rota generated: {} filled, {} unassigned", grid.filledCount(), grid.unassignedCount());

        return new GenerationResult(grid, seed, history.isPresent(), catalog.rolesWithEmptyPool(),
                tracker.snapshot(), ledger.days());
    }

    /**
     * Replaces the saved final schedule.
     */
    @Transactional
    public ScheduleGrid saveFinal(ScheduleGrid grid) {
        for (String role : grid.roles()) {
            roleDefinitions.require(role);
        }
        slotRepository.deleteAllInBatch();
        List<ScheduleSlotRecord> records = new ArrayList<>();
        List<String> roleOrder = roleDefinitions.roleNames();
        for (String role : grid.roles()) {
            List<String> row = grid.row(role);
            for (int i = 0; i < grid.dates().size(); i++) {
                records.add(new ScheduleSlotRecord(role, roleOrder.indexOf(role), grid.dates().get(i), i, row.get(i)));
            }
        }
        slotRepository.saveAll(records);
        logger.info("Saved final schedule: {} roles x {} dates", grid.roles().size(), grid.dates().size());
        return grid;
    }

    @Transactional(readOnly = true)
    public Optional<ScheduleGrid> loadFinal() {
        List<ScheduleSlotRecord> records = slotRepository.findAllByOrderByRolePositionAscDateIndexAsc();
        if (records.isEmpty()) {
            return Optional.empty();
        }
        TreeMap<Integer, String> dateByIndex = new TreeMap<>();
        Map<String, Map<Integer, String>> byRole = new LinkedHashMap<>();
        for (ScheduleSlotRecord r : records) {
            dateByIndex.putIfAbsent(r.getDateIndex(), r.getDateLabel());
            byRole.computeIfAbsent(r.getRoleName(), k -> new HashMap<>()).put(r.getDateIndex(), r.getPersonName());
        }
        List<String> dates = new ArrayList<>(dateByIndex.values());
        List<Integer> indexes = new ArrayList<>(dateByIndex.keySet());
        Map<String, List<String>> cells = new HashMap<>();
        byRole.forEach((role, byIndex) -> {
            List<String> row = new ArrayList<>(dates.size());
            indexes.forEach(i -> row.add(byIndex.get(i)));
            cells.put(role, row);
        });
        return Optional.of(new ScheduleGrid(new ArrayList<>(byRole.keySet()), dates, cells));
    }

    /**
     * Counts tallied from the saved final schedule.
     */
    @Transactional(readOnly = true)
    public Map<String, Map<String, Integer>> savedFairness() {
        return loadFinal()
                .map(FairnessTracker::fromHistory)
                .orElseGet(FairnessTracker::new)
                .snapshot();
    }

    public ScheduleGrid requireFinal() {
        return loadFinal().orElseThrow(() ->
                new BusinessException("NO_SAVED_SCHEDULE", "保存済みのスケジュールがありません"));
    }
}
