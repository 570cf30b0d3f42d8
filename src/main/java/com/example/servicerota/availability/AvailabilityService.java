package com.example.servicerota.availability;

import com.example.servicerota.exception.ScheduleGenerationException;
import com.example.servicerota.qualification.QualificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class AvailabilityService {
    private static final Logger logger = LoggerFactory.getLogger(AvailabilityService.class);

    private final AvailabilityColumnRepository columnRepository;
    private final AvailabilityCellRepository cellRepository;
    private final QualificationService qualificationService;
    private final CoverageChecker coverageChecker;

    public AvailabilityService(AvailabilityColumnRepository columnRepository,
                               AvailabilityCellRepository cellRepository,
                               QualificationService qualificationService,
                               CoverageChecker coverageChecker) {
        this.columnRepository = columnRepository;
        this.cellRepository = cellRepository;
        this.qualificationService = qualificationService;
        this.coverageChecker = coverageChecker;
    }

    /**
     * 出欠表を置き換える。見出しはセルとは別に保存するため、メンバー0人の表も登録済みとして扱う
     */
    @Transactional
    public AvailabilityTable replace(AvailabilityTable table) {
        cellRepository.deleteAllInBatch();
        columnRepository.deleteAllInBatch();

        List<String> header = table.header();
        List<AvailabilityColumn> columns = new ArrayList<>(header.size());
        for (int i = 0; i < header.size(); i++) {
            columns.add(new AvailabilityColumn(i, header.get(i)));
        }
        columnRepository.saveAll(columns);

        List<AvailabilityCell> cells = new ArrayList<>();
        List<String> people = table.people();
        List<String> dates = table.dates();
        for (int row = 0; row < people.size(); row++) {
            String person = people.get(row);
            for (int col = 0; col < dates.size(); col++) {
                String date = dates.get(col);
                cells.add(new AvailabilityCell(person, row, date, col, table.isAvailable(person, date)));
            }
        }
        cellRepository.saveAll(cells);
        logger.info("Stored availability: {} people x {} dates", people.size(), dates.size());
        return table;
    }

    /**
     * 登録済みの出欠表。未登録の場合は空
     */
    @Transactional(readOnly = true)
    public Optional<AvailabilityTable> load() {
        List<AvailabilityColumn> columns = columnRepository.findAllByOrderByPositionAsc();
        if (columns.isEmpty()) {
            return Optional.empty();
        }
        String nameHeader = columns.get(0).getLabel();
        List<String> dates = columns.subList(1, columns.size()).stream()
                .map(AvailabilityColumn::getLabel)
                .toList();

        Map<String, List<Boolean>> rows = new LinkedHashMap<>();
        for (AvailabilityCell cell : cellRepository.findAllByOrderByRowIndexAscDateIndexAsc()) {
            List<Boolean> flags = rows.computeIfAbsent(cell.getPersonName(), k -> {
                List<Boolean> blank = new ArrayList<>(dates.size());
                for (int i = 0; i < dates.size(); i++) blank.add(Boolean.FALSE);
                return blank;
            });
            int index = dates.indexOf(cell.getDateLabel());
            if (index < 0) {
                logger.warn("Ignoring availability cell for {} on unknown date {}", cell.getPersonName(), cell.getDateLabel());
                continue;
            }
            flags.set(index, Boolean.TRUE.equals(cell.getAvailable()));
        }
        return Optional.of(AvailabilityTable.of(nameHeader, dates, rows));
    }

    /**
     * 生成用の出欠表。未登録の場合は DATA_UNAVAILABLE
     */
    @Transactional(readOnly = true)
    public AvailabilityTable require() {
        return load().orElseThrow(ScheduleGenerationException::dataUnavailable);
    }

    /**
     * 日付・役割ごとの充足状況をチェック
     */
    @Transactional(readOnly = true)
    public CoverageReport coverage() {
        CoverageReport report = coverageChecker.check(require(), qualificationService.loadCatalog());
        if (report.issueCount() > 0) {
            logger.info("Coverage check found {} issue(s) across {} dates", report.issueCount(), report.dates().size());
        }
        return report;
    }
}
