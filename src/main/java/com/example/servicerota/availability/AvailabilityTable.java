package com.example.servicerota.availability;

import com.example.servicerota.exception.BusinessException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Who can serve on which date. Rows are people, columns are date labels in the order the caller
 * supplied them; that order is the generation order and is never re-derived here.
 */
public final class AvailabilityTable {

    private static final Logger logger = LoggerFactory.getLogger(AvailabilityTable.class);

    public static final String DEFAULT_NAME_HEADER = "Name List";

    private final String nameHeader;
    private final List<String> dates;
    private final Map<String, List<Boolean>> rows;

    private AvailabilityTable(String nameHeader, List<String> dates, Map<String, List<Boolean>> rows) {
        this.nameHeader = nameHeader;
        this.dates = List.copyOf(dates);
        this.rows = Collections.unmodifiableMap(rows);
    }

    /**
     * Builds a table from raw cells. The first header cell names the person column, the rest are
     * date labels. Cells are normalised through {@link AvailabilityFlag}; anything that is not
     * yes/no counts as unavailable.
     */
    public static AvailabilityTable parse(List<String> header, List<List<String>> rawRows) {
        if (header == null || header.isEmpty()) {
            throw new BusinessException("EMPTY_HEADER", "見出し行がありません");
        }
        String nameHeader = header.get(0) == null || header.get(0).isBlank()
                ? DEFAULT_NAME_HEADER
                : header.get(0).trim();
        List<String> dates = new ArrayList<>();
        Set<String> seenDates = new HashSet<>();
        for (String label : header.subList(1, header.size())) {
            if (label == null || label.isBlank()) {
                throw new BusinessException("BLANK_DATE", "日付見出しが空です");
            }
            String trimmed = label.trim();
            if (!seenDates.add(trimmed)) {
                throw new BusinessException("DUPLICATE_DATE", "日付が重複しています: " + trimmed, trimmed);
            }
            dates.add(trimmed);
        }

        Map<String, List<Boolean>> rows = new LinkedHashMap<>();
        int unrecognised = 0;
        if (rawRows != null) {
            for (List<String> raw : rawRows) {
                if (raw == null || raw.isEmpty() || raw.get(0) == null || raw.get(0).isBlank()) {
                    throw new BusinessException("BLANK_PERSON", "氏名が空の行があります");
                }
                String person = raw.get(0).trim();
                if (rows.containsKey(person)) {
                    throw new BusinessException("DUPLICATE_PERSON", "氏名が重複しています: " + person, person);
                }
                List<Boolean> flags = new ArrayList<>(dates.size());
                for (int i = 0; i < dates.size(); i++) {
                    String cell = i + 1 < raw.size() ? raw.get(i + 1) : null;
                    Optional<Boolean> flag = AvailabilityFlag.parse(cell);
                    if (flag.isEmpty() && cell != null && !cell.isBlank()) {
                        unrecognised++;
                        logger.warn("Unrecognised availability '{}' for {} on {}; treated as unavailable",
                                cell, person, dates.get(i));
                    }
                    flags.add(flag.orElse(Boolean.FALSE));
                }
                rows.put(person, Collections.unmodifiableList(flags));
            }
        }
        logger.debug("Parsed availability: {} people x {} dates ({} unrecognised cells)",
                rows.size(), dates.size(), unrecognised);
        return new AvailabilityTable(nameHeader, dates, rows);
    }

    public static AvailabilityTable of(List<String> dates, Map<String, List<Boolean>> rows) {
        return of(DEFAULT_NAME_HEADER, dates, rows);
    }

    public static AvailabilityTable of(String nameHeader, List<String> dates, Map<String, List<Boolean>> rows) {
        Map<String, List<Boolean>> copy = new LinkedHashMap<>();
        rows.forEach((person, flags) -> {
            if (flags.size() != dates.size()) {
                throw new IllegalArgumentException("row for " + person + " has " + flags.size()
                        + " cells, expected " + dates.size());
            }
            copy.put(person, List.copyOf(flags));
        });
        return new AvailabilityTable(nameHeader, dates, copy);
    }

    public String nameHeader() {
        return nameHeader;
    }

    public List<String> dates() {
        return dates;
    }

    public List<String> people() {
        return List.copyOf(rows.keySet());
    }

    public boolean isAvailable(String person, String date) {
        List<Boolean> flags = rows.get(person);
        int index = dates.indexOf(date);
        return flags != null && index >= 0 && flags.get(index);
    }

    /**
     * People marked available on {@code date}, in table row order.
     */
    public Set<String> availablePeople(String date) {
        int index = dates.indexOf(date);
        if (index < 0) {
            throw new IllegalArgumentException("unknown date: " + date);
        }
        Set<String> out = new LinkedHashSet<>();
        rows.forEach((person, flags) -> {
            if (flags.get(index)) out.add(person);
        });
        return out;
    }

    /**
     * One person's flags in date order; empty when the person is not in the table.
     */
    public Map<String, Boolean> calendarOf(String person) {
        List<Boolean> flags = rows.get(person);
        if (flags == null) {
            return Map.of();
        }
        Map<String, Boolean> calendar = new LinkedHashMap<>();
        for (int i = 0; i < dates.size(); i++) {
            calendar.put(dates.get(i), flags.get(i));
        }
        return calendar;
    }

    public List<String> header() {
        List<String> header = new ArrayList<>(dates.size() + 1);
        header.add(nameHeader);
        header.addAll(dates);
        return header;
    }

    /**
     * Rows in the input shape, flags rendered as Yes/No.
     */
    public List<List<String>> toRows() {
        List<List<String>> out = new ArrayList<>(rows.size());
        rows.forEach((person, flags) -> {
            List<String> line = new ArrayList<>(flags.size() + 1);
            line.add(person);
            flags.forEach(f -> line.add(AvailabilityFlag.format(f)));
            out.add(line);
        });
        return out;
    }
}
