package com.example.servicerota.schedule;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.StringJoiner;

/**
 * スケジュール表をCSV出力（{@code role} 列＋日付列）
 */
@Component
public class ScheduleCsvExporter {

    private static final String FILENAME = "final_schedule.csv";

    public CsvFile export(ScheduleGrid grid) {
        StringBuilder builder = new StringBuilder();
        builder.append('\uFEFF');
        for (List<String> row : grid.toRows()) {
            appendRow(builder, row);
        }
        byte[] data = builder.toString().getBytes(StandardCharsets.UTF_8);
        return new CsvFile(FILENAME, data);
    }

    private void appendRow(StringBuilder builder, List<String> row) {
        StringJoiner joiner = new StringJoiner(",");
        row.forEach(cell -> joiner.add(escapeCsv(cell)));
        builder.append(joiner).append('\n');
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
