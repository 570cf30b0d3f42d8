package com.example.servicerota.availability;

import com.example.servicerota.exception.BusinessException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an availability sheet exported as CSV: first column names, remaining columns dates.
 * Columns whose header starts with {@code Unnamed} (spreadsheet export artefacts) are dropped.
 */
@Component
public class AvailabilityCsvReader {

    public AvailabilityTable read(InputStream in) throws IOException {
        String text;
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            StringBuilder sb = new StringBuilder();
            char[] buffer = new char[4096];
            int n;
            while ((n = br.read(buffer)) != -1) {
                sb.append(buffer, 0, n);
            }
            text = stripBom(sb.toString());
        }
        List<List<String>> lines = new ArrayList<>();
        for (List<String> record : parseRecords(text)) {
            if (record.size() == 1 && record.get(0).isBlank()) continue;
            lines.add(record);
        }
        if (lines.isEmpty()) {
            throw new BusinessException("EMPTY_CSV", "CSVが空です");
        }
        List<String> header = lines.get(0);
        List<Integer> keep = new ArrayList<>();
        for (int i = 0; i < header.size(); i++) {
            if (i == 0 || !header.get(i).startsWith("Unnamed")) keep.add(i);
        }
        return AvailabilityTable.parse(select(header, keep), lines.subList(1, lines.size()).stream()
                .map(row -> select(row, keep))
                .toList());
    }

    private static List<String> select(List<String> row, List<Integer> keep) {
        List<String> out = new ArrayList<>(keep.size());
        for (int i : keep) {
            out.add(i < row.size() ? row.get(i) : "");
        }
        return out;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '\uFEFF' ? line.substring(1) : line;
    }

    /**
     * Splits CSV text into records. A quoted cell may contain commas, doubled quotes and line breaks.
     */
    static List<List<String>> parseRecords(String text) {
        List<List<String>> records = new ArrayList<>();
        List<String> cells = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                cells.add(current.toString().trim());
                current.setLength(0);
            } else if (c == '\n' || c == '\r') {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') i++;
                cells.add(current.toString().trim());
                current.setLength(0);
                records.add(cells);
                cells = new ArrayList<>();
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new BusinessException("UNTERMINATED_QUOTE", "CSVの引用符が閉じられていません");
        }
        if (current.length() > 0 || !cells.isEmpty()) {
            cells.add(current.toString().trim());
            records.add(cells);
        }
        return records;
    }
}
