package com.retailsales.domain.ingest;

import org.apache.commons.csv.CSVRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Header positions for each {@link SalesColumn}, resolved once per import.
 */
public final class ColumnResolution {

    private final Map<SalesColumn, Integer> positions;

    private ColumnResolution(Map<SalesColumn, Integer> positions) {
        this.positions = positions;
    }

    /**
     * Exact spellings win over normalized matches; the first header with a
     * given spelling wins over later duplicates.
     */
    public static ColumnResolution resolve(List<String> headers) {
        Map<String, Integer> exact = new HashMap<>();
        Map<String, Integer> normalized = new HashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            String header = headers.get(i);
            if (header == null) {
                continue;
            }
            exact.putIfAbsent(header.trim(), i);
            String key = SalesColumn.normalize(header);
            if (!key.isEmpty()) {
                normalized.putIfAbsent(key, i);
            }
        }

        Map<SalesColumn, Integer> positions = new EnumMap<>(SalesColumn.class);
        for (SalesColumn column : SalesColumn.values()) {
            Integer position = column.getSpellings().stream()
                    .map(exact::get)
                    .filter(p -> p != null)
                    .findFirst()
                    .orElseGet(() -> column.getSpellings().stream()
                            .map(spelling -> normalized.get(SalesColumn.normalize(spelling)))
                            .filter(p -> p != null)
                            .findFirst()
                            .orElse(null));
            if (position != null) {
                positions.put(column, position);
            }
        }
        return new ColumnResolution(Collections.unmodifiableMap(positions));
    }

    public boolean has(SalesColumn column) {
        return positions.containsKey(column);
    }

    /**
     * Trimmed cell value, or null when the column is absent, the row is
     * short, or the cell is blank.
     */
    public String value(CSVRecord record, SalesColumn column) {
        Integer position = positions.get(column);
        if (position == null || position >= record.size()) {
            return null;
        }
        String value = record.get(position);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }
}
