package org.netpreserve.scriptorium.util;

import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for loosely typed tabular records.
 */
public final class Rows {
    private static final Set<String> NULL_MARKERS = Set.of("nan", "null", "none");

    private Rows() {
    }

    /**
     * Lower-cases column names and drops blank cells and spreadsheet null markers such as {@code NaN}, so
     * that an absent column and an empty cell read the same.
     */
    public static Map<String, String> normalize(Map<String, ?> row) {
        var normalized = new HashMap<String, String>();
        row.forEach((key, value) -> {
            if (key == null || value == null) return;
            String column = StringUtils.removeStart(key, "\uFEFF").strip().toLowerCase(Locale.ROOT);
            String text = StringUtils.trimToNull(String.valueOf(value));
            if (text == null || NULL_MARKERS.contains(text.toLowerCase(Locale.ROOT))) return;
            normalized.putIfAbsent(column, text);
        });
        return normalized;
    }
}
