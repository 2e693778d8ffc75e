package com.stationalmanac.core.window;

import com.stationalmanac.core.model.TemperatureRecord;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Picks the "on this day" observations out of one station's archived series.
 * <p>
 * Every record whose month and day equal the target is kept, across all years on file. Each matched
 * calendar date additionally keeps the record just before its first match and just after its last
 * match, so that values at local midnight can be interpolated. Brackets never wrap past either end of
 * the series.
 * <p>
 * The series must belong to a single station and be sorted by timestamp; the ordering is checked.
 */
public final class WindowExtractor {
    private WindowExtractor() {
    }

    public static List<TemperatureRecord> extract(List<TemperatureRecord> series, MonthDay targetDay) {
        Objects.requireNonNull(targetDay, "targetDay is required");
        if (series == null || series.isEmpty()) {
            throw new IllegalArgumentException("Series must not be empty");
        }
        requireAscending(series);

        Map<LocalDate, int[]> runs = new LinkedHashMap<>();
        TreeSet<Integer> selected = new TreeSet<>();
        for (int i = 0; i < series.size(); i++) {
            TemperatureRecord record = series.get(i);
            if (!record.monthDay().equals(targetDay)) {
                continue;
            }
            selected.add(i);
            int index = i;
            runs.compute(record.timestamp().toLocalDate(), (date, run) -> {
                if (run == null) {
                    return new int[]{index, index};
                }
                run[1] = index;
                return run;
            });
        }

        int last = series.size() - 1;
        for (int[] run : runs.values()) {
            if (run[0] > 0) {
                selected.add(run[0] - 1);
            }
            if (run[1] < last) {
                selected.add(run[1] + 1);
            }
        }

        List<TemperatureRecord> window = new ArrayList<>(selected.size());
        for (int index : selected) {
            window.add(series.get(index));
        }
        window.sort(Comparator.comparing(TemperatureRecord::timestamp));
        return List.copyOf(window);
    }

    private static void requireAscending(List<TemperatureRecord> series) {
        for (int i = 1; i < series.size(); i++) {
            if (series.get(i).timestamp().isBefore(series.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("Series is not sorted by timestamp at index " + i
                        + " (" + series.get(i - 1).timestamp() + " then " + series.get(i).timestamp() + ")");
            }
        }
    }
}
