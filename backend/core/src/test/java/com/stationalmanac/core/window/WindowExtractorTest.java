package com.stationalmanac.core.window;

import com.stationalmanac.core.model.TemperatureRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowExtractorTest {
    @Test
    void emptySeriesIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> WindowExtractor.extract(List.of(), MonthDay.of(1, 2)));
    }

    @Test
    void unsortedSeriesIsRejected() {
        List<TemperatureRecord> series = List.of(
                record(LocalDateTime.of(2020, 1, 2, 0, 0)),
                record(LocalDateTime.of(2020, 1, 1, 0, 0))
        );
        assertThrows(IllegalArgumentException.class, () -> WindowExtractor.extract(series, MonthDay.of(1, 2)));
    }

    @Test
    void keepsMatchedDaysWithOneBracketOnEachSide() {
        List<TemperatureRecord> series = everyEightHours(
                LocalDateTime.of(2018, 12, 20, 0, 0),
                LocalDateTime.of(2020, 1, 12, 0, 0)
        );

        List<TemperatureRecord> window = WindowExtractor.extract(series, MonthDay.of(1, 2));

        assertEquals(List.of(
                LocalDateTime.of(2019, 1, 1, 16, 0),
                LocalDateTime.of(2019, 1, 2, 0, 0),
                LocalDateTime.of(2019, 1, 2, 8, 0),
                LocalDateTime.of(2019, 1, 2, 16, 0),
                LocalDateTime.of(2019, 1, 3, 0, 0),
                LocalDateTime.of(2020, 1, 1, 16, 0),
                LocalDateTime.of(2020, 1, 2, 0, 0),
                LocalDateTime.of(2020, 1, 2, 8, 0),
                LocalDateTime.of(2020, 1, 2, 16, 0),
                LocalDateTime.of(2020, 1, 3, 0, 0)
        ), timestamps(window));
    }

    @Test
    void bracketsCrossTheYearBoundary() {
        List<TemperatureRecord> series = everyEightHours(
                LocalDateTime.of(2018, 12, 20, 0, 0),
                LocalDateTime.of(2020, 1, 12, 0, 0)
        );

        List<TemperatureRecord> window = WindowExtractor.extract(series, MonthDay.of(1, 1));

        assertEquals(List.of(
                LocalDateTime.of(2018, 12, 31, 16, 0),
                LocalDateTime.of(2019, 1, 1, 0, 0),
                LocalDateTime.of(2019, 1, 1, 8, 0),
                LocalDateTime.of(2019, 1, 1, 16, 0),
                LocalDateTime.of(2019, 1, 2, 0, 0),
                LocalDateTime.of(2019, 12, 31, 16, 0),
                LocalDateTime.of(2020, 1, 1, 0, 0),
                LocalDateTime.of(2020, 1, 1, 8, 0),
                LocalDateTime.of(2020, 1, 1, 16, 0),
                LocalDateTime.of(2020, 1, 2, 0, 0)
        ), timestamps(window));
    }

    @Test
    void matchAtSeriesStartHasNoPrecedingBracket() {
        List<TemperatureRecord> series = everyEightHours(
                LocalDateTime.of(2019, 1, 2, 0, 0),
                LocalDateTime.of(2019, 1, 4, 0, 0)
        );

        List<TemperatureRecord> window = WindowExtractor.extract(series, MonthDay.of(1, 2));

        assertEquals(List.of(
                LocalDateTime.of(2019, 1, 2, 0, 0),
                LocalDateTime.of(2019, 1, 2, 8, 0),
                LocalDateTime.of(2019, 1, 2, 16, 0),
                LocalDateTime.of(2019, 1, 3, 0, 0)
        ), timestamps(window));
    }

    @Test
    void matchAtSeriesEndHasNoFollowingBracket() {
        List<TemperatureRecord> series = everyEightHours(
                LocalDateTime.of(2019, 12, 31, 0, 0),
                LocalDateTime.of(2020, 1, 2, 16, 0)
        );

        List<TemperatureRecord> window = WindowExtractor.extract(series, MonthDay.of(1, 2));

        assertEquals(List.of(
                LocalDateTime.of(2020, 1, 1, 16, 0),
                LocalDateTime.of(2020, 1, 2, 0, 0),
                LocalDateTime.of(2020, 1, 2, 8, 0),
                LocalDateTime.of(2020, 1, 2, 16, 0)
        ), timestamps(window));
        assertEquals(series.get(series.size() - 1), window.get(window.size() - 1));
    }

    @Test
    void singleRecordSeriesMatchingTheDay() {
        TemperatureRecord only = record(LocalDateTime.of(2019, 7, 4, 12, 0));

        assertEquals(List.of(only), WindowExtractor.extract(List.of(only), MonthDay.of(7, 4)));
    }

    @Test
    void dayAbsentFromEveryYearYieldsEmptyWindow() {
        List<TemperatureRecord> series = everyEightHours(
                LocalDateTime.of(2018, 12, 20, 0, 0),
                LocalDateTime.of(2020, 1, 12, 0, 0)
        );

        assertTrue(WindowExtractor.extract(series, MonthDay.of(2, 29)).isEmpty());
    }

    @Test
    void sparseSeriesSharesBracketsBetweenAdjacentYears() {
        List<TemperatureRecord> series = List.of(
                record(LocalDateTime.of(2019, 1, 1, 8, 0)),
                record(LocalDateTime.of(2019, 1, 1, 16, 0)),
                record(LocalDateTime.of(2020, 1, 1, 8, 0)),
                record(LocalDateTime.of(2020, 1, 1, 16, 0))
        );

        assertEquals(series, WindowExtractor.extract(series, MonthDay.of(1, 1)));
    }

    @Test
    void keepsTemperaturesWithTheirTimestamps() {
        List<TemperatureRecord> series = List.of(
                new TemperatureRecord(LocalDateTime.of(2019, 3, 9, 23, 0), -12),
                new TemperatureRecord(LocalDateTime.of(2019, 3, 10, 5, 0), 4),
                new TemperatureRecord(LocalDateTime.of(2019, 3, 11, 2, 0), 31),
                new TemperatureRecord(LocalDateTime.of(2019, 3, 12, 2, 0), 55)
        );

        List<TemperatureRecord> window = WindowExtractor.extract(series, MonthDay.of(3, 10));

        assertEquals(List.of(series.get(0), series.get(1), series.get(2)), window);
    }

    private static List<TemperatureRecord> everyEightHours(LocalDateTime start, LocalDateTime endInclusive) {
        List<TemperatureRecord> series = new ArrayList<>();
        int value = 0;
        for (LocalDateTime t = start; !t.isAfter(endInclusive); t = t.plusHours(8)) {
            series.add(new TemperatureRecord(t, value++ % 300 - 150));
        }
        return series;
    }

    private static TemperatureRecord record(LocalDateTime timestamp) {
        return new TemperatureRecord(timestamp, 0);
    }

    private static List<LocalDateTime> timestamps(List<TemperatureRecord> records) {
        return records.stream().map(TemperatureRecord::timestamp).toList();
    }
}
