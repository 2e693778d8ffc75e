package com.stationalmanac.archive;

import com.stationalmanac.archive.support.FixtureUtils;
import com.stationalmanac.core.model.Station;
import com.stationalmanac.core.model.TemperatureRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonlSeriesStoreTest {
    private static final Station CHAMPAIGN =
            new Station(999999, 54808, "CHAMPAIGN 9 SW", "IL", null, 40.053001, -88.373001, 213.399994);

    @TempDir
    Path tempDir;

    @Test
    void loadsPerStationFileSkippingBlankLines() {
        JsonlSeriesStore store = new JsonlSeriesStore(FixtureUtils.archiveDirectory());

        List<TemperatureRecord> series = store.load(CHAMPAIGN);

        assertEquals(List.of(
                new TemperatureRecord(LocalDateTime.of(2019, 1, 1, 8, 0), -15),
                new TemperatureRecord(LocalDateTime.of(2019, 1, 1, 16, 0), 0),
                new TemperatureRecord(LocalDateTime.of(2020, 1, 1, 8, 0), 25),
                new TemperatureRecord(LocalDateTime.of(2020, 1, 1, 16, 0), 100)
        ), series);
    }

    @Test
    void filtersRowsOfOtherStationsInCompiledTables() throws Exception {
        Files.writeString(tempDir.resolve("999999-54808.jsonl"), """
                {"timestamp":"2020-01-01T00:00:00","temperature":11,"station":72530094846}
                {"timestamp":"2020-01-01T00:00:00","temperature":-7,"station":99999954808}
                {"timestamp":"2020-01-01T08:00:00","temperature":-3,"station":99999954808}
                """);

        List<TemperatureRecord> series = new JsonlSeriesStore(tempDir).load(CHAMPAIGN);

        assertEquals(2, series.size());
        assertEquals(-7, series.get(0).temperatureRaw());
        assertEquals(-3, series.get(1).temperatureRaw());
    }

    @Test
    void missingFileFailsWithStationKey() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new JsonlSeriesStore(tempDir).load(CHAMPAIGN));

        assertTrue(error.getMessage().contains("999999-54808"));
    }

    @Test
    void malformedLineFailsWithLineNumber() throws Exception {
        Files.writeString(tempDir.resolve("999999-54808.jsonl"), """
                {"timestamp":"2020-01-01T00:00:00","temperature":11}
                {"timestamp":"2020-01-01T08:00:00","temperature":
                """);

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> new JsonlSeriesStore(tempDir).load(CHAMPAIGN));

        assertTrue(error.getMessage().endsWith(":2"));
    }

    @Test
    void nullTemperatureIsRejected() throws Exception {
        Files.writeString(tempDir.resolve("999999-54808.jsonl"), """
                {"timestamp":"2020-01-01T00:00:00","temperature":null}
                """);

        assertThrows(IllegalStateException.class, () -> new JsonlSeriesStore(tempDir).load(CHAMPAIGN));
    }
}
