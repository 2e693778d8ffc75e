package com.stationalmanac.archive;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stationalmanac.core.model.Station;
import com.stationalmanac.core.model.TemperatureRecord;
import com.stationalmanac.core.util.JsonUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

// rows whose station column names another station are skipped
public final class JsonlSeriesStore implements ArchivedSeriesStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlSeriesStore.class.getName());

    private final Path directory;

    public JsonlSeriesStore(Path directory) {
        this.directory = directory;
    }

    public Path fileFor(Station station) {
        return directory.resolve(station.archiveKey() + ".jsonl");
    }

    @Override
    public List<TemperatureRecord> load(Station station) {
        Path file = fileFor(station);
        if (!Files.exists(file)) {
            throw new IllegalStateException("No archived series for station " + station.archiveKey() + " at " + file);
        }

        long stationId = station.compiledId();
        List<TemperatureRecord> records = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                ArchiveRow row;
                try {
                    row = JsonUtils.objectMapper().readValue(line, ArchiveRow.class);
                } catch (IOException decodeError) {
                    throw new IllegalStateException("Invalid archive row at " + file + ":" + lineNumber, decodeError);
                }
                if (row.timestamp() == null) {
                    throw new IllegalStateException("Archive row without timestamp at " + file + ":" + lineNumber);
                }
                if (row.station() != null && row.station() != stationId) {
                    skipped++;
                    continue;
                }
                records.add(new TemperatureRecord(row.timestamp(), row.temperature()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read archived series " + file, e);
        }

        if (skipped > 0) {
            LOGGER.fine("Skipped " + skipped + " rows of other stations in " + file);
        }
        return List.copyOf(records);
    }

    private record ArchiveRow(
            @JsonProperty("timestamp") LocalDateTime timestamp,
            @JsonProperty("temperature") int temperature,
            @JsonProperty("station") Long station
    ) {
    }
}
