package com.stationalmanac.archive;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stationalmanac.core.model.Station;
import com.stationalmanac.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

public final class JsonStationCatalog implements StationCatalog {
    private static final Logger LOGGER = Logger.getLogger(JsonStationCatalog.class.getName());

    private final Path file;
    private volatile List<Station> stations;

    public JsonStationCatalog(Path file) {
        this.file = file;
    }

    @Override
    public List<Station> stations() {
        List<Station> loaded = stations;
        if (loaded == null) {
            synchronized (this) {
                loaded = stations;
                if (loaded == null) {
                    loaded = read();
                    stations = loaded;
                }
            }
        }
        return loaded;
    }

    private List<Station> read() {
        if (!Files.exists(file)) {
            throw new IllegalStateException("Station catalog not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            List<Station> rows = JsonUtils.objectMapper().readValue(in, new TypeReference<List<Station>>() {
            });
            if (rows == null || rows.isEmpty()) {
                throw new IllegalStateException("Station catalog is empty: " + file);
            }
            LOGGER.info("Loaded " + rows.size() + " stations from " + file);
            return List.copyOf(rows);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read station catalog " + file, e);
        }
    }
}
