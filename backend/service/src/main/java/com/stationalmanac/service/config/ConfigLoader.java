package com.stationalmanac.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.stationalmanac.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    public static final String ALMANAC_FILE = "almanac.json";

    private ConfigLoader() {
    }

    public static AlmanacConfig loadAlmanac(Path configDir) {
        return read(configDir.resolve(ALMANAC_FILE), new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Empty config in " + path);
            }
            return value;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
