package com.stationalmanac.service;

import com.stationalmanac.core.model.ValidationException;
import com.stationalmanac.service.config.AlmanacConfig;
import com.stationalmanac.service.config.ConfigLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    @Test
    void parsesCoordinatesAndFlagInAnyPosition() {
        Main.Request request = Main.parseArgs(new String[]{"--current-only", "40.1164", "-88.2434"});

        assertTrue(request.currentOnly());
        assertEquals(40.1164, request.coordinates().latitude());
        assertEquals(-88.2434, request.coordinates().longitude());
        assertFalse(Main.parseArgs(new String[]{"61.17", "-150.03"}).currentOnly());
    }

    @Test
    void rejectsMalformedArguments() {
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"40.1"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"40.1", "-88", "12"}));
        assertThrows(IllegalArgumentException.class, () -> Main.parseArgs(new String[]{"north", "-88"}));
        assertThrows(ValidationException.class, () -> Main.parseArgs(new String[]{"95", "-88"}));
    }

    @Test
    void usageErrorsExitWithoutOutput() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int code = Main.run(new String[]{"40", "-200"}, Map.of(), new PrintStream(out, true, StandardCharsets.UTF_8));

        assertEquals(Main.EXIT_USAGE, code);
        assertEquals(0, out.size());
    }

    @Test
    void missingArchiveIsAFailure(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(ConfigLoader.ALMANAC_FILE), """
                {"stationCatalog": "%s", "pointsBaseUrl": "http://localhost:1/points/", "retryAttempts": 1}
                """.formatted(dir.resolve("absent.json").toString().replace("\\", "\\\\")));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int code = Main.run(new String[]{"40", "-88"}, Map.of("ALMANAC_CONFIG_DIR", dir.toString()),
                new PrintStream(out, true, StandardCharsets.UTF_8));

        assertEquals(Main.EXIT_FAILURE, code);
        assertEquals(0, out.size());
    }

    @Test
    void configFallsBackToDefaultsWhenFileIsAbsent(@TempDir Path dir) {
        AlmanacConfig config = Main.resolveConfig(Map.of("ALMANAC_CONFIG_DIR", dir.toString()));

        assertEquals(AlmanacConfig.defaults(), config);
    }

    @Test
    void userAgentComesFromEnvironment(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve(ConfigLoader.ALMANAC_FILE), "{\"userAgent\": \"from-file\"}");

        AlmanacConfig config = Main.resolveConfig(Map.of(
                "ALMANAC_CONFIG_DIR", dir.toString(),
                "NWS_USER_AGENT", "from-env (me@example.com)"
        ));

        assertEquals("from-env (me@example.com)", config.userAgent());
    }
}
