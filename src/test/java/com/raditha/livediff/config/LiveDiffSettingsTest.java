package com.raditha.livediff.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LiveDiffSettingsTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        LiveDiffSettings.clear();
    }

    @AfterEach
    void tearDown() {
        LiveDiffSettings.clear();
    }

    @Test
    void testLoadConfig_Defaults() {
        DiffConfig config = LiveDiffSettings.loadConfig(null, null, null);

        assertEquals(DiffConfig.defaults(), config);
        assertEquals(25, config.maxChangedVarsPerBlock());
        assertEquals(50, config.maxOnlyVarsShown());
        assertEquals("debug_", config.labelPrefix());
    }

    @Test
    void testLoadConfig_FromYamlFile() throws IOException {
        LiveDiffSettings.loadConfigMap(new File("src/test/resources/livediff-test.yml"));

        DiffConfig config = LiveDiffSettings.loadConfig(null, null, null);

        assertEquals(2, config.maxChangedVarsPerBlock());
        assertEquals(3, config.maxOnlyVarsShown());
        assertEquals("dump_", config.labelPrefix());
    }

    @Test
    void testLoadConfig_CliOverridesYaml() throws IOException {
        LiveDiffSettings.loadConfigMap(new File("src/test/resources/livediff-test.yml"));

        DiffConfig config = LiveDiffSettings.loadConfig(10, 0, "");

        assertEquals(10, config.maxChangedVarsPerBlock());
        assertEquals(0, config.maxOnlyVarsShown());
        assertEquals("", config.labelPrefix());
    }

    @Test
    void testLoadConfig_YamlMapConfig() {
        Map<String, Object> yamlConfig = new HashMap<>();
        yamlConfig.put("max_changed_vars_per_block", 7);
        LiveDiffSettings.setProperty(LiveDiffSettings.CONFIG_KEY, yamlConfig);

        DiffConfig config = LiveDiffSettings.loadConfig(null, null, null);

        assertEquals(7, config.maxChangedVarsPerBlock());
        assertEquals(50, config.maxOnlyVarsShown());
    }

    @Test
    void testLoadConfig_NonNumericValueRejected() {
        LiveDiffSettings.setProperty(LiveDiffSettings.CONFIG_KEY, Map.of("max_only_vars_shown", "many"));

        assertThrows(IllegalArgumentException.class,
                () -> LiveDiffSettings.loadConfig(null, null, null));
    }

    @Test
    void testLoadConfig_NegativeYamlValueRejected() {
        LiveDiffSettings.setProperty(LiveDiffSettings.CONFIG_KEY, Map.of("max_changed_vars_per_block", -4));

        assertThrows(IllegalArgumentException.class,
                () -> LiveDiffSettings.loadConfig(null, null, null));
    }

    @Test
    void testMissingConfigFileRejected() {
        File missing = tempDir.resolve("nope.yml").toFile();
        assertThrows(IllegalArgumentException.class, () -> LiveDiffSettings.loadConfigMap(missing));
    }

    @Test
    void testEmptyConfigFile() throws IOException {
        Path empty = tempDir.resolve("empty.yml");
        Files.writeString(empty, "other_tool:\n  enabled: true\n");

        LiveDiffSettings.loadConfigMap(empty.toFile());

        assertEquals(DiffConfig.defaults(),
                LiveDiffSettings.loadConfig(null, null, null));
        assertNotNull(LiveDiffSettings.getProperty("other_tool"));
    }
}
