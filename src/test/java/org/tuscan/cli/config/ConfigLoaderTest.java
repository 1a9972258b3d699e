package org.tuscan.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader}: the file cascade (explicit file, environment variable,
 * working directory, classpath defaults) and the layering of system properties over files.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    File tempDir;

    private final List<String> messages = new ArrayList<>();
    private final List<ConfigLoader.MessageLevel> levels = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("pipeline.batch-size");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should overlay the file on reference defaults")
    void loadFromFile_shouldOverlayFileOnDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(3, config.getInt("pipeline.threads"));
        assertEquals(500, config.getInt("pipeline.batch-size"));
        assertEquals(2, config.getInt("pipeline.queue-capacity-per-worker"));
        assertEquals("TUSCAN_output.txt", config.getString("pipeline.output.default-file"));
        assertEquals("models/regression.json", config.getString("model.regression"));
        assertFalse(config.hasPath("model.classification"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("pipeline.batch-size", "42");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(42, config.getInt("pipeline.batch-size"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
    }

    @Test
    @DisplayName("loadDefaults should expose the reference configuration")
    void loadDefaults_shouldExposeReferenceConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(0, config.getInt("pipeline.threads"));
        assertEquals(10000, config.getInt("pipeline.batch-size"));
        assertEquals("PLAIN", config.getString("logging.format"));
        assertEquals("INFO", config.getString("logging.levels.\"org.tuscan\""));
        assertFalse(config.hasPath("pipeline.output.min-score"));
    }

    @Test
    @DisplayName("Explicit config file takes precedence over environment and working directory")
    void resolve_explicitFileWins() {
        File cwdFile = writeConfig("cwd.conf", "test.value = cwd");
        File envFile = writeConfig("env.conf", "test.value = env");

        Config config = ConfigLoader.resolve(testResource("test-config.conf"), envFile.getPath(), cwdFile, this::record);

        assertEquals("file-value", config.getString("test.value"));
        assertTrue(messages.get(0).contains("--config"));
        assertEquals(ConfigLoader.MessageLevel.INFO, levels.get(0));
    }

    @Test
    @DisplayName("Environment variable is used when no explicit file is given")
    void resolve_environmentBeforeWorkingDirectory() {
        File cwdFile = writeConfig("cwd.conf", "test.value = cwd");
        File envFile = writeConfig("env.conf", "test.value = env");

        Config config = ConfigLoader.resolve(null, envFile.getPath(), cwdFile, this::record);

        assertEquals("env", config.getString("test.value"));
        assertTrue(messages.get(0).contains(ConfigLoader.CONFIG_ENV_VARIABLE));
    }

    @Test
    @DisplayName("Working directory file is used when neither explicit file nor environment is set")
    void resolve_workingDirectoryFile() {
        File cwdFile = writeConfig("cwd.conf", "test.value = cwd");

        Config config = ConfigLoader.resolve(null, "  ", cwdFile, this::record);

        assertEquals("cwd", config.getString("test.value"));
    }

    @Test
    @DisplayName("Falls back to classpath defaults when no file is found")
    void resolve_fallsBackToDefaults() {
        Config config = ConfigLoader.resolve(null, null, new File(tempDir, "missing.conf"), this::record);

        assertEquals(10000, config.getInt("pipeline.batch-size"));
        assertTrue(messages.get(0).contains("using default configuration"));
        assertEquals(List.of(ConfigLoader.MessageLevel.WARN), levels);
    }

    @Test
    @DisplayName("Missing explicit or environment file is an error")
    void resolve_missingFilesAreErrors() {
        File missing = new File(tempDir, "missing.conf");

        assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, null, missing, this::record));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(null, missing.getPath(), missing, this::record));
        assertTrue(e.getMessage().contains(ConfigLoader.CONFIG_ENV_VARIABLE));
    }

    private void record(ConfigLoader.MessageLevel level, String message) {
        levels.add(level);
        messages.add(message);
    }

    private File writeConfig(final String name, final String content) {
        File file = new File(tempDir, name);
        try {
            Files.writeString(file.toPath(), content);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
        return file;
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
