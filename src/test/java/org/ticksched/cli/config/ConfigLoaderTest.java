package org.ticksched.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>reference.conf (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("test.nested.setting");
        System.clearProperty("ticksched.loop.ticks-per-second");
        System.clearProperty("config.file");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(20, config.getInt("ticksched.loop.ticks-per-second"));
        // Not in the file, comes from reference.conf
        assertEquals("drain-reinsert", config.getString("ticksched.scheduler.store"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("ticksched.loop.ticks-per-second", "250");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(250, config.getInt("ticksched.loop.ticks-per-second"));
    }

    @Test
    @DisplayName("System property should override nested configuration values")
    void loadFromFile_systemPropertyShouldOverrideNestedConfig() {
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-nested", config.getString("test.nested.setting"));
        assertEquals("file-value", config.getString("test.value"));
    }

    @Test
    @DisplayName("Substitutions should resolve against reference.conf and system properties")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
        assertEquals(Duration.ZERO, config.getDuration("ticksched.loop.shutdown-timeout"));
    }

    @Test
    @DisplayName("loadDefaults should expose reference.conf values")
    void loadDefaults_shouldReturnReferenceValues() {
        Config config = ConfigLoader.loadDefaults();

        assertEquals(64, config.getInt("ticksched.loop.ticks-per-second"));
        assertEquals(0, config.getInt("ticksched.loop.max-tasks-per-tick"));
        assertTrue(config.getLongList("ticksched.loop.pause-ticks").isEmpty());
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("resolve should prefer the explicit file and report it")
    void resolve_shouldUseExplicitFile() {
        List<String> messages = new ArrayList<>();
        File file = testResource("test-config.conf");

        Config config = ConfigLoader.resolve(file, (level, message) -> messages.add(level + ": " + message));

        assertEquals(20, config.getInt("ticksched.loop.ticks-per-second"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO: Loading ticksched settings from "));
        assertTrue(messages.get(0).endsWith("(--config)"));
    }

    @Test
    @DisplayName("resolve should fail for a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/ticksched.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("ticksched.conf"));
    }

    @Test
    @DisplayName("resolve should honour -Dconfig.file when no explicit file is given")
    void resolve_shouldUseConfigFileSystemProperty() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());
        List<ConfigLoader.MessageLevel> levels = new ArrayList<>();

        Config config = ConfigLoader.resolve(null, (level, message) -> levels.add(level));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(List.of(ConfigLoader.MessageLevel.INFO), levels);
    }

    @Test
    @DisplayName("resolve should fail when -Dconfig.file points to a missing file")
    void resolve_shouldRejectMissingConfigFileSystemProperty() {
        System.setProperty("config.file", "does-not-exist/other.conf");

        assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(null, (level, message) -> { }));
    }

    /**
     * Locates a test resource file on the classpath.
     *
     * @param name the resource file name (relative to this test class's package).
     * @return the {@link File} pointing to the test resource.
     */
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
