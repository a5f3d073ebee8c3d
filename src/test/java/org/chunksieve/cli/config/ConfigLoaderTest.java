package org.chunksieve.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("chunksieve.search.workers");
        System.clearProperty("chunksieve.search.chunk-depth");
        System.clearProperty("engine-home");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the file over the reference defaults")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(List.of("/opt/engine/qutrit_engine", "--quiet"), config.getStringList("chunksieve.engine.command"));
        assertEquals(2, config.getInt("chunksieve.search.workers"));
        assertEquals(7, config.getInt("chunksieve.search.iterations"));
        assertEquals(4, config.getInt("chunksieve.search.chunk-depth"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("chunksieve.search.workers", "16");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals(16, config.getInt("chunksieve.search.workers"));
        assertEquals(7, config.getInt("chunksieve.search.iterations"));
    }

    @Test
    @DisplayName("System property should override reference defaults")
    void loadDefaults_systemPropertyShouldOverrideDefaults() {
        System.setProperty("chunksieve.search.chunk-depth", "9");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadDefaults();

        assertEquals(9, config.getInt("chunksieve.search.chunk-depth"));
        assertEquals(List.of("./qutrit_engine"), config.getStringList("chunksieve.engine.command"));
    }

    @Test
    @DisplayName("Should resolve configuration references against overrides")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("engine-home", "/usr/local/engine");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals(List.of("/usr/local/engine/qutrit_engine"), config.getStringList("chunksieve.engine.command"));
    }

    @Test
    @DisplayName("resolve should prefer the explicit file and report it")
    void resolve_explicitFileIsUsedAndReported() {
        List<Map.Entry<ConfigLoader.MessageLevel, String>> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
                (level, message) -> messages.add(Map.entry(level, message)));

        assertEquals(7, config.getInt("chunksieve.search.iterations"));
        assertEquals(1, messages.size());
        assertEquals(ConfigLoader.MessageLevel.INFO, messages.get(0).getKey());
        assertTrue(messages.get(0).getValue().contains("--config"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_missingExplicitFileThrows() {
        File missing = tempDir.resolve("missing.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("not found"));
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
