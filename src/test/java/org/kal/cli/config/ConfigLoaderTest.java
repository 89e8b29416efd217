package org.kal.cli.config;

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
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment Variables
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
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
        System.clearProperty("kal.repl.prompt");
        System.clearProperty("kal.module-name");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("custom.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Defaults from reference.conf are used when no file is given")
    void load_shouldFallBackToReferenceDefaults() {
        // Act
        Config config = ConfigLoader.load(null);

        // Assert
        assertEquals("my cool jit", config.getString("kal.module-name"));
        assertEquals("__anon_expr", config.getString("kal.anonymous-function-name"));
        assertEquals(40, config.getInt("kal.operators.\"*\""));
        assertTrue(config.getBoolean("kal.repl.evaluate"));
        assertEquals(512, config.getInt("kal.runtime.max-call-depth"));
    }

    @Test
    @DisplayName("Configuration file should override defaults and keep the rest")
    void load_fileShouldOverrideDefaults() throws IOException {
        // Arrange
        File file = writeConfig("kal.module-name = \"from file\"\nkal.repl.evaluate = false\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("from file", config.getString("kal.module-name"));
        assertFalse(config.getBoolean("kal.repl.evaluate"));
        assertEquals("ready> ", config.getString("kal.repl.prompt"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() throws IOException {
        // Arrange
        File file = writeConfig("kal.repl.prompt = \"file> \"\nkal.module-name = \"from file\"\n");
        System.setProperty("kal.repl.prompt", "sys> ");
        ConfigFactory.invalidateCaches();

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("sys> ", config.getString("kal.repl.prompt"));
        assertEquals("from file", config.getString("kal.module-name"));
    }

    @Test
    @DisplayName("Substitutions in the configuration file are resolved")
    void load_shouldResolveSubstitutions() throws IOException {
        // Arrange
        File file = writeConfig("base-name = \"jit\"\nkal.module-name = ${base-name}\"-2\"\n");

        // Act
        Config config = ConfigLoader.load(file);

        // Assert
        assertEquals("jit-2", config.getString("kal.module-name"));
    }

    @Test
    @DisplayName("A missing explicit configuration file is rejected")
    void load_missingFileShouldThrow() {
        File missing = tempDir.resolve("does-not-exist.conf").toFile();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("does-not-exist.conf"));
    }
}
