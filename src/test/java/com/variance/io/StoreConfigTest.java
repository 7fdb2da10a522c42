package com.variance.io;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class StoreConfigTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(StoreConfig.ROOT_PROPERTY);
    }

    @Test
    @DisplayName("Defaults to ./data and json records")
    void defaults() {
        StoreConfig config = StoreConfig.defaults();

        assertEquals(Path.of("data"), config.rootDirectory());
        assertEquals("json", config.extension());
    }

    @Test
    @DisplayName("System property overrides the root directory")
    void readsSystemProperty() {
        System.setProperty(StoreConfig.ROOT_PROPERTY, " /tmp/variance ");

        assertEquals(Path.of("/tmp/variance"), StoreConfig.fromSystemProperties().rootDirectory());
    }

    @Test
    @DisplayName("Blank system property falls back to defaults")
    void blankPropertyUsesDefaults() {
        System.setProperty(StoreConfig.ROOT_PROPERTY, "  ");

        assertEquals(StoreConfig.defaults(), StoreConfig.fromSystemProperties());
    }

    @Test
    @DisplayName("Rejects invalid extensions")
    void rejectsInvalidExtension() {
        assertThrows(IllegalArgumentException.class, () -> new StoreConfig(Path.of("data"), ""));
        assertThrows(IllegalArgumentException.class, () -> new StoreConfig(Path.of("data"), ".json"));
        assertThrows(NullPointerException.class, () -> new StoreConfig(null, "json"));
    }
}
