package com.goodnews.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfigServiceTest {

    private PreferencesStore store;
    private ConfigService config;

    @BeforeEach
    void setUp() {
        store = PreferencesStore.forNode("com/goodnews/test-" + UUID.randomUUID());
        config = new ConfigService(store);
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(ConfigService.FONT_PATH_PROPERTY);
        System.clearProperty(ConfigService.FALLBACK_FAMILY_PROPERTY);
        store.discard();
    }

    @Test
    void defaultsPointAtBundledAssets() {
        assertEquals(Paths.get("assets", "font.ttf"), config.getFontPath());
        assertEquals(Paths.get("assets", "NotoColorEmoji.ttf"), config.getEmojiFontPath());
        assertEquals("SansSerif", config.getFallbackFontFamily());
    }

    @Test
    void persistedPathOverridesDefault() {
        Path custom = Paths.get("fonts", "SourceHanSans.otf");
        config.setEmojiFontPath(custom);

        assertEquals(custom, config.getEmojiFontPath());
    }

    @Test
    void systemPropertyWinsOverPersistedPath() {
        config.setFontPath(Paths.get("persisted.ttf"));
        System.setProperty(ConfigService.FONT_PATH_PROPERTY, " override.ttf ");
        System.setProperty(ConfigService.FALLBACK_FAMILY_PROPERTY, "Serif");

        assertEquals(Paths.get("override.ttf"), config.getFontPath());
        assertEquals("Serif", config.getFallbackFontFamily());
    }
}
