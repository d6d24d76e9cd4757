package com.goodnews.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Central entry point for resolving font configuration from system property overrides,
 * persisted preferences and the bundled asset defaults, in that order.
 */
public final class ConfigService {
    static final String FONT_PATH_PROPERTY = "fontPath";
    static final String EMOJI_FONT_PATH_PROPERTY = "emojiFontPath";
    static final String FALLBACK_FAMILY_PROPERTY = "fallbackFontFamily";

    static final String PREF_KEY_FONT_PATH = "font.path";
    static final String PREF_KEY_EMOJI_FONT_PATH = "font.emoji.path";

    static final String DEFAULT_FALLBACK_FAMILY = "SansSerif";

    private static final String ASSETS_DIR = "assets";
    private static final String DEFAULT_FONT_FILE = "font.ttf";
    private static final String DEFAULT_EMOJI_FONT_FILE = "NotoColorEmoji.ttf";

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    public Path getFontPath() {
        return resolvePath(FONT_PATH_PROPERTY, PREF_KEY_FONT_PATH, DEFAULT_FONT_FILE);
    }

    public void setFontPath(Path fontPath) {
        preferences.putPath(PREF_KEY_FONT_PATH, fontPath);
    }

    public Path getEmojiFontPath() {
        return resolvePath(EMOJI_FONT_PATH_PROPERTY, PREF_KEY_EMOJI_FONT_PATH, DEFAULT_EMOJI_FONT_FILE);
    }

    public void setEmojiFontPath(Path emojiFontPath) {
        preferences.putPath(PREF_KEY_EMOJI_FONT_PATH, emojiFontPath);
    }

    /**
     * Logical font family used when the configured font file cannot be loaded.
     */
    public String getFallbackFontFamily() {
        String override = System.getProperty(FALLBACK_FAMILY_PROPERTY);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        return DEFAULT_FALLBACK_FAMILY;
    }

    private Path resolvePath(String property, String preferenceKey, String defaultFile) {
        String override = System.getProperty(property);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        Optional<Path> persisted = preferences.getPath(preferenceKey);
        return persisted.orElseGet(() -> Paths.get(ASSETS_DIR, defaultFile));
    }
}
