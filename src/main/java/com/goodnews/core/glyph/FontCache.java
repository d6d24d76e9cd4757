package com.goodnews.core.glyph;

import com.goodnews.logging.AppLogger;

import java.awt.Font;
import java.awt.FontFormatException;
import java.awt.font.FontRenderContext;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Font resources shared by every measurement and drawing call.
 * <p>
 * Font files are read once when the cache is created; sized instances are derived on
 * demand and memoized, so one cache can serve concurrent fits. Create it at startup and
 * hand it to the metrics providers.
 */
public final class FontCache {
    private static final Logger LOGGER = AppLogger.get();
    private static final FontRenderContext RENDER_CONTEXT = new FontRenderContext(null, true, true);

    private final Font primaryBase;
    private final Font emojiBase;
    private final Map<Integer, Font> primaryBySize = new ConcurrentHashMap<>();
    private final Map<Integer, Font> emojiBySize = new ConcurrentHashMap<>();

    private FontCache(Font primaryBase, Font emojiBase) {
        this.primaryBase = primaryBase;
        this.emojiBase = emojiBase;
    }

    /**
     * Loads the primary font and, when present, the emoji font.
     *
     * @param primaryFontPath font file for ordinary glyphs; may be {@code null} to go straight to the fallback
     * @param emojiFontPath   color/emoji font file; {@code null} or missing disables emoji composition
     * @param fallbackFamily  logical family used when the primary file cannot be read
     * @throws FontUnavailableException if the primary file fails and no fallback family is given
     */
    public static FontCache load(Path primaryFontPath, Path emojiFontPath, String fallbackFamily) {
        Font primary = loadPrimary(primaryFontPath, fallbackFamily);
        Font emoji = loadEmoji(emojiFontPath);
        if (emoji != null) {
            LOGGER.info("Emoji font loaded from " + emojiFontPath + ", emoji rendering enabled");
        } else {
            LOGGER.info("No emoji font available, emoji glyphs will be measured with the primary font");
        }
        return new FontCache(primary, emoji);
    }

    /**
     * Wraps already created fonts. {@code emoji} may be {@code null}.
     */
    public static FontCache of(Font primary, Font emoji) {
        if (primary == null) {
            throw new FontUnavailableException("A primary font is required");
        }
        return new FontCache(primary, emoji);
    }

    public Font primaryFont(int size) {
        return primaryBySize.computeIfAbsent(size, s -> primaryBase.deriveFont(Font.PLAIN, (float) s));
    }

    public Optional<Font> emojiFont(int size) {
        if (emojiBase == null) {
            return Optional.empty();
        }
        return Optional.of(emojiBySize.computeIfAbsent(size, s -> emojiBase.deriveFont(Font.PLAIN, (float) s)));
    }

    public boolean hasEmojiFont() {
        return emojiBase != null;
    }

    public FontRenderContext renderContext() {
        return RENDER_CONTEXT;
    }

    private static Font loadPrimary(Path fontPath, String fallbackFamily) {
        IOException failure = null;
        if (fontPath != null) {
            try {
                return readFontFile(fontPath);
            } catch (IOException e) {
                failure = e;
                LOGGER.log(Level.WARNING, "Primary font " + fontPath + " could not be loaded, using " + fallbackFamily, e);
            }
        }
        if (fallbackFamily == null || fallbackFamily.isBlank()) {
            String message = "No usable font: " + (fontPath == null ? "no font file configured" : "failed to load " + fontPath)
                + " and no fallback family configured";
            throw failure == null ? new FontUnavailableException(message) : new FontUnavailableException(message, failure);
        }
        return new Font(fallbackFamily, Font.PLAIN, 1);
    }

    private static Font loadEmoji(Path fontPath) {
        if (fontPath == null || !fontPath.toFile().isFile()) {
            return null;
        }
        try {
            return readFontFile(fontPath);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Emoji font " + fontPath + " could not be loaded", e);
            return null;
        }
    }

    /**
     * Reads a TrueType/OpenType file, retrying as Type 1 before giving up.
     */
    static Font readFontFile(Path fontPath) throws IOException {
        File fontFile = fontPath.toFile();
        if (!fontFile.isFile()) {
            throw new IOException("Font file not found: " + fontPath);
        }
        try {
            return Font.createFont(Font.TRUETYPE_FONT, fontFile);
        } catch (FontFormatException | IOException e) {
            try {
                return Font.createFont(Font.TYPE1_FONT, fontFile);
            } catch (FontFormatException | IOException e2) {
                throw new IOException("Unreadable font file " + fontPath + ": " + e.getMessage(), e);
            }
        }
    }
}
