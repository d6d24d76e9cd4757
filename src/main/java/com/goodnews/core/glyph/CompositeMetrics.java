package com.goodnews.core.glyph;

import com.goodnews.logging.AppLogger;

import java.util.logging.Logger;

/**
 * Emoji-aware measurement. Falls back to {@link PlainMetrics} when no emoji font is available,
 * in which case emoji widths come from the primary font and may be undercounted.
 */
public final class CompositeMetrics implements GlyphMetricsProvider {
    private static final Logger LOGGER = AppLogger.get();

    private final PlainMetrics plain;
    private final EmojiCompositor compositor;

    public CompositeMetrics(FontCache fonts, EmojiClassifier classifier) {
        this.plain = new PlainMetrics(fonts);
        this.compositor = EmojiCompositor.create(fonts, classifier).orElse(null);
        if (compositor == null) {
            LOGGER.warning("Emoji compositor unavailable, emoji text will be measured with the primary font");
        }
    }

    public boolean isDegraded() {
        return compositor == null;
    }

    @Override
    public double measure(String text, int fontSize) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return compositor == null ? plain.measure(text, fontSize) : compositor.advanceWidth(text, fontSize);
    }

    @Override
    public double lineHeight(String text, int fontSize) {
        return compositor == null ? plain.lineHeight(text, fontSize) : compositor.advanceHeight(text, fontSize);
    }

    @Override
    public double ascent(String text, int fontSize) {
        return compositor == null ? plain.ascent(text, fontSize) : compositor.ascent(text, fontSize);
    }
}
