package com.goodnews.core.glyph;

/**
 * Measures text as it will be drawn at a given font size.
 */
public interface GlyphMetricsProvider {

    /**
     * @return the advance width of {@code text} at {@code fontSize}, 0 for empty text
     */
    double measure(String text, int fontSize);

    /**
     * Height of the glyph extent of {@code text}, used when placing the baseline.
     * Not part of fitting, which budgets {@code fontSize * 1.5} per line.
     */
    default double lineHeight(String text, int fontSize) {
        return fontSize;
    }

    /**
     * Distance from the top of the glyph extent to the baseline.
     */
    default double ascent(String text, int fontSize) {
        return fontSize * 0.8;
    }
}
