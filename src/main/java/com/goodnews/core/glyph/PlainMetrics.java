package com.goodnews.core.glyph;

import java.awt.Font;
import java.awt.font.LineMetrics;

/**
 * Measures text with the primary font alone.
 */
public final class PlainMetrics implements GlyphMetricsProvider {

    private final FontCache fonts;

    public PlainMetrics(FontCache fonts) {
        this.fonts = fonts;
    }

    @Override
    public double measure(String text, int fontSize) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Font font = fonts.primaryFont(fontSize);
        return font.getStringBounds(text, fonts.renderContext()).getWidth();
    }

    @Override
    public double lineHeight(String text, int fontSize) {
        LineMetrics metrics = lineMetrics(text, fontSize);
        return metrics.getAscent() + metrics.getDescent();
    }

    @Override
    public double ascent(String text, int fontSize) {
        return lineMetrics(text, fontSize).getAscent();
    }

    private LineMetrics lineMetrics(String text, int fontSize) {
        String sample = (text == null || text.isEmpty()) ? " " : text;
        return fonts.primaryFont(fontSize).getLineMetrics(sample, fonts.renderContext());
    }
}
