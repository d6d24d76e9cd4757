package com.goodnews.core.render;

import com.goodnews.core.fit.FitRequest;
import com.goodnews.core.fit.FitResult;
import com.goodnews.core.glyph.GlyphMetricsProvider;

import java.util.ArrayList;
import java.util.List;

/**
 * Positions fitted lines inside their box.
 * <p>
 * Each line is centered horizontally; the block of {@code lineCount} slots, each
 * {@code fontSize * 1.5} tall, is centered vertically. Glyphs sit in the middle of their slot.
 * Blank lines still take a slot.
 */
public final class TextBoxLayout {

    private TextBoxLayout() {
    }

    public static List<PlacedLine> place(FitResult fit, double boxWidth, double boxHeight, GlyphMetricsProvider metrics) {
        int fontSize = fit.fontSize();
        double slot = fontSize * FitRequest.LINE_SPACING_FACTOR;
        double cursor = (boxHeight - fit.lineCount() * slot) / 2;

        List<PlacedLine> placed = new ArrayList<>(fit.lineCount());
        for (String line : fit.lines()) {
            double width = metrics.measure(line, fontSize);
            double glyphTop = cursor + (slot - metrics.lineHeight(line, fontSize)) / 2;
            double baseline = glyphTop + metrics.ascent(line, fontSize);
            placed.add(new PlacedLine(line, (boxWidth - width) / 2, cursor, baseline, width));
            cursor += slot;
        }
        return placed;
    }
}
