package com.goodnews.core.fit;

import com.goodnews.core.glyph.GlyphClass;

import java.util.List;

/**
 * Outcome of a fit: the chosen font size and the wrapped lines.
 * <p>
 * When {@code fitGuaranteed} is false the result is the degraded fallback and may overflow
 * the box; callers must check it rather than expect an exception.
 *
 * @param glyphClass the measurement class the lines were measured with
 */
public record FitResult(int fontSize,
                        int charsPerLine,
                        List<String> lines,
                        boolean fitGuaranteed,
                        GlyphClass glyphClass) {

    public FitResult {
        lines = List.copyOf(lines);
        if (lines.isEmpty() || lines.size() > FitRequest.MAX_LINES) {
            throw new IllegalArgumentException("A fit holds 1 to %d lines, got %d".formatted(FitRequest.MAX_LINES, lines.size()));
        }
    }

    static FitResult fitted(int fontSize, int charsPerLine, List<String> lines, GlyphClass glyphClass) {
        return new FitResult(fontSize, charsPerLine, lines, true, glyphClass);
    }

    static FitResult degraded(int fontSize, int charsPerLine, List<String> lines, GlyphClass glyphClass) {
        return new FitResult(fontSize, charsPerLine, lines, false, glyphClass);
    }

    public int lineCount() {
        return lines.size();
    }
}
