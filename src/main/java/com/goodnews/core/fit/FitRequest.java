package com.goodnews.core.fit;

/**
 * One text to fit into a box.
 * <p>
 * The text is normalized on construction (whitespace collapsed, blank input replaced by
 * {@link TextNormalizer#EMPTY_PLACEHOLDER}), so {@link #text()} is never empty.
 *
 * @param text            normalized text
 * @param boxWidth        box width in device-independent units
 * @param boxHeight       box height in device-independent units
 * @param initialFontSize largest font size tried
 * @param minFontSize     smallest font size allowed, also the fallback size
 * @param fontSizeStep    decrement between tried font sizes
 */
public record FitRequest(String text,
                         double boxWidth,
                         double boxHeight,
                         int initialFontSize,
                         int minFontSize,
                         int fontSizeStep) {

    public static final int MAX_LINES = 3;
    public static final double LINE_SPACING_FACTOR = 1.5;
    public static final int DEFAULT_FONT_SIZE_STEP = 5;

    public FitRequest {
        text = TextNormalizer.normalize(text);
        if (!(boxWidth > 0) || !(boxHeight > 0)) {
            throw new IllegalArgumentException("Box dimensions must be positive: %s x %s".formatted(boxWidth, boxHeight));
        }
        if (minFontSize < 1) {
            throw new IllegalArgumentException("minFontSize must be positive, was " + minFontSize);
        }
        if (initialFontSize < minFontSize) {
            throw new IllegalArgumentException(
                "initialFontSize %d is below minFontSize %d".formatted(initialFontSize, minFontSize));
        }
        if (fontSizeStep < 1) {
            throw new IllegalArgumentException("fontSizeStep must be positive, was " + fontSizeStep);
        }
    }

    public static FitRequest of(String text, double boxWidth, double boxHeight, int initialFontSize, int minFontSize) {
        return new FitRequest(text, boxWidth, boxHeight, initialFontSize, minFontSize, DEFAULT_FONT_SIZE_STEP);
    }

    /**
     * Length of the text in code points.
     */
    public int length() {
        return text.codePointCount(0, text.length());
    }

    public int maxLines() {
        return MAX_LINES;
    }

    public double lineSpacingFactor() {
        return LINE_SPACING_FACTOR;
    }

    /**
     * Vertical space {@code lineCount} lines take at {@code fontSize}.
     */
    public double textHeight(int lineCount, int fontSize) {
        return (double) lineCount * fontSize * LINE_SPACING_FACTOR;
    }
}
