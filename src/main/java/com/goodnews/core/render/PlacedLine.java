package com.goodnews.core.render;

/**
 * A fitted line positioned relative to the text box origin.
 *
 * @param x        left edge that centers the line horizontally
 * @param top      top of the line's slot
 * @param baseline baseline to draw at
 * @param width    measured advance width
 */
public record PlacedLine(String text, double x, double top, double baseline, double width) {

    /**
     * Blank lines keep their slot but are not drawn.
     */
    public boolean drawable() {
        return text != null && !text.isBlank();
    }
}
