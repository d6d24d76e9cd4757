package com.goodnews.core.render;

import com.goodnews.core.fit.FitResult;

import java.util.List;

/**
 * Everything needed to draw fitted text onto a background.
 */
public record PlacedText(NewsTemplate template, TextBox box, FitResult fit, List<PlacedLine> lines) {

    public PlacedText {
        lines = List.copyOf(lines);
    }
}
