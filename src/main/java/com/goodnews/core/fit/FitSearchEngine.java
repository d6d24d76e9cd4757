package com.goodnews.core.fit;

import com.goodnews.core.glyph.CompositeMetrics;
import com.goodnews.core.glyph.EmojiClassifier;
import com.goodnews.core.glyph.FontCache;
import com.goodnews.core.glyph.GlyphClass;
import com.goodnews.core.glyph.GlyphMetricsProvider;
import com.goodnews.core.glyph.PlainMetrics;
import com.goodnews.logging.AppLogger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Searches for the largest font size and fewest lines that fit a text into a box.
 * <p>
 * Line counts are tried from 1 to {@link FitRequest#MAX_LINES}. For each count the font size
 * starts over at the initial size and steps down to the minimum; at each size the character
 * budget {@code ceil(length / lineCount)} is tried with the offsets in {@link #BUDGET_OFFSETS},
 * in that order. A candidate only counts if it wraps to exactly the current line count.
 * The first candidate whose widest line and total height fit is returned. If none fits, the
 * result is a degraded layout at the minimum font size with {@code fitGuaranteed == false}.
 */
public final class FitSearchEngine {
    private static final Logger LOGGER = AppLogger.get();

    static final int[] BUDGET_OFFSETS = {0, -1, 1, -2, 2};

    private final EmojiClassifier classifier;
    private final LineWrapper wrapper;
    private final GlyphMetricsProvider plainMetrics;
    private final GlyphMetricsProvider emojiMetrics;

    public FitSearchEngine(EmojiClassifier classifier,
                           LineWrapper wrapper,
                           GlyphMetricsProvider plainMetrics,
                           GlyphMetricsProvider emojiMetrics) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.wrapper = Objects.requireNonNull(wrapper, "wrapper");
        this.plainMetrics = Objects.requireNonNull(plainMetrics, "plainMetrics");
        this.emojiMetrics = Objects.requireNonNull(emojiMetrics, "emojiMetrics");
    }

    /**
     * Engine measuring with the fonts held by {@code fonts}.
     */
    public static FitSearchEngine create(FontCache fonts) {
        EmojiClassifier classifier = new EmojiClassifier();
        return new FitSearchEngine(
            classifier,
            new LineWrapper(),
            new PlainMetrics(fonts),
            new CompositeMetrics(fonts, classifier)
        );
    }

    public FitResult fit(FitRequest request) {
        GlyphClass glyphClass = classifier.classify(request.text());
        GlyphMetricsProvider metrics = metricsFor(glyphClass);

        for (int lineCount = 1; lineCount <= request.maxLines(); lineCount++) {
            Optional<FitResult> fit = searchLineCount(request, lineCount, glyphClass, metrics);
            if (fit.isPresent()) {
                return fit.get();
            }
        }
        FitResult fallback = fallback(request, glyphClass);
        LOGGER.info("No fit for %d code points in %.0fx%.0f, falling back to size %d over %d lines"
            .formatted(request.length(), request.boxWidth(), request.boxHeight(),
                fallback.fontSize(), fallback.lineCount()));
        return fallback;
    }

    /**
     * Provider used for a glyph class, so callers can measure lines the way the search did.
     */
    public GlyphMetricsProvider metricsFor(GlyphClass glyphClass) {
        return glyphClass == GlyphClass.EMOJI_AWARE ? emojiMetrics : plainMetrics;
    }

    Optional<FitResult> searchLineCount(FitRequest request,
                                        int lineCount,
                                        GlyphClass glyphClass,
                                        GlyphMetricsProvider metrics) {
        int startBudget = ceilDiv(request.length(), lineCount);
        for (int fontSize = request.initialFontSize();
             fontSize >= request.minFontSize();
             fontSize -= request.fontSizeStep()) {
            Optional<FitResult> fit = searchFontSize(request, lineCount, startBudget, fontSize, glyphClass, metrics);
            if (fit.isPresent()) {
                return fit;
            }
        }
        LOGGER.fine(() -> "No %d-line fit between sizes %d and %d"
            .formatted(lineCount, request.initialFontSize(), request.minFontSize()));
        return Optional.empty();
    }

    Optional<FitResult> searchFontSize(FitRequest request,
                                       int lineCount,
                                       int startBudget,
                                       int fontSize,
                                       GlyphClass glyphClass,
                                       GlyphMetricsProvider metrics) {
        if (request.textHeight(lineCount, fontSize) > request.boxHeight()) {
            return Optional.empty();
        }
        for (int budget : candidateBudgets(startBudget)) {
            Optional<FitResult> fit = tryCandidate(request, lineCount, budget, fontSize, glyphClass, metrics);
            if (fit.isPresent()) {
                return fit;
            }
        }
        return Optional.empty();
    }

    Optional<FitResult> tryCandidate(FitRequest request,
                                     int lineCount,
                                     int charsPerLine,
                                     int fontSize,
                                     GlyphClass glyphClass,
                                     GlyphMetricsProvider metrics) {
        List<String> lines = wrapper.wrap(request.text(), charsPerLine);
        if (lines.size() != lineCount) {
            return Optional.empty();
        }
        double widest = widestLine(lines, fontSize, metrics);
        if (widest > request.boxWidth() || request.textHeight(lineCount, fontSize) > request.boxHeight()) {
            return Optional.empty();
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Fit at size %d, %d chars per line, widest %.1f".formatted(fontSize, charsPerLine, widest));
        }
        return Optional.of(FitResult.fitted(fontSize, charsPerLine, lines, glyphClass));
    }

    FitResult fallback(FitRequest request, GlyphClass glyphClass) {
        int charsPerLine = ceilDiv(request.length(), request.maxLines());
        List<String> lines = foldToMaxLines(wrapper.wrap(request.text(), charsPerLine), request.maxLines());
        return FitResult.degraded(request.minFontSize(), charsPerLine, lines, glyphClass);
    }

    /**
     * Budgets in preference order, clamped to at least 1, each tried once.
     */
    static Set<Integer> candidateBudgets(int startBudget) {
        Set<Integer> budgets = new LinkedHashSet<>();
        for (int offset : BUDGET_OFFSETS) {
            budgets.add(Math.max(1, startBudget + offset));
        }
        return budgets;
    }

    /**
     * Joins any lines past {@code maxLines} onto the last kept line so no text is lost.
     */
    static List<String> foldToMaxLines(List<String> lines, int maxLines) {
        if (lines.size() <= maxLines) {
            return lines;
        }
        List<String> folded = new ArrayList<>(lines.subList(0, maxLines - 1));
        folded.add(String.join(" ", lines.subList(maxLines - 1, lines.size())));
        return folded;
    }

    private static double widestLine(List<String> lines, int fontSize, GlyphMetricsProvider metrics) {
        double widest = 0;
        for (String line : lines) {
            widest = Math.max(widest, metrics.measure(line, fontSize));
        }
        return widest;
    }

    private static int ceilDiv(int dividend, int divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
