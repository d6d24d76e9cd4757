package com.goodnews.core.glyph;

import java.awt.Font;
import java.awt.font.LineMetrics;
import java.awt.font.TextAttribute;
import java.text.AttributedString;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lays out text as alternating runs of primary-font glyphs and emoji-font glyphs.
 * <p>
 * Widths are the sum of the run advances at the requested size. Heights treat emoji
 * runs as {@value #EMOJI_SCALE} times taller, which only matters when placing baselines.
 */
public final class EmojiCompositor {
    public static final float EMOJI_SCALE = 1.3f;

    private final FontCache fonts;
    private final EmojiClassifier classifier;

    private EmojiCompositor(FontCache fonts, EmojiClassifier classifier) {
        this.fonts = fonts;
        this.classifier = classifier;
    }

    /**
     * @return a compositor, or empty when the cache holds no emoji font
     */
    public static Optional<EmojiCompositor> create(FontCache fonts, EmojiClassifier classifier) {
        if (!fonts.hasEmojiFont()) {
            return Optional.empty();
        }
        return Optional.of(new EmojiCompositor(fonts, classifier));
    }

    public double advanceWidth(String text, int fontSize) {
        double width = 0;
        for (GlyphRun run : runs(text)) {
            width += runFont(run, fontSize).getStringBounds(text, run.start(), run.end(), fonts.renderContext()).getWidth();
        }
        return width;
    }

    public double advanceHeight(String text, int fontSize) {
        double height = 0;
        for (GlyphRun run : runsOrBlank(text)) {
            LineMetrics metrics = runMetrics(text, run, fontSize);
            height = Math.max(height, scaled(run, metrics.getAscent() + metrics.getDescent()));
        }
        return height;
    }

    public double ascent(String text, int fontSize) {
        double ascent = 0;
        for (GlyphRun run : runsOrBlank(text)) {
            ascent = Math.max(ascent, scaled(run, runMetrics(text, run, fontSize).getAscent()));
        }
        return ascent;
    }

    /**
     * Builds drawable text with the emoji font applied to emoji runs.
     */
    public AttributedString attributed(String text, int fontSize) {
        AttributedString attributed = new AttributedString(text);
        attributed.addAttribute(TextAttribute.FONT, fonts.primaryFont(fontSize));
        for (GlyphRun run : runs(text)) {
            if (run.emoji()) {
                attributed.addAttribute(TextAttribute.FONT, runFont(run, fontSize), run.start(), run.end());
            }
        }
        return attributed;
    }

    /**
     * Splits text into maximal runs of one glyph class. Marks, format characters and variation
     * selectors stay with the run they follow so emoji sequences are not torn apart.
     */
    List<GlyphRun> runs(String text) {
        List<GlyphRun> runs = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return runs;
        }
        int runStart = 0;
        boolean runEmoji = classifier.isEmoji(text.codePointAt(0));
        int index = Character.charCount(text.codePointAt(0));
        while (index < text.length()) {
            int codePoint = text.codePointAt(index);
            if (!isJoining(codePoint) && classifier.isEmoji(codePoint) != runEmoji) {
                runs.add(new GlyphRun(runStart, index, runEmoji));
                runStart = index;
                runEmoji = !runEmoji;
            }
            index += Character.charCount(codePoint);
        }
        runs.add(new GlyphRun(runStart, text.length(), runEmoji));
        return runs;
    }

    private List<GlyphRun> runsOrBlank(String text) {
        List<GlyphRun> runs = runs(text);
        return runs.isEmpty() ? List.of(new GlyphRun(0, 0, false)) : runs;
    }

    private LineMetrics runMetrics(String text, GlyphRun run, int fontSize) {
        Font font = runFont(run, fontSize);
        if (run.start() == run.end()) {
            return font.getLineMetrics(" ", fonts.renderContext());
        }
        return font.getLineMetrics(text, run.start(), run.end(), fonts.renderContext());
    }

    private Font runFont(GlyphRun run, int fontSize) {
        if (run.emoji()) {
            return fonts.emojiFont(fontSize).orElseGet(() -> fonts.primaryFont(fontSize));
        }
        return fonts.primaryFont(fontSize);
    }

    private static double scaled(GlyphRun run, double value) {
        return run.emoji() ? value * EMOJI_SCALE : value;
    }

    private static boolean isJoining(int codePoint) {
        int type = Character.getType(codePoint);
        return type == Character.NON_SPACING_MARK
            || type == Character.ENCLOSING_MARK
            || type == Character.FORMAT;
    }

    /**
     * Char range {@code [start, end)} of one glyph class.
     */
    record GlyphRun(int start, int end, boolean emoji) {
    }
}
