package com.goodnews.core.render;

import com.goodnews.core.fit.FitResult;
import com.goodnews.core.glyph.GlyphClass;
import com.goodnews.core.glyph.GlyphMetricsProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextBoxLayoutTest {

    private final GlyphMetricsProvider halfEm = (text, fontSize) -> text.codePointCount(0, text.length()) * fontSize * 0.5;

    @Test
    void centersEachLineAndTheBlock() {
        FitResult fit = new FitResult(10, 4, List.of("ab", "abcd"), true, GlyphClass.PLAIN);

        List<PlacedLine> lines = TextBoxLayout.place(fit, 100, 100, halfEm);

        assertEquals(2, lines.size());
        PlacedLine first = lines.get(0);
        assertEquals(45, first.x(), 1e-9);
        assertEquals(35, first.top(), 1e-9);
        assertEquals(10, first.width(), 1e-9);

        PlacedLine second = lines.get(1);
        assertEquals(40, second.x(), 1e-9);
        assertEquals(50, second.top(), 1e-9);
    }

    @Test
    void baselineSitsInMiddleOfSlot() {
        FitResult fit = new FitResult(20, 5, List.of("hello"), true, GlyphClass.PLAIN);

        PlacedLine line = TextBoxLayout.place(fit, 200, 30, halfEm).get(0);

        // slot 30, glyph extent 20, ascent 16
        assertEquals(0, line.top(), 1e-9);
        assertEquals(5 + 16, line.baseline(), 1e-9);
    }

    @Test
    void blankLinesKeepTheirSlot() {
        FitResult fit = new FitResult(10, 4, List.of("ab", " ", "cd"), false, GlyphClass.PLAIN);

        List<PlacedLine> lines = TextBoxLayout.place(fit, 100, 45, halfEm);

        assertTrue(lines.get(0).drawable());
        assertFalse(lines.get(1).drawable());
        assertEquals(15, lines.get(1).top(), 1e-9);
        assertEquals(30, lines.get(2).top(), 1e-9);
    }

    @Test
    void overflowingFallbackStartsAboveTheBox() {
        FitResult fit = new FitResult(20, 4, List.of("aaaa", "bbbb", "cccc"), false, GlyphClass.PLAIN);

        List<PlacedLine> lines = TextBoxLayout.place(fit, 30, 60, halfEm);

        assertEquals(-15, lines.get(0).top(), 1e-9);
        assertEquals(-5, lines.get(0).x(), 1e-9);
    }
}
