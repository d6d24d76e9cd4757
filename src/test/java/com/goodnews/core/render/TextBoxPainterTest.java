package com.goodnews.core.render;

import com.goodnews.core.fit.FitResult;
import com.goodnews.core.glyph.EmojiClassifier;
import com.goodnews.core.glyph.FontCache;
import com.goodnews.core.glyph.GlyphClass;
import com.goodnews.core.glyph.PlainMetrics;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextBoxPainterTest {

    private static final Font PRIMARY = new Font(Font.SANS_SERIF, Font.PLAIN, 1);
    private static final Font EMOJI = new Font(Font.SERIF, Font.PLAIN, 1);

    private static final Predicate<Color> RED = c -> c.getRed() > 150 && c.getGreen() < 100 && c.getBlue() < 100;
    private static final Predicate<Color> BLUE = c -> c.getBlue() > 150 && c.getRed() < 100 && c.getGreen() < 100;
    private static final Predicate<Color> NOT_WHITE = c -> c.getRed() < 250 || c.getGreen() < 250 || c.getBlue() < 250;

    private final TemplateRegistry outlined = TemplateRegistry.fromJson("""
        {
          "templates": {
            "good": { "image": "good_news.jpg", "fontColor": "#FF0000", "strokeColor": "#0000FF", "strokeWidth": 4 }
          }
        }
        """);

    @Test
    void strokeOutlineIsDrawnAroundTheFill() {
        NewsTextLayoutService service = NewsTextLayoutService.create(FontCache.of(PRIMARY, null), outlined);

        BufferedImage canvas = paint(service, service.layout("good", "Good news", 800, 600));

        assertTrue(count(canvas, BLUE) > 0, "expected stroke-colored pixels");
        assertTrue(count(canvas, RED) > 0, "expected fill-colored pixels");
    }

    @Test
    void emojiTextIsDrawnWithTheComposedFonts() {
        NewsTextLayoutService service = NewsTextLayoutService.create(FontCache.of(PRIMARY, EMOJI), outlined);
        PlacedText placed = service.layout("good", "Party ★ time", 800, 600);

        BufferedImage canvas = paint(service, placed);

        assertEquals(GlyphClass.EMOJI_AWARE, placed.fit().glyphClass());
        assertTrue(count(canvas, RED) > 0, "expected fill-colored pixels");
    }

    @Test
    void blankLinesLeaveTheirSlotEmpty() {
        FontCache fonts = FontCache.of(PRIMARY, null);
        NewsTemplate template = outlined.forType("good");
        TextBox box = template.textBox(800, 600);
        FitResult fit = new FitResult(40, 4, List.of("Good", "", "News"), true, GlyphClass.PLAIN);
        List<PlacedLine> lines = TextBoxLayout.place(fit, box.width(), box.height(), new PlainMetrics(fonts));
        TextBoxPainter painter = new TextBoxPainter(fonts, new EmojiClassifier());

        BufferedImage canvas = blankCanvas();
        Graphics2D g2d = canvas.createGraphics();
        try {
            painter.paint(g2d, new PlacedText(template, box, fit, lines));
        } finally {
            g2d.dispose();
        }

        // slots are 60 tall and start 90 below the box top; the middle one spans 150..210
        int top = (int) (box.y() + lines.get(1).top());
        assertEquals(270, top);
        int inMiddleSlot = 0;
        for (int y = top + 10; y < top + 50; y++) {
            for (int x = (int) box.x(); x < box.x() + box.width(); x++) {
                if (NOT_WHITE.test(new Color(canvas.getRGB(x, y)))) {
                    inMiddleSlot++;
                }
            }
        }
        assertEquals(0, inMiddleSlot);
        assertTrue(count(canvas, RED) > 0, "the other lines are still drawn");
    }

    private static BufferedImage paint(NewsTextLayoutService service, PlacedText placed) {
        BufferedImage canvas = blankCanvas();
        Graphics2D g2d = canvas.createGraphics();
        try {
            service.paint(g2d, placed);
        } finally {
            g2d.dispose();
        }
        return canvas;
    }

    private static BufferedImage blankCanvas() {
        BufferedImage canvas = new BufferedImage(800, 600, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = canvas.createGraphics();
        try {
            g2d.setColor(Color.WHITE);
            g2d.fillRect(0, 0, 800, 600);
        } finally {
            g2d.dispose();
        }
        return canvas;
    }

    private static int count(BufferedImage canvas, Predicate<Color> matches) {
        int found = 0;
        for (int y = 0; y < canvas.getHeight(); y++) {
            for (int x = 0; x < canvas.getWidth(); x++) {
                if (matches.test(new Color(canvas.getRGB(x, y)))) {
                    found++;
                }
            }
        }
        return found;
    }
}
