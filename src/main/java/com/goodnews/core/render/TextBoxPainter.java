package com.goodnews.core.render;

import com.goodnews.core.glyph.EmojiClassifier;
import com.goodnews.core.glyph.EmojiCompositor;
import com.goodnews.core.glyph.FontCache;
import com.goodnews.core.glyph.GlyphClass;

import java.awt.BasicStroke;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.font.TextAttribute;
import java.awt.font.TextLayout;
import java.awt.geom.AffineTransform;
import java.text.AttributedString;
import java.util.Map;

/**
 * Draws placed text onto a caller-owned canvas in the template's colors.
 */
public final class TextBoxPainter {

    private final FontCache fonts;
    private final EmojiCompositor compositor;

    public TextBoxPainter(FontCache fonts, EmojiClassifier classifier) {
        this.fonts = fonts;
        this.compositor = EmojiCompositor.create(fonts, classifier).orElse(null);
    }

    public void paint(Graphics2D target, PlacedText placed) {
        Graphics2D g2d = (Graphics2D) target.create();
        try {
            setupHighQualityRendering(g2d);
            NewsTemplate template = placed.template();
            TextBox box = placed.box();
            int fontSize = placed.fit().fontSize();
            boolean composite = placed.fit().glyphClass() == GlyphClass.EMOJI_AWARE && compositor != null;

            for (PlacedLine line : placed.lines()) {
                if (!line.drawable()) {
                    continue;
                }
                AttributedString text = composite
                    ? compositor.attributed(line.text(), fontSize)
                    : new AttributedString(line.text(), Map.of(TextAttribute.FONT, fonts.primaryFont(fontSize)));
                TextLayout layout = new TextLayout(text.getIterator(), g2d.getFontRenderContext());
                float x = (float) (box.x() + line.x());
                float y = (float) (box.y() + line.baseline());

                if (template.strokeWidth() > 0) {
                    Shape outline = layout.getOutline(AffineTransform.getTranslateInstance(x, y));
                    g2d.setColor(template.strokeColor());
                    g2d.setStroke(new BasicStroke(template.strokeWidth() * 2f, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
                    g2d.draw(outline);
                }
                g2d.setColor(template.fontColor());
                layout.draw(g2d, x, y);
            }
        } finally {
            g2d.dispose();
        }
    }

    private static void setupHighQualityRendering(Graphics2D g2d) {
        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        g2d.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_ON);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
    }
}
