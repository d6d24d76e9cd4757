package com.goodnews.core.render;

import com.goodnews.config.ConfigService;
import com.goodnews.core.fit.FitRequest;
import com.goodnews.core.fit.FitResult;
import com.goodnews.core.fit.FitSearchEngine;
import com.goodnews.core.glyph.EmojiClassifier;
import com.goodnews.core.glyph.FontCache;
import com.goodnews.logging.AppLogger;

import java.awt.Graphics2D;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point for the surrounding generator: fits news text onto a background of known size
 * and draws it.
 */
public final class NewsTextLayoutService {
    private static final Logger LOGGER = AppLogger.get();

    private final TemplateRegistry templates;
    private final FitSearchEngine engine;
    private final TextBoxPainter painter;

    public NewsTextLayoutService(TemplateRegistry templates, FitSearchEngine engine, TextBoxPainter painter) {
        this.templates = templates;
        this.engine = engine;
        this.painter = painter;
    }

    /**
     * Service configured from the process-wide {@link ConfigService}.
     */
    public static NewsTextLayoutService create() {
        return create(ConfigService.getInstance());
    }

    /**
     * Loads fonts and templates once, as configured by {@code config}.
     *
     * @throws com.goodnews.core.glyph.FontUnavailableException if no font can be obtained
     */
    public static NewsTextLayoutService create(ConfigService config) {
        FontCache fonts = FontCache.load(config.getFontPath(), config.getEmojiFontPath(), config.getFallbackFontFamily());
        return create(fonts, TemplateRegistry.loadDefault());
    }

    public static NewsTextLayoutService create(FontCache fonts, TemplateRegistry templates) {
        return new NewsTextLayoutService(
            templates,
            FitSearchEngine.create(fonts),
            new TextBoxPainter(fonts, new EmojiClassifier())
        );
    }

    public PlacedText layout(String newsType, String rawText, int imageWidth, int imageHeight) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image size must be positive: %dx%d".formatted(imageWidth, imageHeight));
        }
        NewsTemplate template = templates.forType(newsType);
        TextBox box = template.textBox(imageWidth, imageHeight);
        FitRequest request = new FitRequest(
            rawText,
            box.width(),
            box.height(),
            template.initialFontSize(),
            template.minFontSize(),
            template.fontSizeStep()
        );

        FitResult fit = engine.fit(request);
        List<PlacedLine> lines = TextBoxLayout.place(fit, box.width(), box.height(), engine.metricsFor(fit.glyphClass()));
        LOGGER.info("Laid out %s news at size %d over %d line(s)%s".formatted(
            template.type(), fit.fontSize(), fit.lineCount(), fit.fitGuaranteed() ? "" : " (may overflow)"));
        return new PlacedText(template, box, fit, lines);
    }

    public void paint(Graphics2D g2d, PlacedText placed) {
        painter.paint(g2d, placed);
    }
}
