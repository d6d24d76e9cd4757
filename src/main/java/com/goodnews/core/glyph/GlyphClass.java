package com.goodnews.core.glyph;

/**
 * Measurement class of a whole text: plain font glyphs only, or plain glyphs mixed with emoji.
 */
public enum GlyphClass {
    PLAIN,
    EMOJI_AWARE
}
