package com.goodnews.core.glyph;

/**
 * Decides which code points belong to the emoji/symbol glyph class.
 * <p>
 * A code point qualifies when its general category is "Symbol, Other" or when it lies in
 * the U+1F000..U+1F9FF emoji blocks. Stateless and safe to share.
 */
public class EmojiClassifier {
    static final int EMOJI_BLOCK_START = 0x1F000;
    static final int EMOJI_BLOCK_END = 0x1F9FF;

    public boolean isEmoji(int codePoint) {
        if (codePoint >= EMOJI_BLOCK_START && codePoint <= EMOJI_BLOCK_END) {
            return true;
        }
        return Character.getType(codePoint) == Character.OTHER_SYMBOL;
    }

    public boolean containsEmoji(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return text.codePoints().anyMatch(this::isEmoji);
    }

    public GlyphClass classify(String text) {
        return containsEmoji(text) ? GlyphClass.EMOJI_AWARE : GlyphClass.PLAIN;
    }
}
