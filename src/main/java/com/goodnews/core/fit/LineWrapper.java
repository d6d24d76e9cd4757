package com.goodnews.core.fit;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy word wrap by code point count.
 * <p>
 * Whitespace-delimited tokens are packed onto a line, one space apart, while the line stays
 * within the budget. A token longer than the budget is broken without hyphenation: its first
 * piece fills the room left on the current line, the rest continues in budget-sized pieces.
 * Lines never begin or end with whitespace, and surrogate pairs are never split.
 */
public final class LineWrapper {

    public List<String> wrap(String text, int charsPerLine) {
        if (charsPerLine < 1) {
            throw new IllegalArgumentException("charsPerLine must be at least 1, was " + charsPerLine);
        }
        List<String> lines = new ArrayList<>();
        StringBuilder line = new StringBuilder();
        int lineLength = 0;

        for (String token : TextNormalizer.tokens(text)) {
            int[] codePoints = token.codePoints().toArray();
            int tokenLength = codePoints.length;
            int needed = lineLength == 0 ? tokenLength : lineLength + 1 + tokenLength;

            if (needed <= charsPerLine) {
                if (lineLength > 0) {
                    line.append(' ');
                    lineLength++;
                }
                line.append(token);
                lineLength += tokenLength;
                continue;
            }

            if (tokenLength <= charsPerLine) {
                lines.add(line.toString());
                line.setLength(0);
                line.append(token);
                lineLength = tokenLength;
                continue;
            }

            int consumed = 0;
            int room = lineLength == 0 ? charsPerLine : charsPerLine - lineLength - 1;
            if (room >= 1) {
                if (lineLength > 0) {
                    line.append(' ');
                }
                line.append(new String(codePoints, 0, room));
                consumed = room;
            }
            if (line.length() > 0) {
                lines.add(line.toString());
                line.setLength(0);
            }
            while (tokenLength - consumed > charsPerLine) {
                lines.add(new String(codePoints, consumed, charsPerLine));
                consumed += charsPerLine;
            }
            line.append(new String(codePoints, consumed, tokenLength - consumed));
            lineLength = tokenLength - consumed;
        }

        if (lineLength > 0) {
            lines.add(line.toString());
        }
        return lines;
    }
}
