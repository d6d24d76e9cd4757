package com.goodnews.core.fit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LineWrapperTest {

    private final LineWrapper wrapper = new LineWrapper();

    @Test
    void packsWordsWhileTheyFit() {
        assertEquals(List.of("hello world"), wrapper.wrap("hello world", 11));
        assertEquals(List.of("hello", "world"), wrapper.wrap("hello world", 10));
        assertEquals(List.of("a b", "c d"), wrapper.wrap("a b c d", 3));
    }

    @Test
    void breaksLongWordsWithoutHyphens() {
        assertEquals(List.of("AAAA", "AAAA", "AA"), wrapper.wrap("AAAAAAAAAA", 4));
    }

    @Test
    void longWordFillsRoomLeftOnCurrentLine() {
        assertEquals(List.of("ab cd", "efghi", "j"), wrapper.wrap("ab cdefghij", 5));
    }

    @Test
    void longWordStartsNewLineWhenNoRoomIsLeft() {
        assertEquals(List.of("abcd", "efghi", "jk"), wrapper.wrap("abcd efghijk", 5));
    }

    @Test
    void wordsContinueAfterTailOfBrokenWord() {
        assertEquals(List.of("abcde", "fg hi"), wrapper.wrap("abcdefg hi", 5));
    }

    @Test
    void countsCodePointsNotChars() {
        assertEquals(List.of("😀😀", "😀"), wrapper.wrap("😀😀😀", 2));
        assertEquals(List.of("今天是", "个好日", "子"), wrapper.wrap("今天是个好日子", 3));
    }

    @Test
    void emptyOrBlankInputYieldsNoLines() {
        assertTrue(wrapper.wrap("", 5).isEmpty());
        assertTrue(wrapper.wrap(" \t\n ", 5).isEmpty());
        assertTrue(wrapper.wrap(null, 5).isEmpty());
    }

    @Test
    void linesNeverCarryEdgeWhitespace() {
        for (String line : wrapper.wrap("  spaced   out\ttext  here ", 6)) {
            assertEquals(line.strip(), line);
            assertTrue(!line.isEmpty());
        }
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> wrapper.wrap("text", 0));
    }

    @Test
    void sameInputSameOutput() {
        String text = "The quick brown fox jumps over the lazy dog 🦊";
        assertEquals(wrapper.wrap(text, 7), wrapper.wrap(text, 7));
    }
}
