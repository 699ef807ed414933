package com.yizhaoqi.kb.chunk;

import com.yizhaoqi.kb.entity.TextChunk;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;


class TextChunkerTest {

    private final TextChunker chunker = new TextChunker();

    @Test
    void testSplit_TwelveHundredCharactersGivesThreeChunks() {
        String content = "a".repeat(1200);

        List<TextChunk> chunks = chunker.split(content, 500, 50);

        assertEquals(3, chunks.size());
        assertEquals(0, chunks.get(0).getChunkIndex());
        assertEquals(1, chunks.get(1).getChunkIndex());
        assertEquals(2, chunks.get(2).getChunkIndex());
        assertEquals(0, chunks.get(0).getStartOffset());
        assertEquals(500, chunks.get(0).getEndOffset());
        assertEquals(450, chunks.get(1).getStartOffset());
        assertEquals(950, chunks.get(1).getEndOffset());
        assertEquals(900, chunks.get(2).getStartOffset());
        assertEquals(1200, chunks.get(2).getEndOffset());
        assertEquals(300, chunks.get(2).getContent().length());
    }

    @Test
    void testSplit_ConsecutiveChunksShareOverlap() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < 300; i++) {
            builder.append((char) ('a' + i % 26));
        }
        String content = builder.toString();

        List<TextChunk> chunks = chunker.split(content, 100, 20);

        for (int i = 1; i < chunks.size(); i++) {
            String previous = chunks.get(i - 1).getContent();
            String current = chunks.get(i).getContent();
            assertEquals(previous.substring(previous.length() - 20), current.substring(0, 20));
        }
        TextChunk last = chunks.get(chunks.size() - 1);
        assertEquals(content.length(), last.getEndOffset());
    }

    @Test
    void testSplit_ShortContentIsSingleChunk() {
        List<TextChunk> chunks = chunker.split("short text", 1000, 200);

        assertEquals(1, chunks.size());
        assertEquals("short text", chunks.get(0).getContent());
    }

    @Test
    void testSplit_ExactMultipleEndsOnBoundary() {
        List<TextChunk> chunks = chunker.split("x".repeat(1000), 500, 0);

        assertEquals(2, chunks.size());
        assertEquals(1000, chunks.get(1).getEndOffset());
    }

    @Test
    void testSplit_EmptyContent() {
        assertTrue(chunker.split("", 500, 50).isEmpty());
        assertTrue(chunker.split(null, 500, 50).isEmpty());
    }

    @Test
    void testSplit_RejectsOverlapNotSmallerThanSize() {
        assertThrows(IllegalArgumentException.class, () -> chunker.split("text", 100, 100));
        assertThrows(IllegalArgumentException.class, () -> chunker.split("text", 100, 150));
        assertThrows(IllegalArgumentException.class, () -> chunker.split("text", 100, -1));
        assertThrows(IllegalArgumentException.class, () -> chunker.split("text", 0, 0));
    }

    @Test
    void testSplit_WindowEndNeverCutsSurrogatePair() {
        String emoji = new String(Character.toChars(0x1F600));
        String content = "abc" + emoji + "def";

        List<TextChunk> chunks = chunker.split(content, 4, 1);

        assertEquals(3, chunks.size());
        assertEquals("abc", chunks.get(0).getContent());
        assertEquals(emoji + "de", chunks.get(1).getContent());
        assertEquals(3, chunks.get(1).getStartOffset());
        assertEquals("ef", chunks.get(2).getContent());
        chunks.forEach(chunk -> assertTrue(isWellFormed(chunk.getContent()), chunk.getContent()));
    }

    @Test
    void testSplit_WindowStartNeverCutsSurrogatePair() {
        String emoji = new String(Character.toChars(0x1F600));
        String content = "a" + emoji + "b";

        List<TextChunk> chunks = chunker.split(content, 2, 0);

        assertEquals(2, chunks.size());
        assertEquals("a", chunks.get(0).getContent());
        assertEquals(emoji + "b", chunks.get(1).getContent());
        assertEquals(1, chunks.get(1).getStartOffset());
        assertEquals(content.length(), chunks.get(1).getEndOffset());
    }

    private static boolean isWellFormed(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }
}
