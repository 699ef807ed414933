package com.yizhaoqi.kb.chunk;

import com.yizhaoqi.kb.entity.TextChunk;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into fixed-size overlapping character windows. Window {@code i} starts at
 * {@code i * (chunkSize - chunkOverlap)}; the last window is the first one that reaches the end of the text.
 * A window edge that would fall inside a surrogate pair is moved so the pair stays whole.
 */
@Component
public class TextChunker {

    public List<TextChunk> split(String content, int chunkSize, int chunkOverlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException(String.format(
                    "chunkOverlap must be in [0, chunkSize): overlap=%d, size=%d", chunkOverlap, chunkSize));
        }
        List<TextChunk> chunks = new ArrayList<>();
        if (content == null || content.isEmpty()) {
            return chunks;
        }

        int step = chunkSize - chunkOverlap;
        int length = content.length();
        for (int windowStart = 0; ; windowStart += step) {
            int start = windowStart;
            if (splitsSurrogatePair(content, start)) {
                start--;
            }
            int end = Math.min(windowStart + chunkSize, length);
            if (splitsSurrogatePair(content, end)) {
                end = end - 1 > start ? end - 1 : end + 1;
            }
            chunks.add(new TextChunk(chunks.size(), content.substring(start, end), start, end));
            if (end == length) {
                break;
            }
        }
        return chunks;
    }

    private static boolean splitsSurrogatePair(String content, int index) {
        return index > 0 && index < content.length()
                && Character.isLowSurrogate(content.charAt(index))
                && Character.isHighSurrogate(content.charAt(index - 1));
    }
}
