package com.yizhaoqi.kb.entity;

import lombok.Getter;

/**
 * One window of a document's text. Offsets index into the extracted content, end exclusive.
 */
@Getter
public class TextChunk {

    private final int chunkIndex;
    private final String content;
    private final int startOffset;
    private final int endOffset;

    public TextChunk(int chunkIndex, String content, int startOffset, int endOffset) {
        this.chunkIndex = chunkIndex;
        this.content = content;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }
}
