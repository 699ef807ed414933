package com.yizhaoqi.kb.entity;

public record KnowledgeBaseStats(Long id, String name, long documentCount, long readyDocumentCount,
                                 long chunkCount, long totalSizeBytes) {
}
