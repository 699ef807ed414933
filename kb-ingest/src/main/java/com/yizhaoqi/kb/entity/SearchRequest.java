package com.yizhaoqi.kb.entity;

/**
 * Nearest-neighbour query against one knowledge base. {@code topK} and {@code similarityThreshold}
 * may be null, in which case the configured defaults (5 and 0.7) apply.
 */
public record SearchRequest(Long knowledgeBaseId, float[] queryEmbedding, Integer topK, Double similarityThreshold) {
}
