package com.yizhaoqi.kb.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields left null fall back to the configured embedding defaults.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateKnowledgeBaseRequest {
    private String name;
    private String description;
    private String embeddingProvider;
    private String embeddingModel;
    private Integer embeddingDimensions;
    private Integer chunkSize;
    private Integer chunkOverlap;

    public CreateKnowledgeBaseRequest(String name, String description) {
        this.name = name;
        this.description = description;
    }
}
