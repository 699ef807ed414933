package com.yizhaoqi.kb.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields left null keep their current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateKnowledgeBaseRequest {
    private String name;
    private String description;
    private String embeddingProvider;
    private String embeddingModel;
    private Integer embeddingDimensions;
    private Integer chunkSize;
    private Integer chunkOverlap;
}
