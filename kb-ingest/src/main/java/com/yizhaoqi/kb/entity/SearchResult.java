package com.yizhaoqi.kb.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SearchResult {
    private Long id;
    private Long documentId;
    private String documentName;
    private Integer chunkIndex;
    private String content;
    private Map<String, Object> metadata;
    private double similarity;

    public SearchResult(Long id, Long documentId, String documentName, Integer chunkIndex,
                        String content, Map<String, Object> metadata, double similarity) {
        this.id = id;
        this.documentId = documentId;
        this.documentName = documentName;
        this.chunkIndex = chunkIndex;
        this.content = content;
        this.metadata = metadata;
        this.similarity = similarity;
    }
}
