package com.yizhaoqi.kb.entity;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire form of a document. {@code file_size} is a plain JSON integer (or null); sizes above
 * 2^53-1 are rejected when the document is created so JSON clients never lose precision.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DocumentResponse {
    private Long id;
    private Long knowledgeBaseId;
    private String name;
    private DocumentSourceType sourceType;
    private String sourceUrl;
    private String filePath;
    private DocumentFileType fileType;
    private Long fileSize;
    private String content;
    private Map<String, Object> metadata;
    private DocumentStatus status;
    private String errorMessage;
    private LocalDateTime processingStartedAt;
    private LocalDateTime processingCompletedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static DocumentResponse from(KnowledgeDocument document) {
        DocumentResponse response = new DocumentResponse();
        response.setId(document.getId());
        response.setKnowledgeBaseId(document.getKnowledgeBaseId());
        response.setName(document.getName());
        response.setSourceType(document.getSourceType());
        response.setSourceUrl(document.getSourceUrl());
        response.setFilePath(document.getFilePath());
        response.setFileType(document.getFileType());
        response.setFileSize(document.getFileSize());
        response.setContent(document.getContent());
        response.setMetadata(document.getMetadata() == null
                ? new LinkedHashMap<>() : new LinkedHashMap<>(document.getMetadata()));
        response.setStatus(document.getStatus());
        response.setErrorMessage(document.getErrorMessage());
        response.setProcessingStartedAt(document.getProcessingStartedAt());
        response.setProcessingCompletedAt(document.getProcessingCompletedAt());
        response.setCreatedAt(document.getCreatedAt());
        response.setUpdatedAt(document.getUpdatedAt());
        return response;
    }
}
