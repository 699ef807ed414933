package com.yizhaoqi.kb.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message published for every processing run of a document.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class DocumentProcessingTask {
    private String runId;
    private Long documentId;
    private Long knowledgeBaseId;
    private DocumentSourceType sourceType;
    private String sourceLocator;
    private DocumentFileType fileType;
    private String userId;
}
