package com.yizhaoqi.kb.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;


@Data
@Entity
@Table(name = "knowledge_documents", indexes = {
        @Index(name = "idx_knowledge_documents_kb_id", columnList = "knowledge_base_id"),
        @Index(name = "idx_knowledge_documents_status", columnList = "status")
})
public class KnowledgeDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "knowledge_base_id", nullable = false)
    private Long knowledgeBaseId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", length = 16, nullable = false)
    private DocumentSourceType sourceType;

    @Column(name = "source_url", length = 2048)
    private String sourceUrl;

    @Column(name = "file_path", length = 1024)
    private String filePath;

    @Enumerated(EnumType.STRING)
    @Column(name = "file_type", length = 16, nullable = false)
    private DocumentFileType fileType;

    @Column(name = "file_size")
    private Long fileSize;

    @Lob
    private String content;

    @Lob
    @Convert(converter = JsonMapConverter.class)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private DocumentStatus status = DocumentStatus.PENDING;

    @Lob
    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "processing_started_at")
    private LocalDateTime processingStartedAt;

    @Column(name = "processing_completed_at")
    private LocalDateTime processingCompletedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    /**
     * The storage locator matching {@link #sourceType}: the URL for url documents, the blob path for files.
     */
    public String getSourceLocator() {
        return sourceType == DocumentSourceType.URL ? sourceUrl : filePath;
    }
}
