package com.yizhaoqi.kb.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;


@Data
@Entity
@Table(name = "knowledge_chunks", indexes = {
        @Index(name = "idx_knowledge_chunks_document_id", columnList = "document_id"),
        @Index(name = "idx_knowledge_chunks_kb_id", columnList = "knowledge_base_id"),
        @Index(name = "idx_knowledge_chunks_chunk_index", columnList = "document_id, chunk_index")
})
public class KnowledgeChunk {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_id", nullable = false)
    private Long documentId;

    @Column(name = "knowledge_base_id", nullable = false)
    private Long knowledgeBaseId;

    @Column(name = "chunk_index", nullable = false)
    private Integer chunkIndex;

    @Lob
    @Column(nullable = false)
    private String content;

    @Lob
    @Convert(converter = FloatArrayConverter.class)
    @Column(nullable = false)
    private float[] embedding;

    @Column(name = "embedding_model", length = 128, nullable = false)
    private String embeddingModel;

    @Column(name = "embedding_dimensions", nullable = false)
    private Integer embeddingDimensions;

    @Column(name = "token_count")
    private Integer tokenCount;

    @Lob
    @Convert(converter = JsonMapConverter.class)
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @CreationTimestamp
    private LocalDateTime createdAt;
}
