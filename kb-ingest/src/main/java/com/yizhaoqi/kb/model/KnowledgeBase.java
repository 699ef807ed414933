package com.yizhaoqi.kb.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;


@Data
@Entity
@Table(name = "knowledge_bases", indexes = {
        @Index(name = "idx_knowledge_bases_user_id", columnList = "user_id")
})
public class KnowledgeBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", length = 64, nullable = false)
    private String userId;

    @Column(nullable = false)
    private String name;

    @Column(length = 2000)
    private String description;

    @Embedded
    private EmbeddingConfig embeddingConfig = new EmbeddingConfig();

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
