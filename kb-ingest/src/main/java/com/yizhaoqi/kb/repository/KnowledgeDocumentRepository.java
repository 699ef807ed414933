package com.yizhaoqi.kb.repository;

import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface KnowledgeDocumentRepository extends JpaRepository<KnowledgeDocument, Long> {

    Page<KnowledgeDocument> findByKnowledgeBaseIdOrderByCreatedAtDesc(Long knowledgeBaseId, Pageable pageable);

    Page<KnowledgeDocument> findByKnowledgeBaseIdAndStatusOrderByCreatedAtDesc(Long knowledgeBaseId,
                                                                               DocumentStatus status,
                                                                               Pageable pageable);

    List<KnowledgeDocument> findByKnowledgeBaseId(Long knowledgeBaseId);

    List<KnowledgeDocument> findByKnowledgeBaseIdAndStatus(Long knowledgeBaseId, DocumentStatus status);

    long countByKnowledgeBaseId(Long knowledgeBaseId);

    long countByKnowledgeBaseIdAndStatus(Long knowledgeBaseId, DocumentStatus status);

    @Query("SELECT COALESCE(SUM(d.fileSize), 0) FROM KnowledgeDocument d WHERE d.knowledgeBaseId = :kbId")
    long sumFileSizeByKnowledgeBaseId(@Param("kbId") Long knowledgeBaseId);


    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE KnowledgeDocument d SET d.status = com.yizhaoqi.kb.model.DocumentStatus.PROCESSING, " +
            "d.processingStartedAt = :now, d.processingCompletedAt = null, d.errorMessage = null, " +
            "d.updatedAt = :now, d.version = d.version + 1 " +
            "WHERE d.id = :id AND d.status = com.yizhaoqi.kb.model.DocumentStatus.PENDING")
    int claimForProcessing(@Param("id") Long id, @Param("now") LocalDateTime now);


    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE KnowledgeDocument d SET d.status = :target, d.errorMessage = :errorMessage, " +
            "d.processingCompletedAt = :now, d.updatedAt = :now, d.version = d.version + 1 " +
            "WHERE d.id = :id AND d.status = com.yizhaoqi.kb.model.DocumentStatus.PROCESSING")
    int completeProcessing(@Param("id") Long id,
                           @Param("target") DocumentStatus target,
                           @Param("errorMessage") String errorMessage,
                           @Param("now") LocalDateTime now);


    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE KnowledgeDocument d SET d.status = com.yizhaoqi.kb.model.DocumentStatus.PENDING, " +
            "d.content = null, d.errorMessage = null, d.processingStartedAt = null, d.processingCompletedAt = null, " +
            "d.updatedAt = :now, d.version = d.version + 1 " +
            "WHERE d.id = :id AND d.status IN :expected")
    int resetToPending(@Param("id") Long id,
                       @Param("expected") Collection<DocumentStatus> expected,
                       @Param("now") LocalDateTime now);


    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM KnowledgeDocument d WHERE d.knowledgeBaseId = :kbId")
    int deleteByKnowledgeBaseId(@Param("kbId") Long knowledgeBaseId);
}
