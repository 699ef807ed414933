package com.yizhaoqi.kb.repository;

import com.yizhaoqi.kb.model.KnowledgeChunk;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface KnowledgeChunkRepository extends JpaRepository<KnowledgeChunk, Long> {

    /**
     * Candidate rows for a similarity query, in insertion order.
     */
    List<KnowledgeChunk> findByKnowledgeBaseIdAndDocumentIdInOrderByIdAsc(Long knowledgeBaseId,
                                                                          Collection<Long> documentIds);

    long countByKnowledgeBaseId(Long knowledgeBaseId);


    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM KnowledgeChunk c WHERE c.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") Long documentId);


    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM KnowledgeChunk c WHERE c.knowledgeBaseId = :kbId")
    int deleteByKnowledgeBaseId(@Param("kbId") Long knowledgeBaseId);
}
