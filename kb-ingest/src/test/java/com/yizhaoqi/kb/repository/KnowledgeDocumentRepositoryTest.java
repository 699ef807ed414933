package com.yizhaoqi.kb.repository;

import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class KnowledgeDocumentRepositoryTest {

    @Autowired
    private KnowledgeDocumentRepository documentRepository;

    @Test
    void testClaimForProcessing_OnlyFromPending() {
        KnowledgeDocument document = documentRepository.save(document(1L, DocumentStatus.PENDING, 10L));

        assertEquals(1, documentRepository.claimForProcessing(document.getId(), LocalDateTime.now()));
        assertEquals(0, documentRepository.claimForProcessing(document.getId(), LocalDateTime.now()));

        KnowledgeDocument claimed = documentRepository.findById(document.getId()).orElseThrow();
        assertEquals(DocumentStatus.PROCESSING, claimed.getStatus());
        assertNotNull(claimed.getProcessingStartedAt());
        assertNull(claimed.getProcessingCompletedAt());
    }

    @Test
    void testCompleteProcessing_OnlyFromProcessing() {
        KnowledgeDocument pending = documentRepository.save(document(1L, DocumentStatus.PENDING, 10L));

        assertEquals(0, documentRepository.completeProcessing(pending.getId(), DocumentStatus.READY, null,
                LocalDateTime.now()));

        documentRepository.claimForProcessing(pending.getId(), LocalDateTime.now());
        assertEquals(1, documentRepository.completeProcessing(pending.getId(), DocumentStatus.FAILED,
                "No content extracted from document", LocalDateTime.now()));

        KnowledgeDocument failed = documentRepository.findById(pending.getId()).orElseThrow();
        assertEquals(DocumentStatus.FAILED, failed.getStatus());
        assertEquals("No content extracted from document", failed.getErrorMessage());
        assertNotNull(failed.getProcessingCompletedAt());
    }

    @Test
    void testResetToPending_ClearsRunState() {
        KnowledgeDocument document = document(1L, DocumentStatus.READY, 10L);
        document.setContent("old content");
        document.setProcessingStartedAt(LocalDateTime.now().minusMinutes(1));
        document.setProcessingCompletedAt(LocalDateTime.now());
        document = documentRepository.save(document);

        assertEquals(0, documentRepository.resetToPending(document.getId(),
                List.of(DocumentStatus.PROCESSING), LocalDateTime.now()));
        assertEquals(1, documentRepository.resetToPending(document.getId(),
                DocumentStatus.REPROCESSABLE, LocalDateTime.now()));

        KnowledgeDocument reset = documentRepository.findById(document.getId()).orElseThrow();
        assertEquals(DocumentStatus.PENDING, reset.getStatus());
        assertNull(reset.getContent());
        assertNull(reset.getProcessingStartedAt());
        assertNull(reset.getProcessingCompletedAt());
    }

    @Test
    void testAggregatesPerKnowledgeBase() {
        documentRepository.save(document(1L, DocumentStatus.READY, 100L));
        documentRepository.save(document(1L, DocumentStatus.FAILED, null));
        documentRepository.save(document(1L, DocumentStatus.READY, 23L));
        documentRepository.save(document(2L, DocumentStatus.READY, 5000L));

        assertEquals(123L, documentRepository.sumFileSizeByKnowledgeBaseId(1L));
        assertEquals(0L, documentRepository.sumFileSizeByKnowledgeBaseId(3L));
        assertEquals(3L, documentRepository.countByKnowledgeBaseId(1L));
        assertEquals(2L, documentRepository.countByKnowledgeBaseIdAndStatus(1L, DocumentStatus.READY));
    }

    private KnowledgeDocument document(Long kbId, DocumentStatus status, Long fileSize) {
        KnowledgeDocument document = new KnowledgeDocument();
        document.setKnowledgeBaseId(kbId);
        document.setName("report.txt");
        document.setSourceType(DocumentSourceType.FILE);
        document.setFilePath("kb/" + kbId + "/report.txt");
        document.setFileType(DocumentFileType.TXT);
        document.setFileSize(fileSize);
        document.setStatus(status);
        return document;
    }
}
