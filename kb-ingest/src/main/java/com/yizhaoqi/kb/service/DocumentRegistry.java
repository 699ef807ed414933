package com.yizhaoqi.kb.service;

import com.yizhaoqi.kb.entity.IngestionRequest;
import com.yizhaoqi.kb.exception.ConflictException;
import com.yizhaoqi.kb.exception.NotFoundException;
import com.yizhaoqi.kb.model.DocumentSourceType;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.repository.KnowledgeChunkRepository;
import com.yizhaoqi.kb.repository.KnowledgeDocumentRepository;
import com.yizhaoqi.kb.storage.BlobStorage;
import com.yizhaoqi.kb.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the document rows and their status lifecycle. Every status change is a compare-and-set
 * update on the current status, so concurrent callers cannot both win the same transition.
 */
@Service
public class DocumentRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DocumentRegistry.class);

    public static final int DEFAULT_PAGE_SIZE = 50;

    @Autowired
    private KnowledgeDocumentRepository documentRepository;

    @Autowired
    private KnowledgeChunkRepository chunkRepository;

    @Autowired
    private BlobStorage blobStorage;

    @Transactional
    public KnowledgeDocument create(Long knowledgeBaseId, IngestionRequest request) {
        request.validate();

        KnowledgeDocument document = new KnowledgeDocument();
        document.setKnowledgeBaseId(knowledgeBaseId);
        String name = request.getName();
        document.setName(name == null || name.trim().isEmpty() ? request.defaultName() : name.trim());
        document.setSourceType(request.getSourceType());
        if (request.getSourceType() == DocumentSourceType.URL) {
            document.setSourceUrl(request.getLocator().trim());
        } else {
            document.setFilePath(request.getLocator().trim());
        }
        document.setFileType(request.getFileType());
        document.setFileSize(request.getFileSize());
        document.setStatus(DocumentStatus.PENDING);

        KnowledgeDocument saved = documentRepository.save(document);
        logger.info("Document registered: id={}, kb={}, name={}, sourceType={}, fileType={}",
                saved.getId(), knowledgeBaseId, saved.getName(), saved.getSourceType(), saved.getFileType());
        return saved;
    }

    public KnowledgeDocument getDocument(Long documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> NotFoundException.document(documentId));
    }

    public Page<KnowledgeDocument> listDocuments(Long knowledgeBaseId, DocumentStatus status, int page, int size) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), size > 0 ? size : DEFAULT_PAGE_SIZE);
        if (status == null) {
            return documentRepository.findByKnowledgeBaseIdOrderByCreatedAtDesc(knowledgeBaseId, pageable);
        }
        return documentRepository.findByKnowledgeBaseIdAndStatusOrderByCreatedAtDesc(knowledgeBaseId, status, pageable);
    }

    /**
     * Applies one edge of the status state machine.
     *
     * @throws NotFoundException for an unknown document
     * @throws ConflictException when the edge is not legal from the current status, or another caller
     *         changed the status first
     */
    @Transactional
    public KnowledgeDocument transition(Long documentId, DocumentStatus target, String errorMessage) {
        KnowledgeDocument document = getDocument(documentId);
        DocumentStatus current = document.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new ConflictException(String.format("Illegal status transition for document %d: %s -> %s",
                    documentId, current.wireValue(), target == null ? "null" : target.wireValue()));
        }

        LocalDateTime now = LocalDateTime.now();
        int updated;
        switch (target) {
            case PROCESSING:
                updated = documentRepository.claimForProcessing(documentId, now);
                break;
            case READY:
                updated = documentRepository.completeProcessing(documentId, DocumentStatus.READY, null, now);
                break;
            case FAILED:
                updated = documentRepository.completeProcessing(documentId, DocumentStatus.FAILED, errorMessage, now);
                break;
            default:
                updated = documentRepository.resetToPending(documentId, List.of(current), now);
                if (updated == 1) {
                    chunkRepository.deleteByDocumentId(documentId);
                }
                break;
        }
        if (updated == 0) {
            throw new ConflictException(String.format(
                    "Document %d changed status concurrently; %s -> %s not applied",
                    documentId, current.wireValue(), target.wireValue()));
        }
        LogUtils.logDocumentOperation("registry", "TRANSITION", documentId, document.getName(),
                current.wireValue() + "->" + target.wireValue());
        return getDocument(documentId);
    }

    /**
     * Moves a pending document to processing. Returns false when it is not pending any more,
     * typically because another run claimed it first.
     */
    @Transactional
    public boolean claim(Long documentId) {
        boolean claimed = documentRepository.claimForProcessing(documentId, LocalDateTime.now()) == 1;
        if (!claimed) {
            logger.info("Document {} was not claimed: not pending or already taken", documentId);
        }
        return claimed;
    }

    @Transactional
    public void recordExtraction(Long documentId, String content, Map<String, Object> metadata) {
        KnowledgeDocument document = getDocument(documentId);
        if (document.getStatus() != DocumentStatus.PROCESSING) {
            throw new ConflictException(String.format("Document %d is %s, not processing",
                    documentId, document.getStatus().wireValue()));
        }
        document.setContent(content);
        document.setMetadata(new LinkedHashMap<>(metadata));
        try {
            documentRepository.saveAndFlush(document);
        } catch (ObjectOptimisticLockingFailureException e) {
            throw new ConflictException("Document " + documentId + " changed while recording extracted content");
        }
    }

    /**
     * Marks a processing document as failed. Does nothing for documents in any other state, so a
     * late failure report can never overwrite a newer outcome.
     *
     * @return whether the document was moved to failed
     */
    @Transactional
    public boolean forceFail(Long documentId, String reason) {
        int updated = documentRepository.completeProcessing(documentId, DocumentStatus.FAILED, reason,
                LocalDateTime.now());
        if (updated == 1) {
            logger.warn("Document {} marked failed: {}", documentId, reason);
        } else {
            logger.info("Document {} not force-failed: it is no longer processing", documentId);
        }
        return updated == 1;
    }

    /**
     * Resets a document to pending and drops its chunks in one transaction. A document that is
     * already pending is reset as well, so a run whose message was lost can be queued again; the
     * consumer's claim lets only one of the queued runs do the work.
     *
     * @throws ConflictException when the document is processing
     */
    @Transactional
    public KnowledgeDocument reprocess(Long documentId) {
        KnowledgeDocument document = getDocument(documentId);
        if (document.getStatus() == DocumentStatus.PROCESSING) {
            throw new ConflictException("Document " + documentId + " is currently processing");
        }
        int updated = documentRepository.resetToPending(documentId, DocumentStatus.REPROCESSABLE, LocalDateTime.now());
        if (updated == 0) {
            throw new ConflictException("Document " + documentId + " started processing; try again once it finishes");
        }
        int removed = chunkRepository.deleteByDocumentId(documentId);
        logger.info("Document {} reset to pending for reprocessing (was {}), {} chunks removed",
                documentId, document.getStatus().wireValue(), removed);
        return getDocument(documentId);
    }

    @Transactional
    public void delete(Long documentId) {
        KnowledgeDocument document = getDocument(documentId);
        int removed = chunkRepository.deleteByDocumentId(documentId);
        documentRepository.deleteById(documentId);
        logger.info("Document {} deleted with {} chunks", documentId, removed);

        if (document.getSourceType() == DocumentSourceType.FILE && document.getFilePath() != null) {
            blobStorage.deleteBlob(document.getFilePath());
        }
    }

    /**
     * Removes every document and chunk of a knowledge base, then requests deletion of their blobs.
     */
    @Transactional
    public int deleteAllForKnowledgeBase(Long knowledgeBaseId) {
        List<KnowledgeDocument> documents = documentRepository.findByKnowledgeBaseId(knowledgeBaseId);
        chunkRepository.deleteByKnowledgeBaseId(knowledgeBaseId);
        int removed = documentRepository.deleteByKnowledgeBaseId(knowledgeBaseId);
        for (KnowledgeDocument document : documents) {
            if (document.getSourceType() == DocumentSourceType.FILE && document.getFilePath() != null) {
                blobStorage.deleteBlob(document.getFilePath());
            }
        }
        return removed;
    }
}
