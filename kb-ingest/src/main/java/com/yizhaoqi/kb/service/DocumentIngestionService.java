package com.yizhaoqi.kb.service;

import com.yizhaoqi.kb.entity.DocumentResponse;
import com.yizhaoqi.kb.entity.FileIngestionRequest;
import com.yizhaoqi.kb.entity.IngestionHandle;
import com.yizhaoqi.kb.entity.IngestionRequest;
import com.yizhaoqi.kb.entity.UrlIngestionRequest;
import com.yizhaoqi.kb.exception.NotFoundException;
import com.yizhaoqi.kb.model.DocumentProcessingTask;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.producer.DocumentProcessingProducer;
import com.yizhaoqi.kb.utils.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;

/**
 * Entry point for adding, reprocessing, listing and removing documents on behalf of a user.
 * Processing itself runs asynchronously; callers get an {@link IngestionHandle} right away.
 */
@Service
@Slf4j
public class DocumentIngestionService {

    @Autowired
    private KnowledgeBaseService knowledgeBaseService;

    @Autowired
    private DocumentRegistry documentRegistry;

    @Autowired
    private DocumentProcessingProducer processingProducer;

    public IngestionHandle ingestFile(String userId, Long knowledgeBaseId, FileIngestionRequest request) {
        return ingest(userId, knowledgeBaseId, request);
    }

    public IngestionHandle ingestUrl(String userId, Long knowledgeBaseId, UrlIngestionRequest request) {
        return ingest(userId, knowledgeBaseId, request);
    }

    public IngestionHandle ingest(String userId, Long knowledgeBaseId, IngestionRequest request) {
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("INGEST_DOCUMENT");
        try {
            knowledgeBaseService.getOwned(knowledgeBaseId, userId);
            KnowledgeDocument document = documentRegistry.create(knowledgeBaseId, request);
            DocumentProcessingTask task = processingProducer.submit(document, userId);
            LogUtils.logDocumentOperation(userId, "INGEST", document.getId(), document.getName(),
                    document.getStatus().wireValue());
            monitor.end("queued");
            return new IngestionHandle(document.getId(), task.getRunId(), DocumentResponse.from(document));
        } catch (RuntimeException e) {
            LogUtils.logBusinessError("INGEST_DOCUMENT", userId, "kb=%d", e, knowledgeBaseId);
            monitor.end("failed: " + e.getMessage());
            throw e;
        }
    }

    public IngestionHandle reprocess(String userId, Long knowledgeBaseId, Long documentId) {
        requireDocumentInKnowledgeBase(userId, knowledgeBaseId, documentId);
        KnowledgeDocument document = documentRegistry.reprocess(documentId);
        DocumentProcessingTask task = processingProducer.submit(document, userId);
        LogUtils.logDocumentOperation(userId, "REPROCESS", documentId, document.getName(),
                document.getStatus().wireValue());
        return new IngestionHandle(documentId, task.getRunId(), DocumentResponse.from(document));
    }

    public DocumentResponse getDocument(String userId, Long knowledgeBaseId, Long documentId) {
        return DocumentResponse.from(requireDocumentInKnowledgeBase(userId, knowledgeBaseId, documentId));
    }

    public Page<DocumentResponse> listDocuments(String userId, Long knowledgeBaseId, DocumentStatus status,
                                                int page, int size) {
        knowledgeBaseService.getOwned(knowledgeBaseId, userId);
        return documentRegistry.listDocuments(knowledgeBaseId, status, page, size).map(DocumentResponse::from);
    }

    public void deleteDocument(String userId, Long knowledgeBaseId, Long documentId) {
        KnowledgeDocument document = requireDocumentInKnowledgeBase(userId, knowledgeBaseId, documentId);
        documentRegistry.delete(documentId);
        LogUtils.logDocumentOperation(userId, "DELETE", documentId, document.getName(), "deleted");
    }

    private KnowledgeDocument requireDocumentInKnowledgeBase(String userId, Long knowledgeBaseId, Long documentId) {
        knowledgeBaseService.getOwned(knowledgeBaseId, userId);
        KnowledgeDocument document = documentRegistry.getDocument(documentId);
        if (!knowledgeBaseId.equals(document.getKnowledgeBaseId())) {
            log.warn("Document {} requested through knowledge base {} but belongs to {}",
                    documentId, knowledgeBaseId, document.getKnowledgeBaseId());
            throw NotFoundException.document(documentId);
        }
        return document;
    }
}
