package com.yizhaoqi.kb.service;

import com.yizhaoqi.kb.chunk.TextChunker;
import com.yizhaoqi.kb.client.EmbeddingProvider;
import com.yizhaoqi.kb.entity.ExtractedContent;
import com.yizhaoqi.kb.entity.ExtractionOutcome;
import com.yizhaoqi.kb.entity.ProcessingResult;
import com.yizhaoqi.kb.entity.TextChunk;
import com.yizhaoqi.kb.exception.ConflictException;
import com.yizhaoqi.kb.exception.NotFoundException;
import com.yizhaoqi.kb.extract.ContentExtractor;
import com.yizhaoqi.kb.model.DocumentProcessingTask;
import com.yizhaoqi.kb.model.EmbeddingConfig;
import com.yizhaoqi.kb.model.KnowledgeBase;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.repository.KnowledgeBaseRepository;
import com.yizhaoqi.kb.utils.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One processing run of one document: claim, extract, split, embed, store. Every failure ends as a
 * failed status with its message recorded on the document; nothing is thrown to the caller.
 */
@Service
@Slf4j
public class DocumentProcessingPipeline {

    static final String NO_CONTENT = "No content extracted from document";
    static final String NO_CHUNKS = "No chunks created from content";

    private final DocumentRegistry documentRegistry;
    private final KnowledgeBaseRepository knowledgeBaseRepository;
    private final ContentExtractor contentExtractor;
    private final TextChunker textChunker;
    private final EmbeddingProvider embeddingProvider;
    private final ChunkPersistenceService chunkPersistenceService;

    public DocumentProcessingPipeline(DocumentRegistry documentRegistry,
                                      KnowledgeBaseRepository knowledgeBaseRepository,
                                      ContentExtractor contentExtractor,
                                      TextChunker textChunker,
                                      EmbeddingProvider embeddingProvider,
                                      ChunkPersistenceService chunkPersistenceService) {
        this.documentRegistry = documentRegistry;
        this.knowledgeBaseRepository = knowledgeBaseRepository;
        this.contentExtractor = contentExtractor;
        this.textChunker = textChunker;
        this.embeddingProvider = embeddingProvider;
        this.chunkPersistenceService = chunkPersistenceService;
    }

    public ProcessingResult process(DocumentProcessingTask task) {
        Long documentId = task.getDocumentId();
        LogUtils.bindRun(documentId, task.getRunId());
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("PROCESS_DOCUMENT");
        try {
            if (!documentRegistry.claim(documentId)) {
                monitor.end("skipped");
                return ProcessingResult.skipped(documentId, "Document is not pending");
            }
            ProcessingResult result = run(documentId);
            monitor.end(result.outcome().name());
            return result;
        } finally {
            LogUtils.clearRun();
        }
    }

    private ProcessingResult run(Long documentId) {
        try {
            KnowledgeDocument document = documentRegistry.getDocument(documentId);
            KnowledgeBase knowledgeBase = knowledgeBaseRepository.findById(document.getKnowledgeBaseId())
                    .orElseThrow(() -> NotFoundException.knowledgeBase(document.getKnowledgeBaseId()));
            EmbeddingConfig config = knowledgeBase.getEmbeddingConfig();

            ExtractionOutcome outcome = contentExtractor.extract(document);
            if (!outcome.isSuccess()) {
                return fail(documentId, outcome.getError().message());
            }
            ExtractedContent extracted = outcome.getContent();
            log.info("Extracted {} characters from document {}", extracted.getContent().length(), documentId);
            documentRegistry.recordExtraction(documentId, extracted.getContent(), extracted.getMetadata());
            if (extracted.getContent().trim().isEmpty()) {
                return fail(documentId, NO_CONTENT);
            }

            List<TextChunk> chunks = textChunker.split(extracted.getContent(), config.getChunkSize(),
                    config.getChunkOverlap());
            if (chunks.isEmpty()) {
                return fail(documentId, NO_CHUNKS);
            }
            log.info("Split document {} into {} chunks (size={}, overlap={})",
                    documentId, chunks.size(), config.getChunkSize(), config.getChunkOverlap());

            List<float[]> vectors = embeddingProvider.embed(
                    chunks.stream().map(TextChunk::getContent).collect(Collectors.toList()), config);

            int stored = chunkPersistenceService.persistAndComplete(document, config, chunks, vectors);
            LogUtils.logDocumentOperation("pipeline", "PROCESS", documentId, document.getName(), "ready");
            return ProcessingResult.ready(documentId, stored);
        } catch (ConflictException | NotFoundException e) {
            // deleted, reprocessed or force-failed while this run was working on it
            log.warn("Abandoning run for document {}: {}", documentId, e.getMessage());
            return ProcessingResult.skipped(documentId, e.getMessage());
        } catch (RuntimeException e) {
            LogUtils.logBusinessError("PROCESS_DOCUMENT", "pipeline", "documentId=%d", e, documentId);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return fail(documentId, message);
        }
    }

    private ProcessingResult fail(Long documentId, String message) {
        documentRegistry.forceFail(documentId, message);
        return ProcessingResult.failed(documentId, message);
    }
}
