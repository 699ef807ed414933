package com.yizhaoqi.kb.service;

import com.yizhaoqi.kb.entity.TextChunk;
import com.yizhaoqi.kb.exception.ConflictException;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.EmbeddingConfig;
import com.yizhaoqi.kb.model.KnowledgeChunk;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.repository.KnowledgeChunkRepository;
import com.yizhaoqi.kb.repository.KnowledgeDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a document's chunks and marks it ready in the same transaction.
 */
@Service
public class ChunkPersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(ChunkPersistenceService.class);

    @Autowired
    private KnowledgeDocumentRepository documentRepository;

    @Autowired
    private KnowledgeChunkRepository chunkRepository;

    /**
     * Flips the document from processing to ready, then inserts its chunks. If the document is no
     * longer processing nothing is written.
     *
     * @return number of chunks stored
     * @throws ConflictException when the document left the processing state (cancelled, force-failed or deleted)
     */
    @Transactional
    public int persistAndComplete(KnowledgeDocument document, EmbeddingConfig config,
                                  List<TextChunk> chunks, List<float[]> vectors) {
        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException(String.format("Got %d vectors for %d chunks",
                    vectors.size(), chunks.size()));
        }
        Long documentId = document.getId();
        int updated = documentRepository.completeProcessing(documentId, DocumentStatus.READY, null,
                LocalDateTime.now());
        if (updated == 0) {
            throw new ConflictException("Document " + documentId + " is no longer processing; chunks discarded");
        }

        // leftovers of an interrupted earlier run
        chunkRepository.deleteByDocumentId(documentId);

        List<KnowledgeChunk> rows = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            TextChunk chunk = chunks.get(i);
            float[] vector = vectors.get(i);
            if (vector.length != config.getDimensions()) {
                throw new IllegalArgumentException(String.format(
                        "Chunk %d has a %d-dimensional vector, expected %d",
                        chunk.getChunkIndex(), vector.length, config.getDimensions()));
            }
            rows.add(toRow(document, config, chunk, vector));
        }
        chunkRepository.saveAll(rows);
        logger.info("Stored {} chunks for document {} and marked it ready", rows.size(), documentId);
        return rows.size();
    }

    private KnowledgeChunk toRow(KnowledgeDocument document, EmbeddingConfig config, TextChunk chunk, float[] vector) {
        KnowledgeChunk row = new KnowledgeChunk();
        row.setDocumentId(document.getId());
        row.setKnowledgeBaseId(document.getKnowledgeBaseId());
        row.setChunkIndex(chunk.getChunkIndex());
        row.setContent(chunk.getContent());
        row.setEmbedding(vector);
        row.setEmbeddingModel(config.getModel());
        row.setEmbeddingDimensions(config.getDimensions());
        row.setTokenCount(estimateTokens(chunk.getContent()));

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("documentName", document.getName());
        metadata.put("fileType", document.getFileType().getExtension());
        metadata.put("startOffset", chunk.getStartOffset());
        metadata.put("endOffset", chunk.getEndOffset());
        row.setMetadata(metadata);
        return row;
    }

    /**
     * Rough token estimate: one token per four characters, rounded up.
     */
    static int estimateTokens(String text) {
        return (text.length() + 3) / 4;
    }
}
