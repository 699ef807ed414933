package com.yizhaoqi.kb.service;

import com.yizhaoqi.kb.config.KnowledgeBaseProperties;
import com.yizhaoqi.kb.entity.SearchRequest;
import com.yizhaoqi.kb.entity.SearchResult;
import com.yizhaoqi.kb.exception.ConflictException;
import com.yizhaoqi.kb.exception.NotFoundException;
import com.yizhaoqi.kb.exception.ValidationException;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.EmbeddingConfig;
import com.yizhaoqi.kb.model.KnowledgeBase;
import com.yizhaoqi.kb.model.KnowledgeChunk;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.repository.KnowledgeBaseRepository;
import com.yizhaoqi.kb.repository.KnowledgeChunkRepository;
import com.yizhaoqi.kb.repository.KnowledgeDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cosine-similarity search over the chunks of a knowledge base's ready documents.
 */
@Service
public class SimilaritySearchService {

    private static final Logger logger = LoggerFactory.getLogger(SimilaritySearchService.class);

    @Autowired
    private KnowledgeBaseRepository knowledgeBaseRepository;

    @Autowired
    private KnowledgeDocumentRepository documentRepository;

    @Autowired
    private KnowledgeChunkRepository chunkRepository;

    @Autowired
    private KnowledgeBaseProperties properties;

    @Transactional(readOnly = true)
    public List<SearchResult> search(SearchRequest request) {
        KnowledgeBase knowledgeBase = knowledgeBaseRepository.findById(request.knowledgeBaseId())
                .orElseThrow(() -> NotFoundException.knowledgeBase(request.knowledgeBaseId()));
        EmbeddingConfig config = knowledgeBase.getEmbeddingConfig();

        int topK = request.topK() != null ? request.topK() : properties.getSearch().getDefaultTopK();
        double threshold = request.similarityThreshold() != null
                ? request.similarityThreshold() : properties.getSearch().getDefaultSimilarityThreshold();
        validate(request.queryEmbedding(), config.getDimensions(), topK, threshold);

        Long kbId = knowledgeBase.getId();
        Map<Long, KnowledgeDocument> readyDocuments = documentRepository
                .findByKnowledgeBaseIdAndStatus(kbId, DocumentStatus.READY).stream()
                .filter(document -> kbId.equals(document.getKnowledgeBaseId()))
                .collect(Collectors.toMap(KnowledgeDocument::getId, Function.identity(),
                        (a, b) -> a, LinkedHashMap::new));
        if (readyDocuments.isEmpty()) {
            logger.debug("Knowledge base {} has no ready documents", kbId);
            return new ArrayList<>();
        }

        List<KnowledgeChunk> candidates = chunkRepository
                .findByKnowledgeBaseIdAndDocumentIdInOrderByIdAsc(kbId, readyDocuments.keySet());

        List<ScoredChunk> scored = new ArrayList<>();
        for (KnowledgeChunk chunk : candidates) {
            if (!kbId.equals(chunk.getKnowledgeBaseId()) || !readyDocuments.containsKey(chunk.getDocumentId())) {
                continue;
            }
            if (!config.sameVectorSpace(chunk.getEmbeddingModel(), chunk.getEmbeddingDimensions())
                    || chunk.getEmbedding() == null || chunk.getEmbedding().length != config.getDimensions()) {
                throw new ConflictException(String.format(
                        "Document %d was embedded with %s/%s but knowledge base %d now uses %s/%d; reprocess its documents",
                        chunk.getDocumentId(), chunk.getEmbeddingModel(), chunk.getEmbeddingDimensions(),
                        kbId, config.getModel(), config.getDimensions()));
            }
            double similarity = cosineSimilarity(request.queryEmbedding(), chunk.getEmbedding());
            if (similarity >= threshold) {
                scored.add(new ScoredChunk(chunk, similarity));
            }
        }

        List<SearchResult> results = scored.stream()
                .sorted(Comparator.comparingDouble(ScoredChunk::similarity).reversed()
                        .thenComparing(s -> s.chunk().getId()))
                .limit(topK)
                .map(s -> toResult(s, readyDocuments.get(s.chunk().getDocumentId())))
                .collect(Collectors.toList());
        logger.info("Search in knowledge base {}: {} candidates, {} above {}, returning {}",
                kbId, candidates.size(), scored.size(), threshold, results.size());
        return results;
    }

    private void validate(float[] query, int dimensions, int topK, double threshold) {
        if (query == null || query.length == 0) {
            throw new ValidationException("Query embedding is required");
        }
        if (query.length != dimensions) {
            throw new ValidationException(String.format(
                    "Query embedding has %d dimensions, knowledge base expects %d", query.length, dimensions));
        }
        for (float value : query) {
            if (!Float.isFinite(value)) {
                throw new ValidationException("Query embedding contains a non-finite value");
            }
        }
        int maxTopK = properties.getSearch().getMaxTopK();
        if (topK < 1 || topK > maxTopK) {
            throw new ValidationException("topK must be between 1 and " + maxTopK);
        }
        if (Double.isNaN(threshold) || threshold < 0 || threshold > 1) {
            throw new ValidationException("similarityThreshold must be between 0 and 1");
        }
    }

    /**
     * Cosine of the angle between two equally sized vectors; 0 when either has zero length.
     */
    static double cosineSimilarity(float[] a, float[] b) {
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private SearchResult toResult(ScoredChunk scored, KnowledgeDocument document) {
        KnowledgeChunk chunk = scored.chunk();
        return new SearchResult(chunk.getId(), chunk.getDocumentId(), document.getName(), chunk.getChunkIndex(),
                chunk.getContent(), chunk.getMetadata(), scored.similarity());
    }

    private record ScoredChunk(KnowledgeChunk chunk, double similarity) {
    }
}
