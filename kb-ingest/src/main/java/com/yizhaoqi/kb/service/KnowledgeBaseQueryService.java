package com.yizhaoqi.kb.service;

import com.yizhaoqi.kb.client.EmbeddingProvider;
import com.yizhaoqi.kb.entity.SearchRequest;
import com.yizhaoqi.kb.entity.SearchResponse;
import com.yizhaoqi.kb.entity.SearchResult;
import com.yizhaoqi.kb.exception.ValidationException;
import com.yizhaoqi.kb.model.KnowledgeBase;
import com.yizhaoqi.kb.utils.LogUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Answers user queries: embeds the query text with the knowledge base's own embedding settings and
 * runs a similarity search.
 */
@Service
public class KnowledgeBaseQueryService {

    @Autowired
    private KnowledgeBaseService knowledgeBaseService;

    @Autowired
    private EmbeddingProvider embeddingProvider;

    @Autowired
    private SimilaritySearchService similaritySearchService;

    public SearchResponse query(String userId, Long knowledgeBaseId, String query, Integer topK,
                                Double similarityThreshold) {
        if (query == null || query.trim().isEmpty()) {
            throw new ValidationException("Query text is required");
        }
        KnowledgeBase knowledgeBase = knowledgeBaseService.getOwned(knowledgeBaseId, userId);
        LogUtils.PerformanceMonitor monitor = LogUtils.startPerformanceMonitor("QUERY_KNOWLEDGE_BASE");

        float[] embedding = embeddingProvider.embed(List.of(query), knowledgeBase.getEmbeddingConfig()).get(0);
        List<SearchResult> results = similaritySearchService.search(
                new SearchRequest(knowledgeBaseId, embedding, topK, similarityThreshold));

        LogUtils.logBusiness("QUERY_KNOWLEDGE_BASE", userId, "kb=%d, results=%d", knowledgeBaseId, results.size());
        monitor.end("results=" + results.size());
        return SearchResponse.of(query, results);
    }

    public SearchResponse queryByEmbedding(String userId, Long knowledgeBaseId, float[] queryEmbedding, Integer topK,
                                           Double similarityThreshold) {
        knowledgeBaseService.getOwned(knowledgeBaseId, userId);
        List<SearchResult> results = similaritySearchService.search(
                new SearchRequest(knowledgeBaseId, queryEmbedding, topK, similarityThreshold));
        return SearchResponse.of(null, results);
    }
}
