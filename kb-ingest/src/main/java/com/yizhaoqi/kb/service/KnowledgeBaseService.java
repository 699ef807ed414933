package com.yizhaoqi.kb.service;

import com.yizhaoqi.kb.config.KnowledgeBaseProperties;
import com.yizhaoqi.kb.entity.CreateKnowledgeBaseRequest;
import com.yizhaoqi.kb.entity.KnowledgeBaseStats;
import com.yizhaoqi.kb.entity.UpdateKnowledgeBaseRequest;
import com.yizhaoqi.kb.exception.AccessDeniedException;
import com.yizhaoqi.kb.exception.NotFoundException;
import com.yizhaoqi.kb.exception.ValidationException;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.EmbeddingConfig;
import com.yizhaoqi.kb.model.KnowledgeBase;
import com.yizhaoqi.kb.repository.KnowledgeBaseRepository;
import com.yizhaoqi.kb.repository.KnowledgeChunkRepository;
import com.yizhaoqi.kb.repository.KnowledgeDocumentRepository;
import com.yizhaoqi.kb.utils.LogUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class KnowledgeBaseService {

    @Autowired
    private KnowledgeBaseRepository knowledgeBaseRepository;

    @Autowired
    private KnowledgeDocumentRepository documentRepository;

    @Autowired
    private KnowledgeChunkRepository chunkRepository;

    @Autowired
    private DocumentRegistry documentRegistry;

    @Autowired
    private KnowledgeBaseProperties properties;

    @Transactional
    public KnowledgeBase create(String userId, CreateKnowledgeBaseRequest request) {
        if (request.getName() == null || request.getName().trim().isEmpty()) {
            throw new ValidationException("Knowledge base name is required");
        }
        KnowledgeBaseProperties.Defaults defaults = properties.getDefaults();
        EmbeddingConfig config = new EmbeddingConfig(
                valueOr(request.getEmbeddingProvider(), defaults.getEmbeddingProvider()),
                valueOr(request.getEmbeddingModel(), defaults.getEmbeddingModel()),
                valueOr(request.getEmbeddingDimensions(), defaults.getEmbeddingDimensions()),
                valueOr(request.getChunkSize(), defaults.getChunkSize()),
                valueOr(request.getChunkOverlap(), defaults.getChunkOverlap()));
        validate(config);

        KnowledgeBase knowledgeBase = new KnowledgeBase();
        knowledgeBase.setUserId(userId);
        knowledgeBase.setName(request.getName().trim());
        knowledgeBase.setDescription(request.getDescription());
        knowledgeBase.setEmbeddingConfig(config);
        KnowledgeBase saved = knowledgeBaseRepository.save(knowledgeBase);
        LogUtils.logBusiness("CREATE_KNOWLEDGE_BASE", userId, "id=%d, name=%s, model=%s, dimensions=%d",
                saved.getId(), saved.getName(), config.getModel(), config.getDimensions());
        return saved;
    }

    /**
     * Loads a knowledge base on behalf of {@code userId}.
     *
     * @throws NotFoundException when it does not exist
     * @throws AccessDeniedException when it belongs to another user
     */
    public KnowledgeBase getOwned(Long knowledgeBaseId, String userId) {
        KnowledgeBase knowledgeBase = knowledgeBaseRepository.findById(knowledgeBaseId)
                .orElseThrow(() -> NotFoundException.knowledgeBase(knowledgeBaseId));
        if (!knowledgeBase.getUserId().equals(userId)) {
            LogUtils.logBusiness("ACCESS_KNOWLEDGE_BASE", userId, "denied: id=%d", knowledgeBaseId);
            throw new AccessDeniedException("You do not have access to this knowledge base");
        }
        return knowledgeBase;
    }

    public Page<KnowledgeBase> listForUser(String userId, int page, int size) {
        return knowledgeBaseRepository.findByUserIdOrderByCreatedAtDesc(userId,
                PageRequest.of(Math.max(page, 0), size > 0 ? size : DocumentRegistry.DEFAULT_PAGE_SIZE));
    }

    /**
     * Applies the non-null fields of the request. Changing the embedding model or dimension leaves
     * existing chunks in the old vector space until their documents are reprocessed.
     */
    @Transactional
    public KnowledgeBase update(Long knowledgeBaseId, String userId, UpdateKnowledgeBaseRequest request) {
        KnowledgeBase knowledgeBase = getOwned(knowledgeBaseId, userId);
        if (request.getName() != null) {
            if (request.getName().trim().isEmpty()) {
                throw new ValidationException("Knowledge base name must not be blank");
            }
            knowledgeBase.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            knowledgeBase.setDescription(request.getDescription());
        }

        EmbeddingConfig current = knowledgeBase.getEmbeddingConfig();
        EmbeddingConfig config = new EmbeddingConfig(
                valueOr(request.getEmbeddingProvider(), current.getProvider()),
                valueOr(request.getEmbeddingModel(), current.getModel()),
                valueOr(request.getEmbeddingDimensions(), current.getDimensions()),
                valueOr(request.getChunkSize(), current.getChunkSize()),
                valueOr(request.getChunkOverlap(), current.getChunkOverlap()));
        validate(config);
        if (!current.sameVectorSpace(config.getModel(), config.getDimensions())) {
            LogUtils.logBusiness("UPDATE_KNOWLEDGE_BASE", userId,
                    "id=%d embedding space changed %s/%d -> %s/%d, documents need reprocessing",
                    knowledgeBaseId, current.getModel(), current.getDimensions(),
                    config.getModel(), config.getDimensions());
        }
        knowledgeBase.setEmbeddingConfig(config);
        return knowledgeBaseRepository.save(knowledgeBase);
    }

    @Transactional
    public void delete(Long knowledgeBaseId, String userId) {
        KnowledgeBase knowledgeBase = getOwned(knowledgeBaseId, userId);
        int documents = documentRegistry.deleteAllForKnowledgeBase(knowledgeBaseId);
        knowledgeBaseRepository.delete(knowledgeBase);
        LogUtils.logBusiness("DELETE_KNOWLEDGE_BASE", userId, "id=%d, documents=%d", knowledgeBaseId, documents);
    }

    public KnowledgeBaseStats getStats(Long knowledgeBaseId, String userId) {
        KnowledgeBase knowledgeBase = getOwned(knowledgeBaseId, userId);
        return new KnowledgeBaseStats(
                knowledgeBase.getId(),
                knowledgeBase.getName(),
                documentRepository.countByKnowledgeBaseId(knowledgeBaseId),
                documentRepository.countByKnowledgeBaseIdAndStatus(knowledgeBaseId, DocumentStatus.READY),
                chunkRepository.countByKnowledgeBaseId(knowledgeBaseId),
                documentRepository.sumFileSizeByKnowledgeBaseId(knowledgeBaseId));
    }

    private static void validate(EmbeddingConfig config) {
        if (config.getModel() == null || config.getModel().trim().isEmpty()) {
            throw new ValidationException("Embedding model is required");
        }
        if (config.getDimensions() <= 0) {
            throw new ValidationException("Embedding dimensions must be positive");
        }
        if (config.getChunkSize() <= 0) {
            throw new ValidationException("Chunk size must be positive");
        }
        if (config.getChunkOverlap() < 0 || config.getChunkOverlap() >= config.getChunkSize()) {
            throw new ValidationException("Chunk overlap must be at least 0 and smaller than the chunk size");
        }
    }

    private static <T> T valueOr(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
