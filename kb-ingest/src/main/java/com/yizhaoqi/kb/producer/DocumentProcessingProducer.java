package com.yizhaoqi.kb.producer;

import com.yizhaoqi.kb.config.KafkaConfig;
import com.yizhaoqi.kb.exception.KnowledgeBaseException;
import com.yizhaoqi.kb.model.DocumentProcessingTask;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import com.yizhaoqi.kb.utils.LogUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queues processing runs. Messages are keyed by document id so all runs of one document land on the
 * same partition. A send is only reported as done once the broker acknowledged it.
 */
@Component
public class DocumentProcessingProducer {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaConfig kafkaConfig;

    @Value("${kafka.producer.send-timeout-ms:10000}")
    private long sendTimeoutMillis;

    public DocumentProcessingProducer(KafkaTemplate<String, Object> kafkaTemplate, KafkaConfig kafkaConfig) {
        this.kafkaTemplate = kafkaTemplate;
        this.kafkaConfig = kafkaConfig;
    }

    /**
     * @throws KnowledgeBaseException (503) when the message could not be delivered; the document stays
     *         pending and can be queued again with reprocess
     */
    public DocumentProcessingTask submit(KnowledgeDocument document, String userId) {
        String runId = "process-document-" + document.getId() + "-" + System.currentTimeMillis();
        DocumentProcessingTask task = new DocumentProcessingTask(
                runId,
                document.getId(),
                document.getKnowledgeBaseId(),
                document.getSourceType(),
                document.getSourceLocator(),
                document.getFileType(),
                userId
        );
        String topic = kafkaConfig.getDocumentProcessingTopic();
        LogUtils.logBusiness("QUEUE_DOCUMENT", userId, "topic=%s, documentId=%d, runId=%s",
                topic, document.getId(), runId);
        try {
            kafkaTemplate.send(topic, String.valueOf(document.getId()), task)
                    .get(sendTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw queueFailed(document, userId, e);
        } catch (ExecutionException e) {
            throw queueFailed(document, userId, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | RuntimeException e) {
            throw queueFailed(document, userId, e);
        }
        return task;
    }

    private KnowledgeBaseException queueFailed(KnowledgeDocument document, String userId, Throwable cause) {
        LogUtils.logBusinessError("QUEUE_DOCUMENT", userId, "documentId=%d", cause, document.getId());
        return new KnowledgeBaseException(String.format(
                "Failed to queue document %d for processing; reprocess it to retry", document.getId()),
                HttpStatus.SERVICE_UNAVAILABLE, cause);
    }
}
