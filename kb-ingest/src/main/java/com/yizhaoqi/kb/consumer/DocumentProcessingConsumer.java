package com.yizhaoqi.kb.consumer;

import com.yizhaoqi.kb.entity.ProcessingResult;
import com.yizhaoqi.kb.model.DocumentProcessingTask;
import com.yizhaoqi.kb.service.DocumentProcessingPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class DocumentProcessingConsumer {

    private final DocumentProcessingPipeline pipeline;

    public DocumentProcessingConsumer(DocumentProcessingPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @KafkaListener(topics = "#{kafkaConfig.getDocumentProcessingTopic()}",
            groupId = "#{kafkaConfig.getDocumentProcessingGroupId()}")
    public void processTask(DocumentProcessingTask task) {
        log.info("Received processing task: documentId={}, runId={}, sourceType={}",
                task.getDocumentId(), task.getRunId(), task.getSourceType());
        ProcessingResult result = pipeline.process(task);
        log.info("Processing run {} finished: outcome={}, chunks={}, error={}",
                task.getRunId(), result.outcome(), result.chunkCount(), result.error());
    }
}
