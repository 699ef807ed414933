package com.yizhaoqi.kb.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;


@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.document-processing:kb-document-processing}")
    private String documentProcessingTopic;

    @Value("${kafka.group.document-processing:kb-document-processing-group}")
    private String documentProcessingGroupId;

    @Value("${kafka.topic.document-processing-partitions:3}")
    private int documentProcessingPartitions;

    public String getDocumentProcessingTopic() {
        return documentProcessingTopic;
    }

    public String getDocumentProcessingGroupId() {
        return documentProcessingGroupId;
    }

    @Bean
    public NewTopic documentProcessingTopic() {
        return TopicBuilder.name(documentProcessingTopic)
                .partitions(documentProcessingPartitions)
                .replicas(1)
                .build();
    }
}
