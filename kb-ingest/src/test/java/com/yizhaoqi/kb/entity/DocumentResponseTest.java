package com.yizhaoqi.kb.entity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;
import com.yizhaoqi.kb.model.DocumentStatus;
import com.yizhaoqi.kb.model.KnowledgeDocument;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DocumentResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void testWireFormat() throws Exception {
        KnowledgeDocument document = new KnowledgeDocument();
        document.setId(7L);
        document.setKnowledgeBaseId(1L);
        document.setName("example.com");
        document.setSourceType(DocumentSourceType.URL);
        document.setSourceUrl("https://example.com");
        document.setFileType(DocumentFileType.HTML);
        document.setFileSize(IngestionRequest.MAX_WIRE_SAFE_SIZE);
        document.setStatus(DocumentStatus.FAILED);
        document.setErrorMessage("Failed to fetch URL: Request failed with status code 404");
        document.setMetadata(Map.of("title", "Example"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(DocumentResponse.from(document)));

        assertEquals(1L, json.get("knowledge_base_id").asLong());
        assertEquals("url", json.get("source_type").asText());
        assertEquals("html", json.get("file_type").asText());
        assertEquals("failed", json.get("status").asText());
        assertTrue(json.get("file_size").isIntegralNumber());
        assertEquals(9_007_199_254_740_991L, json.get("file_size").asLong());
        assertEquals("Example", json.get("metadata").get("title").asText());
        assertTrue(json.has("error_message"));
        assertFalse(json.has("knowledgeBaseId"));
    }
}
