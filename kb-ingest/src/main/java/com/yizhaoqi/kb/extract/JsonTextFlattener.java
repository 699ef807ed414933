package com.yizhaoqi.kb.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yizhaoqi.kb.config.KnowledgeBaseProperties;
import com.yizhaoqi.kb.entity.ExtractionFailureKind;
import com.yizhaoqi.kb.exception.ExtractionException;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flattens a JSON document into one line per scalar value. Every object key is emitted as its own
 * {@code key:} line ahead of its value. Values nested deeper than the configured depth are dropped.
 */
@Component
public class JsonTextFlattener {

    private final ObjectMapper objectMapper;
    private final KnowledgeBaseProperties properties;

    public JsonTextFlattener(ObjectMapper objectMapper, KnowledgeBaseProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public String flatten(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExtractionException(ExtractionFailureKind.PARSE_FAILED, "json",
                    "Failed to extract text from JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new ExtractionException(ExtractionFailureKind.PARSE_FAILED, "json",
                    "Failed to extract text from JSON: empty document");
        }
        return String.join("\n", flatten(root, properties.getExtraction().getJsonMaxDepth()));
    }

    static List<String> flatten(JsonNode root, int maxDepth) {
        List<String> lines = new ArrayList<>();
        Deque<WorkItem> stack = new ArrayDeque<>();
        stack.push(WorkItem.node(root, 0));

        while (!stack.isEmpty()) {
            WorkItem item = stack.pop();
            if (item.label != null) {
                lines.add(item.label);
                continue;
            }
            JsonNode node = item.node;
            if (item.depth > maxDepth) {
                continue;
            }
            if (node.isTextual()) {
                lines.add(node.textValue());
            } else if (node.isNumber() || node.isBoolean()) {
                lines.add(node.asText());
            } else if (node.isArray()) {
                // pushed in reverse so that elements come off the stack in document order
                for (int i = node.size() - 1; i >= 0; i--) {
                    stack.push(WorkItem.node(node.get(i), item.depth + 1));
                }
            } else if (node.isObject()) {
                List<Map.Entry<String, JsonNode>> fields = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    fields.add(it.next());
                }
                for (int i = fields.size() - 1; i >= 0; i--) {
                    stack.push(WorkItem.node(fields.get(i).getValue(), item.depth + 1));
                    stack.push(WorkItem.label(fields.get(i).getKey() + ":"));
                }
            }
        }
        return lines;
    }

    private static final class WorkItem {
        private final String label;
        private final JsonNode node;
        private final int depth;

        private WorkItem(String label, JsonNode node, int depth) {
            this.label = label;
            this.node = node;
            this.depth = depth;
        }

        static WorkItem label(String label) {
            return new WorkItem(label, null, 0);
        }

        static WorkItem node(JsonNode node, int depth) {
            return new WorkItem(null, node, depth);
        }
    }
}
