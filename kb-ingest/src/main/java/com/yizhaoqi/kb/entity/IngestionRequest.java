package com.yizhaoqi.kb.entity;

import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;

/**
 * A request to add one document to a knowledge base. Each subclass fixes the source type and owns
 * exactly one locator, so a file request can never carry a URL and vice versa.
 */
public abstract class IngestionRequest {

    public static final long MAX_WIRE_SAFE_SIZE = 9_007_199_254_740_991L;

    private final String name;

    IngestionRequest(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public abstract DocumentSourceType getSourceType();

    public abstract String getLocator();

    public abstract DocumentFileType getFileType();

    public Long getFileSize() {
        return null;
    }

    /**
     * Name stored on the document when the caller did not supply one.
     */
    public abstract String defaultName();

    /**
     * Checks locator, declared type and size. Throws {@link com.yizhaoqi.kb.exception.ValidationException}.
     */
    public abstract void validate();
}
