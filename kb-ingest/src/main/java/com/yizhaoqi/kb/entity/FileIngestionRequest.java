package com.yizhaoqi.kb.entity;

import com.yizhaoqi.kb.exception.ValidationException;
import com.yizhaoqi.kb.model.DocumentFileType;
import com.yizhaoqi.kb.model.DocumentSourceType;

/**
 * A document whose bytes already live in blob storage under {@code filePath}.
 */
public class FileIngestionRequest extends IngestionRequest {

    private final String filePath;
    private final String declaredFileType;
    private final Long fileSize;

    public FileIngestionRequest(String name, String filePath, String declaredFileType, Long fileSize) {
        super(name);
        this.filePath = filePath;
        this.declaredFileType = declaredFileType;
        this.fileSize = fileSize;
    }

    public static FileIngestionRequest of(String fileName, String filePath, Long fileSize) {
        return new FileIngestionRequest(fileName, filePath, null, fileSize);
    }

    @Override
    public DocumentSourceType getSourceType() {
        return DocumentSourceType.FILE;
    }

    @Override
    public String getLocator() {
        return filePath;
    }

    @Override
    public DocumentFileType getFileType() {
        String extension = declaredExtension();
        return DocumentFileType.fromExtension(extension)
                .orElseThrow(() -> new ValidationException(String.format(
                        "Unsupported file type: %s. Supported types: %s",
                        extension.isEmpty() ? "(none)" : extension, DocumentFileType.supportedExtensions())));
    }

    @Override
    public Long getFileSize() {
        return fileSize;
    }

    @Override
    public String defaultName() {
        int slash = filePath == null ? -1 : filePath.lastIndexOf('/');
        return slash >= 0 ? filePath.substring(slash + 1) : filePath;
    }

    @Override
    public void validate() {
        if (filePath == null || filePath.trim().isEmpty()) {
            throw new ValidationException("File path is required for file documents");
        }
        if (fileSize != null && (fileSize < 0 || fileSize > MAX_WIRE_SAFE_SIZE)) {
            throw new ValidationException("File size must be between 0 and " + MAX_WIRE_SAFE_SIZE + " bytes");
        }
        getFileType();
    }

    private String declaredExtension() {
        if (declaredFileType != null && !declaredFileType.trim().isEmpty()) {
            return declaredFileType.trim().toLowerCase();
        }
        String fromName = DocumentFileType.extensionOf(getName());
        return fromName.isEmpty() ? DocumentFileType.extensionOf(filePath) : fromName;
    }
}
