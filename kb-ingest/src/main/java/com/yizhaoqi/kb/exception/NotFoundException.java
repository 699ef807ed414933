package com.yizhaoqi.kb.exception;

import org.springframework.http.HttpStatus;

public class NotFoundException extends KnowledgeBaseException {

    public NotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND);
    }

    public static NotFoundException knowledgeBase(Long id) {
        return new NotFoundException("Knowledge base not found: " + id);
    }

    public static NotFoundException document(Long id) {
        return new NotFoundException("Document not found: " + id);
    }
}
