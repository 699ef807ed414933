package com.yizhaoqi.kb.exception;

import org.springframework.http.HttpStatus;

/**
 * The resource exists but belongs to another user. Kept apart from {@link NotFoundException}.
 */
public class AccessDeniedException extends KnowledgeBaseException {

    public AccessDeniedException(String message) {
        super(message, HttpStatus.FORBIDDEN);
    }
}
