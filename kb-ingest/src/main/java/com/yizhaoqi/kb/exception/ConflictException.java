package com.yizhaoqi.kb.exception;

import org.springframework.http.HttpStatus;

public class ConflictException extends KnowledgeBaseException {

    public ConflictException(String message) {
        super(message, HttpStatus.CONFLICT);
    }
}
