package com.yizhaoqi.kb.exception;

import org.springframework.http.HttpStatus;

public class ValidationException extends KnowledgeBaseException {

    public ValidationException(String message) {
        super(message, HttpStatus.BAD_REQUEST);
    }
}
