package com.example.bpmn_transformer.exception;

/**
 * The input cannot be transformed at all: unreadable BPMN or no process root.
 * Thrown before the document is mutated.
 */
public class InvalidDocumentException extends RuntimeException {

    public InvalidDocumentException(String message) {
        super(message);
    }

    public InvalidDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
