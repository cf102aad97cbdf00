package com.example.bpmn_transformer.cli;

public class UsageException extends Exception {

    public UsageException(String message) {
        super(message);
    }
}
