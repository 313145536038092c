package com.example.contentpipeline.service;

/** Thrown when a generator returns content that cannot be read as the expected structure. */
public class MalformedOutputException extends RuntimeException {

    public MalformedOutputException(String message) {
        super(message);
    }

    public MalformedOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
