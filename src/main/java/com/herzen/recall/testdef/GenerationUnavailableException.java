package com.herzen.recall.testdef;

public class GenerationUnavailableException extends RuntimeException {
    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
