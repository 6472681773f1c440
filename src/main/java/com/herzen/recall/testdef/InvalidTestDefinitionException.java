package com.herzen.recall.testdef;

public class InvalidTestDefinitionException extends RuntimeException {
    public InvalidTestDefinitionException(String message) {
        super(message);
    }
}
