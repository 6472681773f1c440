package com.herzen.recall.testdef;

public class TestNotFoundException extends RuntimeException {
    public TestNotFoundException(String testId) {
        super("Test not found: " + testId);
    }
}
