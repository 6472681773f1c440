package com.herzen.recall.scoring;

@FunctionalInterface
public interface SessionIdGenerator {
    String nextId();
}
