package com.herzen.recall.session;

/**
 * External cleanup of a raw speech transcript (punctuation, misheard words). Applied before the
 * recall is submitted; scoring accepts the raw text just as well.
 */
public interface TranscriptRefiner {
    String refine(String rawText);
}
