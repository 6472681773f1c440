package com.herzen.recall.norms;

/**
 * A normative profile that cannot yield finite standardized scores. Raised while profiles are
 * loaded, which makes it a fatal configuration error.
 */
public class InvalidProfileException extends RuntimeException {
    public InvalidProfileException(String message) {
        super(message);
    }
}
