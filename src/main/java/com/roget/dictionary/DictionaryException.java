package com.roget.dictionary;

/**
 * Thrown when a word list cannot be read or contains a malformed line.
 */
public class DictionaryException extends Exception {
    public DictionaryException(String message) {
        super(message);
    }

    public DictionaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
