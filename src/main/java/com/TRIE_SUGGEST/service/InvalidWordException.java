package com.TRIE_SUGGEST.service;

/**
 * Raised at the input boundary for tokens the trie is not meant to index:
 * empty, too long, non-alphabetic, or carrying a bad popularity.
 */
public class InvalidWordException extends RuntimeException {

    private final String token;

    public InvalidWordException(String token, String message) {
        super(message);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
