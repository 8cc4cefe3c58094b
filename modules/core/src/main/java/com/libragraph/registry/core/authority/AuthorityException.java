package com.libragraph.registry.core.authority;

/**
 * A read or write against the backing store failed.
 */
public class AuthorityException extends RuntimeException {

    public AuthorityException(String message, Throwable cause) {
        super(message, cause);
    }

    public AuthorityException(String message) {
        super(message);
    }
}
