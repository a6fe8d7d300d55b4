package com.certchaperone.backend.modules.identity.application;

public class IdentityLookupException extends RuntimeException {

    public IdentityLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
