package com.contact.resolution.core;

/**
 * Base class for failures raised by the resolution engine.
 */
public class ContactResolutionException extends RuntimeException {

    public ContactResolutionException(String message) {
        super(message);
    }

    public ContactResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
