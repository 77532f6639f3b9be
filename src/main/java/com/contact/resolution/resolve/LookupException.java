package com.contact.resolution.resolve;

import com.contact.resolution.core.ContactResolutionException;

/**
 * Thrown when the candidate pool cannot be read. Never converted into a "no match".
 */
public class LookupException extends ContactResolutionException {

    public LookupException(String message) {
        super(message);
    }

    public LookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
