package com.contact.resolution.lock;

import com.contact.resolution.core.ContactResolutionException;

/**
 * Thrown when a contact lock cannot be acquired within the configured timeout.
 */
public class LockAcquisitionException extends ContactResolutionException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
