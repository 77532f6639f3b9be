package com.contact.resolution.rules;

import com.contact.resolution.core.ContactResolutionException;

/**
 * Thrown when a raw record is structurally unusable. Carries the offending field
 * so the caller can surface the rejected record.
 */
public class ValidationException extends ContactResolutionException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
