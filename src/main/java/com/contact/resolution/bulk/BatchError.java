package com.contact.resolution.bulk;

/**
 * A batch item that failed, with the failure message.
 */
public record BatchError(String itemId, String errorType, String message) {
}
