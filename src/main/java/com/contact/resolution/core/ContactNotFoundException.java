package com.contact.resolution.core;

/**
 * Thrown when an operation names a contact id the store does not know.
 */
public class ContactNotFoundException extends ContactResolutionException {

    private final String contactId;

    public ContactNotFoundException(String contactId) {
        super("Contact not found: " + contactId);
        this.contactId = contactId;
    }

    public String getContactId() {
        return contactId;
    }
}
