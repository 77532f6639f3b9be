package com.contact.resolution.store;

import com.contact.resolution.core.model.Contact;
import com.contact.resolution.resolve.CandidateSource;

import java.util.List;
import java.util.Optional;

/**
 * Contact persistence used by ingestion. Writes are atomic per contact.
 */
public interface ContactStore extends CandidateSource {

    Optional<Contact> findById(String contactId);

    /**
     * Inserts or replaces the contact with the same id.
     */
    void persist(Contact contact);

    /**
     * Removes a contact. Only used to roll back a creation that was never committed.
     */
    void remove(String contactId);

    List<String> findAllIds();
}
