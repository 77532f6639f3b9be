package com.contact.resolution.store;

import com.contact.resolution.config.NicknameTable;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.NormalizedRecord;
import com.contact.resolution.rules.ContactNormalizer;
import com.contact.resolution.similarity.NameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory contact store.
 * Candidates are contacts sharing the record's email domain, phone digits or any name token,
 * with name tokens compared after nickname canonicalization.
 */
public class InMemoryContactStore implements ContactStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryContactStore.class);

    private final ConcurrentMap<String, Contact> contacts = new ConcurrentHashMap<>();
    private final NicknameTable nicknames;

    public InMemoryContactStore() {
        this(NicknameTable.empty());
    }

    public InMemoryContactStore(NicknameTable nicknames) {
        this.nicknames = Objects.requireNonNull(nicknames, "nicknames is required");
    }

    @Override
    public Collection<Contact> findCandidates(NormalizedRecord record) {
        String domain = domainOf(record.email());
        Set<String> nameTokens = NameSimilarity.canonicalTokenSet(record.nameKey(), nicknames);
        List<Contact> candidates = new ArrayList<>();
        for (Contact contact : contacts.values()) {
            if (isCandidate(contact, record, domain, nameTokens)) {
                candidates.add(contact);
            }
        }
        log.debug("store.candidates ref={} found={}", record.reference(), candidates.size());
        return candidates;
    }

    private boolean isCandidate(Contact contact, NormalizedRecord record, String domain,
                                       Set<String> nameTokens) {
        if (domain != null && domain.equals(domainOf(contact.getEmail()))) {
            return true;
        }
        if (record.phone() != null && record.phone().equals(ContactNormalizer.phoneDigits(contact.getPhone()))) {
            return true;
        }
        if (!nameTokens.isEmpty() && contact.hasName()) {
            return !Collections.disjoint(nameTokens, NameSimilarity.canonicalTokenSet(contact.getName(), nicknames));
        }
        return false;
    }

    @Override
    public Optional<Contact> findById(String contactId) {
        return Optional.ofNullable(contacts.get(contactId));
    }

    @Override
    public void persist(Contact contact) {
        Objects.requireNonNull(contact, "contact is required");
        contacts.put(contact.getId(), contact);
    }

    @Override
    public void remove(String contactId) {
        contacts.remove(contactId);
    }

    @Override
    public List<String> findAllIds() {
        return contacts.keySet().stream().sorted().toList();
    }

    public int size() {
        return contacts.size();
    }

    private static String domainOf(String email) {
        if (email == null) {
            return null;
        }
        int at = email.lastIndexOf('@');
        return at < 0 || at == email.length() - 1 ? null : email.substring(at + 1).toLowerCase(Locale.ROOT);
    }
}
