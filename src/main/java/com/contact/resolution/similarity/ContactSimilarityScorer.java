package com.contact.resolution.similarity;

import com.contact.resolution.config.MatchingPolicy;
import com.contact.resolution.rules.ContactNormalizer;

/**
 * The comparison primitives consumed by the identity resolver, bound to one policy.
 */
public class ContactSimilarityScorer {

    private final EmailSimilarity email;
    private final NameSimilarity name;
    private final CompanySimilarity company;

    public ContactSimilarityScorer(MatchingPolicy policy) {
        this.email = new EmailSimilarity(policy);
        this.name = new NameSimilarity(policy.getNicknames());
        this.company = new CompanySimilarity();
    }

    public boolean emailExact(String a, String b) {
        return email.exact(a, b);
    }

    public boolean emailAliasEquivalent(String a, String b) {
        return email.aliasEquivalent(a, b);
    }

    /**
     * Equality of normalized phone digits, so formatted and bare numbers compare equal.
     * Absent values never match.
     */
    public boolean phoneExact(String a, String b) {
        String x = ContactNormalizer.phoneDigits(a);
        return x != null && x.equals(ContactNormalizer.phoneDigits(b));
    }

    public double nameFuzzy(String a, String b) {
        return name.compute(a, b);
    }

    public double companyFuzzy(String a, String b) {
        return company.compute(a, b);
    }
}
