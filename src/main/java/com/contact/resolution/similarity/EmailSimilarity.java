package com.contact.resolution.similarity;

import com.contact.resolution.config.MatchingPolicy;

import java.util.Locale;
import java.util.Objects;

/**
 * Email comparators. Exact equality is universal; alias equivalence is limited to the
 * domains the policy allow-lists, because consumer providers disagree on plus-addressing
 * and dot handling.
 */
public class EmailSimilarity implements SimilarityAlgorithm {

    private final MatchingPolicy policy;

    public EmailSimilarity(MatchingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    /**
     * 1.0 for exact equality, 0.9 for allow-listed alias equivalence, otherwise 0.0.
     */
    @Override
    public double compute(String s1, String s2) {
        if (exact(s1, s2)) {
            return 1.0;
        }
        return aliasEquivalent(s1, s2) ? 0.9 : 0.0;
    }

    @Override
    public String getName() {
        return "Email";
    }

    public boolean exact(String a, String b) {
        String x = clean(a);
        String y = clean(b);
        return x != null && x.equals(y);
    }

    /**
     * Same domain, domain allow-listed, and equal local parts once {@code +tag} is stripped
     * (alias domains) and dots are removed (dot-insensitive domains).
     */
    public boolean aliasEquivalent(String a, String b) {
        String x = clean(a);
        String y = clean(b);
        if (x == null || y == null) {
            return false;
        }
        int atX = x.lastIndexOf('@');
        int atY = y.lastIndexOf('@');
        if (atX <= 0 || atY <= 0) {
            return false;
        }
        String domain = x.substring(atX + 1);
        if (domain.isEmpty() || !domain.equals(y.substring(atY + 1))) {
            return false;
        }
        boolean alias = policy.isAliasDomain(domain);
        boolean dotInsensitive = policy.isDotInsensitiveDomain(domain);
        if (!alias && !dotInsensitive) {
            return false;
        }
        String localX = canonicalLocal(x.substring(0, atX), alias, dotInsensitive);
        String localY = canonicalLocal(y.substring(0, atY), alias, dotInsensitive);
        return !localX.isEmpty() && localX.equals(localY);
    }

    private static String canonicalLocal(String local, boolean stripTag, boolean stripDots) {
        String result = local;
        if (stripTag) {
            int plus = result.indexOf('+');
            if (plus >= 0) {
                result = result.substring(0, plus);
            }
        }
        if (stripDots) {
            result = result.replace(".", "");
        }
        return result;
    }

    private static String clean(String email) {
        if (email == null) {
            return null;
        }
        String trimmed = email.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }
}
