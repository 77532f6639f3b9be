package com.contact.resolution.similarity;

import java.util.Locale;

/**
 * Case-insensitive containment in either direction: "Acme" and "Acme Corp" score 1.0.
 */
public class CompanySimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        String a = s1.trim().toLowerCase(Locale.ROOT);
        String b = s2.trim().toLowerCase(Locale.ROOT);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        return a.contains(b) || b.contains(a) ? 1.0 : 0.0;
    }

    @Override
    public String getName() {
        return "CompanyContainment";
    }
}
