package com.contact.resolution.similarity;

import com.contact.resolution.config.NicknameTable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Token-based person-name comparison tolerant of nicknames, initials and partial names.
 *
 * <ul>
 *   <li>Identical comparison keys: {@link #EXACT_SCORE}</li>
 *   <li>Same tokens after nickname canonicalization (Bill Carter / William Carter): {@link #NICKNAME_SCORE}</li>
 *   <li>Initial in place of a given name (J. Smith / John Smith): {@link #INITIAL_SCORE}</li>
 *   <li>Multi-token name contained in the other (Mary Ann Lee / Mary Lee): {@link #SUBSET_SCORE}</li>
 *   <li>First name alone against a full name (John / John Smith): {@link #FIRST_NAME_ONLY_SCORE}</li>
 *   <li>Anything else: Jaccard overlap of canonical tokens</li>
 * </ul>
 */
public class NameSimilarity implements SimilarityAlgorithm {

    public static final double EXACT_SCORE = 1.0;
    public static final double NICKNAME_SCORE = 0.9;
    public static final double INITIAL_SCORE = 0.8;
    public static final double SUBSET_SCORE = 0.8;
    public static final double FIRST_NAME_ONLY_SCORE = 0.5;

    private static final Pattern SEPARATORS = Pattern.compile("[.,\\s]+");

    private final NicknameTable nicknames;

    public NameSimilarity(NicknameTable nicknames) {
        this.nicknames = Objects.requireNonNull(nicknames, "nicknames is required");
    }

    @Override
    public double compute(String s1, String s2) {
        List<String> a = tokens(s1);
        List<String> b = tokens(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return EXACT_SCORE;
        }

        List<String> ca = canonical(a);
        List<String> cb = canonical(b);
        if (ca.equals(cb)) {
            return NICKNAME_SCORE;
        }
        if (initialMatch(ca, cb)) {
            return INITIAL_SCORE;
        }

        List<String> shorter = ca.size() <= cb.size() ? ca : cb;
        List<String> longer = shorter == ca ? cb : ca;
        if (shorter.size() < longer.size() && longer.containsAll(shorter)) {
            if (shorter.size() >= 2) {
                return SUBSET_SCORE;
            }
            if (shorter.get(0).equals(longer.get(0))) {
                return FIRST_NAME_ONLY_SCORE;
            }
        }

        return overlap(new LinkedHashSet<>(ca), new LinkedHashSet<>(cb));
    }

    @Override
    public String getName() {
        return "NameTokens";
    }

    /**
     * Same token count, same last token, at least one position where a single letter stands
     * for the other side's given name, every other position equivalent.
     */
    private boolean initialMatch(List<String> a, List<String> b) {
        if (a.size() != b.size() || a.size() < 2) {
            return false;
        }
        int last = a.size() - 1;
        if (!a.get(last).equals(b.get(last))) {
            return false;
        }
        boolean sawInitial = false;
        for (int i = 0; i < last; i++) {
            String x = a.get(i);
            String y = b.get(i);
            if (x.equals(y)) {
                continue;
            }
            if (isInitialOf(x, y) || isInitialOf(y, x)) {
                sawInitial = true;
                continue;
            }
            return false;
        }
        return sawInitial;
    }

    /**
     * Jaccard index of two token sets. Empty sets score 0.0.
     */
    static double overlap(Set<String> tokens1, Set<String> tokens2) {
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        int intersectionSize = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersectionSize++;
            }
        }
        int unionSize = tokens1.size() + tokens2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    private static boolean isInitialOf(String initial, String name) {
        return initial.length() == 1 && name.length() > 1 && name.charAt(0) == initial.charAt(0);
    }

    private List<String> canonical(List<String> tokens) {
        List<String> result = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            result.add(nicknames.canonicalize(token));
        }
        return result;
    }

    static List<String> tokens(String name) {
        if (name == null) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : SEPARATORS.split(name.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * Distinct lowercase tokens of a name with nicknames mapped to their canonical form,
     * used for candidate lookup.
     */
    public static Set<String> canonicalTokenSet(String name, NicknameTable nicknames) {
        Set<String> result = new LinkedHashSet<>();
        for (String token : tokens(name)) {
            result.add(nicknames.canonicalize(token));
        }
        return result;
    }
}
