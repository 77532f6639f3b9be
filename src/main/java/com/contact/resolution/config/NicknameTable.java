package com.contact.resolution.config;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups of interchangeable first names (e.g. william, bill, will, billy).
 * Each name maps to the first entry of its group, which serves as the canonical form.
 */
public final class NicknameTable {

    private final Map<String, String> canonical;
    private final List<List<String>> groups;

    private NicknameTable(List<List<String>> groups) {
        Map<String, String> map = new HashMap<>();
        for (List<String> group : groups) {
            if (group.isEmpty()) {
                continue;
            }
            String root = group.get(0).toLowerCase(Locale.ROOT);
            for (String name : group) {
                map.putIfAbsent(name.toLowerCase(Locale.ROOT), root);
            }
        }
        this.canonical = Map.copyOf(map);
        this.groups = groups.stream().map(List::copyOf).toList();
    }

    public static NicknameTable of(Collection<? extends Collection<String>> groups) {
        return new NicknameTable(groups.stream().map(g -> List.<String>copyOf(g)).toList());
    }

    public static NicknameTable empty() {
        return new NicknameTable(List.of());
    }

    /**
     * Returns the canonical form of a lowercase name token, or the token itself.
     */
    public String canonicalize(String token) {
        if (token == null) {
            return null;
        }
        return canonical.getOrDefault(token, token);
    }

    public boolean areEquivalent(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return canonicalize(a).equals(canonicalize(b));
    }

    public Set<String> names() {
        return canonical.keySet();
    }

    public List<List<String>> groups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }
}
