package com.contact.resolution.config;

import com.contact.resolution.core.model.ContactField;
import com.contact.resolution.core.model.SourcePlatform;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Shared matching and merge policy: thresholds, domain allow-lists, the nickname table
 * and per-field authoritative sources. Every resolver and merge engine built from the
 * same policy applies identical semantics.
 */
public class MatchingPolicy {

    private static final double DEFAULT_NAME_MATCH_THRESHOLD = 0.75;
    private static final double DEFAULT_NAME_WITH_COMPANY_THRESHOLD = 0.5;
    private static final double DEFAULT_COMPANY_MATCH_THRESHOLD = 0.5;
    private static final double DEFAULT_PHONE_NAME_THRESHOLD = 0.5;

    static final List<String> DEFAULT_FREE_MAIL_DOMAINS = List.of(
            "gmail.com", "yahoo.com", "hotmail.com", "outlook.com", "icloud.com",
            "aol.com", "live.com", "msn.com", "mail.com", "protonmail.com",
            "protonmail.ch", "zoho.com", "yandex.com", "gmx.com", "mail.ru");

    private final Set<String> freeMailDomains;
    private final Set<String> aliasDomains;
    private final Set<String> dotInsensitiveDomains;
    private final NicknameTable nicknames;
    private final double nameMatchThreshold;
    private final double nameWithCompanyThreshold;
    private final double companyMatchThreshold;
    private final double phoneNameThreshold;
    private final Map<ContactField, Set<SourcePlatform>> authoritativeSources;

    private MatchingPolicy(Builder builder) {
        this.freeMailDomains = Set.copyOf(builder.freeMailDomains);
        this.aliasDomains = Set.copyOf(builder.aliasDomains);
        this.dotInsensitiveDomains = Set.copyOf(builder.dotInsensitiveDomains);
        this.nicknames = builder.nicknames;
        this.nameMatchThreshold = builder.nameMatchThreshold;
        this.nameWithCompanyThreshold = builder.nameWithCompanyThreshold;
        this.companyMatchThreshold = builder.companyMatchThreshold;
        this.phoneNameThreshold = builder.phoneNameThreshold;
        Map<ContactField, Set<SourcePlatform>> authorities = new EnumMap<>(ContactField.class);
        builder.authoritativeSources.forEach((field, sources) ->
                authorities.put(field, Set.copyOf(sources)));
        this.authoritativeSources = Map.copyOf(authorities);
    }

    public boolean isFreeMailDomain(String domain) {
        return domain != null && freeMailDomains.contains(domain.toLowerCase(Locale.ROOT));
    }

    /**
     * Domains on which {@code user+tag@domain} is treated as {@code user@domain}.
     */
    public boolean isAliasDomain(String domain) {
        return domain != null && aliasDomains.contains(domain.toLowerCase(Locale.ROOT));
    }

    /**
     * Domains whose mail servers ignore dots in the local part.
     */
    public boolean isDotInsensitiveDomain(String domain) {
        return domain != null && dotInsensitiveDomains.contains(domain.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns true if the platform overrides existing values of the given field.
     */
    public boolean isAuthoritative(SourcePlatform platform, ContactField field) {
        Set<SourcePlatform> sources = authoritativeSources.get(field);
        return sources != null && sources.contains(platform);
    }

    public Set<String> getFreeMailDomains() {
        return freeMailDomains;
    }

    public Set<String> getAliasDomains() {
        return aliasDomains;
    }

    public Set<String> getDotInsensitiveDomains() {
        return dotInsensitiveDomains;
    }

    public NicknameTable getNicknames() {
        return nicknames;
    }

    public double getNameMatchThreshold() {
        return nameMatchThreshold;
    }

    public double getNameWithCompanyThreshold() {
        return nameWithCompanyThreshold;
    }

    public double getCompanyMatchThreshold() {
        return companyMatchThreshold;
    }

    public double getPhoneNameThreshold() {
        return phoneNameThreshold;
    }

    public Map<ContactField, Set<SourcePlatform>> getAuthoritativeSources() {
        return authoritativeSources;
    }

    /**
     * Policy loaded from the bundled {@code matching-policy.json}.
     */
    public static MatchingPolicy defaults() {
        return MatchingPolicyLoader.loadDefaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(MatchingPolicy policy) {
        Builder builder = new Builder()
                .freeMailDomains(policy.freeMailDomains)
                .aliasDomains(policy.aliasDomains)
                .dotInsensitiveDomains(policy.dotInsensitiveDomains)
                .nicknames(policy.nicknames)
                .nameMatchThreshold(policy.nameMatchThreshold)
                .nameWithCompanyThreshold(policy.nameWithCompanyThreshold)
                .companyMatchThreshold(policy.companyMatchThreshold)
                .phoneNameThreshold(policy.phoneNameThreshold);
        policy.authoritativeSources.forEach(builder::authoritativeSources);
        return builder;
    }

    public static class Builder {
        private final Set<String> freeMailDomains = new LinkedHashSet<>(DEFAULT_FREE_MAIL_DOMAINS);
        private final Set<String> aliasDomains = new LinkedHashSet<>();
        private final Set<String> dotInsensitiveDomains = new LinkedHashSet<>();
        private NicknameTable nicknames = NicknameTable.empty();
        private double nameMatchThreshold = DEFAULT_NAME_MATCH_THRESHOLD;
        private double nameWithCompanyThreshold = DEFAULT_NAME_WITH_COMPANY_THRESHOLD;
        private double companyMatchThreshold = DEFAULT_COMPANY_MATCH_THRESHOLD;
        private double phoneNameThreshold = DEFAULT_PHONE_NAME_THRESHOLD;
        private final Map<ContactField, Set<SourcePlatform>> authoritativeSources =
                new EnumMap<>(ContactField.class);

        public Builder freeMailDomains(Collection<String> domains) {
            this.freeMailDomains.clear();
            domains.forEach(d -> this.freeMailDomains.add(d.trim().toLowerCase(Locale.ROOT)));
            return this;
        }

        public Builder aliasDomains(Collection<String> domains) {
            this.aliasDomains.clear();
            domains.forEach(d -> this.aliasDomains.add(d.trim().toLowerCase(Locale.ROOT)));
            return this;
        }

        public Builder dotInsensitiveDomains(Collection<String> domains) {
            this.dotInsensitiveDomains.clear();
            domains.forEach(d -> this.dotInsensitiveDomains.add(d.trim().toLowerCase(Locale.ROOT)));
            return this;
        }

        public Builder nicknames(NicknameTable nicknames) {
            this.nicknames = nicknames != null ? nicknames : NicknameTable.empty();
            return this;
        }

        public Builder nameMatchThreshold(double threshold) {
            validateThreshold(threshold, "nameMatchThreshold");
            this.nameMatchThreshold = threshold;
            return this;
        }

        public Builder nameWithCompanyThreshold(double threshold) {
            validateThreshold(threshold, "nameWithCompanyThreshold");
            this.nameWithCompanyThreshold = threshold;
            return this;
        }

        public Builder companyMatchThreshold(double threshold) {
            validateThreshold(threshold, "companyMatchThreshold");
            this.companyMatchThreshold = threshold;
            return this;
        }

        public Builder phoneNameThreshold(double threshold) {
            validateThreshold(threshold, "phoneNameThreshold");
            this.phoneNameThreshold = threshold;
            return this;
        }

        public Builder authoritativeSources(ContactField field, Collection<SourcePlatform> sources) {
            if (sources == null || sources.isEmpty()) {
                this.authoritativeSources.remove(field);
            } else {
                this.authoritativeSources.put(field, EnumSet.copyOf(sources));
            }
            return this;
        }

        public Builder authoritativeSource(ContactField field, SourcePlatform source) {
            this.authoritativeSources.computeIfAbsent(field, f -> EnumSet.noneOf(SourcePlatform.class))
                    .add(source);
            return this;
        }

        public MatchingPolicy build() {
            if (nameWithCompanyThreshold > nameMatchThreshold) {
                throw new IllegalArgumentException(
                        "nameWithCompanyThreshold must be <= nameMatchThreshold");
            }
            return new MatchingPolicy(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "MatchingPolicy{" +
                "freeMailDomains=" + freeMailDomains.size() +
                ", aliasDomains=" + aliasDomains +
                ", dotInsensitiveDomains=" + dotInsensitiveDomains +
                ", nicknameGroups=" + nicknames.size() +
                ", nameMatchThreshold=" + nameMatchThreshold +
                ", nameWithCompanyThreshold=" + nameWithCompanyThreshold +
                ", companyMatchThreshold=" + companyMatchThreshold +
                ", phoneNameThreshold=" + phoneNameThreshold +
                ", authoritativeSources=" + authoritativeSources +
                '}';
    }
}
