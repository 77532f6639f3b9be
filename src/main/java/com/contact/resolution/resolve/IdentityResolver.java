package com.contact.resolution.resolve;

import com.contact.resolution.config.MatchingPolicy;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.MatchResult;
import com.contact.resolution.core.model.NormalizedRecord;
import com.contact.resolution.similarity.ContactSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Decides whether an incoming record describes an existing contact.
 * Signals are tried in priority order and the first confident hit wins:
 * <ol>
 *   <li>exact email: {@link MatchConfidence#EXACT}</li>
 *   <li>allow-listed email alias: {@link MatchConfidence#HIGH}</li>
 *   <li>phone corroborated by name (or a nameless contact): {@link MatchConfidence#HIGH}</li>
 *   <li>fuzzy name, alone or with company, among candidates without a conflicting email:
 *       {@link MatchConfidence#MEDIUM}</li>
 * </ol>
 * Several contacts hitting the same step yield {@link MatchConfidence#LOW} with the most
 * recently active of them; nothing qualifying yields {@link MatchConfidence#NONE}.
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    /**
     * Most recently active first: last activity, then creation time, then id. Nulls last.
     */
    static final Comparator<Contact> MOST_RECENTLY_ACTIVE =
            Comparator.comparing(Contact::getLastActivityDate,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(Contact::getCreatedAt,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(Contact::getId);

    private final MatchingPolicy policy;
    private final ContactSimilarityScorer scorer;

    public IdentityResolver(MatchingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.scorer = new ContactSimilarityScorer(policy);
    }

    /**
     * Resolves against candidates read from the given source.
     *
     * @throws LookupException if the source fails or returns no pool
     */
    public MatchResult resolve(NormalizedRecord record, CandidateSource source) {
        Objects.requireNonNull(source, "source is required");
        Collection<Contact> pool;
        try {
            pool = source.findCandidates(record);
        } catch (LookupException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LookupException("Candidate lookup failed for " + record.reference(), e);
        }
        return resolve(record, pool);
    }

    /**
     * Resolves against an already-fetched candidate pool.
     *
     * @throws LookupException if the pool is null
     */
    public MatchResult resolve(NormalizedRecord record, Collection<Contact> pool) {
        Objects.requireNonNull(record, "record is required");
        if (pool == null) {
            throw new LookupException("Candidate pool unavailable for " + record.reference());
        }
        List<Contact> candidates = pool.stream().filter(Objects::nonNull).toList();
        log.debug("resolve.start ref={} candidates={}", record.reference(), candidates.size());

        MatchResult result = decide(record, candidates);
        log.debug("resolve.decided ref={} confidence={} contactId={} reason={}",
                record.reference(), result.confidence(),
                result.hasMatch() ? result.contact().getId() : null, result.reason());
        return result;
    }

    private MatchResult decide(NormalizedRecord record, List<Contact> candidates) {
        if (candidates.isEmpty()) {
            return MatchResult.noMatch("no candidates");
        }

        if (record.hasEmail()) {
            List<Contact> exact = matching(candidates, c -> scorer.emailExact(record.email(), c.getEmail()));
            if (!exact.isEmpty()) {
                return single(exact, MatchConfidence.EXACT, "email exact match");
            }

            List<Contact> alias = matching(candidates,
                    c -> scorer.emailAliasEquivalent(record.email(), c.getEmail()));
            if (!alias.isEmpty()) {
                return single(alias, MatchConfidence.HIGH, "email alias match");
            }
        }

        if (record.hasPhone()) {
            List<Contact> phone = matching(candidates, c -> scorer.phoneExact(record.phone(), c.getPhone())
                    && (!c.hasName() || scorer.nameFuzzy(record.nameKey(), c.getName())
                    >= policy.getPhoneNameThreshold()));
            if (!phone.isEmpty()) {
                return single(phone, MatchConfidence.HIGH, "phone match corroborated by name");
            }
        }

        if (record.hasName()) {
            return fuzzyName(record, candidates);
        }
        return MatchResult.noMatch("no identity signal matched");
    }

    private MatchResult fuzzyName(NormalizedRecord record, List<Contact> candidates) {
        double bestScore = -1.0;
        List<Contact> best = new ArrayList<>();

        for (Contact candidate : candidates) {
            if (emailsConflict(record.email(), candidate.getEmail())) {
                continue;
            }
            double score = scorer.nameFuzzy(record.nameKey(), candidate.getName());
            if (!qualifies(score, record, candidate)) {
                continue;
            }
            if (score > bestScore) {
                bestScore = score;
                best.clear();
                best.add(candidate);
            } else if (score == bestScore) {
                best.add(candidate);
            }
        }

        if (best.isEmpty()) {
            return MatchResult.noMatch("no candidate above name threshold");
        }
        String reason = bestScore >= policy.getNameMatchThreshold()
                ? "name match"
                : "name match corroborated by company";
        if (best.size() > 1) {
            return ambiguous(best, reason, bestScore);
        }
        return MatchResult.of(best.get(0), MatchConfidence.MEDIUM,
                String.format("%s (score %.2f)", reason, bestScore), bestScore);
    }

    private boolean qualifies(double score, NormalizedRecord record, Contact candidate) {
        if (score >= policy.getNameMatchThreshold()) {
            return true;
        }
        return score >= policy.getNameWithCompanyThreshold()
                && scorer.companyFuzzy(record.company(), candidate.getCompany())
                >= policy.getCompanyMatchThreshold();
    }

    private static boolean emailsConflict(String a, String b) {
        return a != null && b != null && !a.equalsIgnoreCase(b);
    }

    private static List<Contact> matching(List<Contact> candidates, Predicate<Contact> predicate) {
        return candidates.stream().filter(predicate).toList();
    }

    private static MatchResult single(List<Contact> hits, MatchConfidence confidence, String reason) {
        if (hits.size() > 1) {
            return ambiguous(hits, reason, 1.0);
        }
        return MatchResult.of(hits.get(0), confidence, reason);
    }

    private static MatchResult ambiguous(List<Contact> hits, String reason, double score) {
        List<Contact> ordered = hits.stream().sorted(MOST_RECENTLY_ACTIVE).toList();
        String ids = ordered.stream().map(Contact::getId).collect(Collectors.joining(", "));
        log.info("resolve.ambiguous matches={} signal=\"{}\" ids=[{}]", ordered.size(), reason, ids);
        return MatchResult.of(ordered.get(0), MatchConfidence.LOW,
                String.format("ambiguous %s: %d contacts [%s]", reason, ordered.size(), ids), score);
    }
}
