package com.contact.resolution.resolve;

import com.contact.resolution.config.MatchingPolicy;
import com.contact.resolution.core.model.Contact;
import com.contact.resolution.core.model.MatchConfidence;
import com.contact.resolution.core.model.MatchResult;
import com.contact.resolution.core.model.NormalizedRecord;
import com.contact.resolution.core.model.RawContactRecord;
import com.contact.resolution.core.model.SourcePlatform;
import com.contact.resolution.rules.ContactNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("IdentityResolver Tests")
class IdentityResolverTest {

    private final MatchingPolicy policy = MatchingPolicy.defaults();
    private final ContactNormalizer normalizer = new ContactNormalizer(policy);
    private final IdentityResolver resolver = new IdentityResolver(policy);

    private NormalizedRecord record(RawContactRecord.Builder builder) {
        return normalizer.normalize(builder.build());
    }

    private static RawContactRecord.Builder raw(SourcePlatform platform) {
        return RawContactRecord.builder().sourcePlatform(platform);
    }

    @Nested
    @DisplayName("Email signals")
    class EmailSignals {

        @Test
        @DisplayName("Exact email resolves EXACT")
        void exactEmail() {
            Contact existing = Contact.builder().email("j@x.com").leadSource(SourcePlatform.CLOSE).build();

            MatchResult result = resolver.resolve(
                    record(raw(SourcePlatform.CALENDLY).email("J@X.com").phone("555-0100")), List.of(existing));

            assertEquals(MatchConfidence.EXACT, result.confidence());
            assertSame(existing, result.contact());
            assertTrue(result.allowsMerge());
        }

        @Test
        @DisplayName("Different emails without other signals resolve NONE")
        void differentEmails() {
            Contact existing = Contact.builder().email("a@x.com").build();

            MatchResult result = resolver.resolve(record(raw(SourcePlatform.TYPEFORM).email("b@x.com")),
                    List.of(existing));

            assertEquals(MatchConfidence.NONE, result.confidence());
            assertFalse(result.hasMatch());
        }

        @Test
        @DisplayName("Consumer plus-address never resolves above LOW")
        void consumerPlusAddress() {
            Contact existing = Contact.builder().name("Jane Doe").email("jane@gmail.com").build();

            MatchResult withoutName = resolver.resolve(
                    record(raw(SourcePlatform.TYPEFORM).email("jane+newsletter@gmail.com")), List.of(existing));
            MatchResult withName = resolver.resolve(
                    record(raw(SourcePlatform.TYPEFORM).email("jane+newsletter@gmail.com").name("Jane Doe")),
                    List.of(existing));

            assertFalse(withoutName.confidence().isAtLeast(MatchConfidence.MEDIUM));
            assertFalse(withName.confidence().isAtLeast(MatchConfidence.MEDIUM));
        }

        @Test
        @DisplayName("Allow-listed alias resolves HIGH")
        void allowListedAlias() {
            IdentityResolver aliasResolver = new IdentityResolver(MatchingPolicy.builder(policy)
                    .aliasDomains(List.of("acme.com"))
                    .build());
            Contact existing = Contact.builder().email("jane@acme.com").build();

            MatchResult result = aliasResolver.resolve(record(raw(SourcePlatform.CLOSE).email("jane+demo@acme.com")),
                    List.of(existing));

            assertEquals(MatchConfidence.HIGH, result.confidence());
            assertSame(existing, result.contact());
        }
    }

    @Nested
    @DisplayName("Phone signal")
    class PhoneSignal {

        @Test
        @DisplayName("Phone corroborated by name resolves HIGH")
        void phoneAndName() {
            Contact existing = Contact.builder().name("John Smith").phone("(415) 555-0100").build();

            MatchResult result = resolver.resolve(
                    record(raw(SourcePlatform.CALENDLY).name("J. Smith").phone("+1 415 555 0100")),
                    List.of(existing));

            assertEquals(MatchConfidence.HIGH, result.confidence());
        }

        @Test
        @DisplayName("Phone alone matches a nameless contact")
        void phoneNamelessContact() {
            Contact existing = Contact.builder().phone("4155550100").build();

            MatchResult result = resolver.resolve(record(raw(SourcePlatform.CLOSE).phone("415-555-0100")),
                    List.of(existing));

            assertEquals(MatchConfidence.HIGH, result.confidence());
        }

        @Test
        @DisplayName("Shared phone with a different name does not match")
        void sharedPhoneDifferentName() {
            Contact existing = Contact.builder().name("Alice Wong").phone("4155550100").build();

            MatchResult result = resolver.resolve(
                    record(raw(SourcePlatform.CLOSE).name("Bob Jones").phone("415-555-0100")), List.of(existing));

            assertEquals(MatchConfidence.NONE, result.confidence());
        }
    }

    @Nested
    @DisplayName("Name signal")
    class NameSignal {

        @Test
        @DisplayName("Nickname resolves MEDIUM")
        void nickname() {
            Contact existing = Contact.builder().name("William Carter").build();

            MatchResult result = resolver.resolve(
                    record(raw(SourcePlatform.CLOSE).name("Bill Carter").company("Acme")), List.of(existing));

            assertEquals(MatchConfidence.MEDIUM, result.confidence());
            assertEquals(0.9, result.score(), 0.0001);
        }

        @Test
        @DisplayName("Weak name needs company corroboration")
        void weakNameWithCompany() {
            Contact existing = Contact.builder().name("John Smith").company("Acme Corp").build();

            MatchResult withCompany = resolver.resolve(
                    record(raw(SourcePlatform.TYPEFORM).name("John").company("Acme")), List.of(existing));
            MatchResult withoutCompany = resolver.resolve(
                    record(raw(SourcePlatform.TYPEFORM).name("John")), List.of(existing));

            assertEquals(MatchConfidence.MEDIUM, withCompany.confidence());
            assertEquals(MatchConfidence.NONE, withoutCompany.confidence());
        }

        @Test
        @DisplayName("Conflicting email blocks a name match")
        void conflictingEmailBlocksName() {
            Contact existing = Contact.builder().name("Jane Doe").email("jane@acme.com").build();

            MatchResult result = resolver.resolve(
                    record(raw(SourcePlatform.TYPEFORM).name("Jane Doe").email("jane@globex.com")),
                    List.of(existing));

            assertEquals(MatchConfidence.NONE, result.confidence());
        }
    }

    @Nested
    @DisplayName("Ambiguity")
    class Ambiguity {

        @Test
        @DisplayName("Two exact email hits resolve LOW with the most recently active")
        void duplicateEmails() {
            Contact older = Contact.builder().email("j@x.com")
                    .lastActivityDate(Instant.parse("2024-01-01T00:00:00Z")).build();
            Contact newer = Contact.builder().email("j@x.com")
                    .lastActivityDate(Instant.parse("2024-06-01T00:00:00Z")).build();

            MatchResult result = resolver.resolve(record(raw(SourcePlatform.CLOSE).email("j@x.com")),
                    List.of(older, newer));

            assertEquals(MatchConfidence.LOW, result.confidence());
            assertSame(newer, result.contact());
            assertFalse(result.allowsMerge());
            assertTrue(result.requiresReview());
            assertTrue(result.reason().contains(older.getId()));
        }

        @Test
        @DisplayName("Tied name scores resolve LOW")
        void tiedNames() {
            Contact a = Contact.builder().name("Jane Doe").build();
            Contact b = Contact.builder().name("Jane Doe").build();

            MatchResult result = resolver.resolve(record(raw(SourcePlatform.CLOSE).name("Jane Doe")), List.of(a, b));

            assertEquals(MatchConfidence.LOW, result.confidence());
        }

        @Test
        @DisplayName("Ordering prefers activity, then creation time")
        void ordering() {
            Contact noActivity = Contact.builder().createdAt(Instant.parse("2024-05-01T00:00:00Z")).build();
            Contact active = Contact.builder().createdAt(Instant.parse("2023-01-01T00:00:00Z"))
                    .lastActivityDate(Instant.parse("2024-01-01T00:00:00Z")).build();

            List<Contact> sorted = List.of(noActivity, active).stream()
                    .sorted(IdentityResolver.MOST_RECENTLY_ACTIVE).toList();

            assertSame(active, sorted.get(0));
        }
    }

    @Nested
    @DisplayName("Candidate lookup")
    class Lookup {

        @Test
        @DisplayName("Empty pool resolves NONE")
        void emptyPool() {
            MatchResult result = resolver.resolve(record(raw(SourcePlatform.CLOSE).email("a@b.com")), List.of());
            assertEquals(MatchConfidence.NONE, result.confidence());
        }

        @Test
        @DisplayName("Unavailable pool raises LookupException")
        void nullPool() {
            NormalizedRecord record = record(raw(SourcePlatform.CLOSE).email("a@b.com"));
            assertThrows(LookupException.class, () -> resolver.resolve(record, (Collection<Contact>) null));
        }

        @Test
        @DisplayName("Failing source raises LookupException, never NONE")
        void failingSource() {
            CandidateSource source = mock(CandidateSource.class);
            when(source.findCandidates(any())).thenThrow(new IllegalStateException("store offline"));
            NormalizedRecord record = record(raw(SourcePlatform.CLOSE).email("a@b.com"));

            LookupException e = assertThrows(LookupException.class, () -> resolver.resolve(record, source));

            assertInstanceOf(IllegalStateException.class, e.getCause());
            verify(source).findCandidates(record);
        }
    }
}
