package com.contact.resolution.config;

import com.contact.resolution.core.model.ContactField;
import com.contact.resolution.core.model.SourcePlatform;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link MatchingPolicy} from JSON.
 *
 * <pre>
 * {
 *   "freeMailDomains": ["gmail.com", "yahoo.com"],
 *   "aliasDomains": ["acme.com"],
 *   "dotInsensitiveDomains": [],
 *   "nicknames": [["william", "bill", "will"], ["robert", "bob", "rob"]],
 *   "thresholds": {"nameMatch": 0.75, "nameWithCompany": 0.5, "companyMatch": 0.5, "phoneName": 0.5},
 *   "authoritativeSources": {"TITLE": ["close"]}
 * }
 * </pre>
 * Omitted sections keep the builder defaults.
 */
public final class MatchingPolicyLoader {
    private static final Logger log = LoggerFactory.getLogger(MatchingPolicyLoader.class);

    static final String DEFAULT_RESOURCE = "/matching-policy.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MatchingPolicyLoader() {
    }

    /**
     * Loads the policy bundled on the classpath.
     */
    public static MatchingPolicy loadDefaults() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static MatchingPolicy loadResource(String resource) {
        try (InputStream in = MatchingPolicyLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Matching policy resource not found: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read matching policy " + resource, e);
        }
    }

    public static MatchingPolicy load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read matching policy " + path, e);
        }
    }

    public static MatchingPolicy load(InputStream in) throws IOException {
        PolicyDocument doc = MAPPER.readValue(in, PolicyDocument.class);
        MatchingPolicy policy = toPolicy(doc);
        log.info("policy.loaded {}", policy);
        return policy;
    }

    static MatchingPolicy toPolicy(PolicyDocument doc) {
        MatchingPolicy.Builder builder = MatchingPolicy.builder();
        if (doc.freeMailDomains() != null) {
            builder.freeMailDomains(doc.freeMailDomains());
        }
        if (doc.aliasDomains() != null) {
            builder.aliasDomains(doc.aliasDomains());
        }
        if (doc.dotInsensitiveDomains() != null) {
            builder.dotInsensitiveDomains(doc.dotInsensitiveDomains());
        }
        if (doc.nicknames() != null) {
            builder.nicknames(NicknameTable.of(doc.nicknames()));
        }
        Thresholds thresholds = doc.thresholds();
        if (thresholds != null) {
            if (thresholds.nameMatch() != null) {
                builder.nameMatchThreshold(thresholds.nameMatch());
            }
            if (thresholds.nameWithCompany() != null) {
                builder.nameWithCompanyThreshold(thresholds.nameWithCompany());
            }
            if (thresholds.companyMatch() != null) {
                builder.companyMatchThreshold(thresholds.companyMatch());
            }
            if (thresholds.phoneName() != null) {
                builder.phoneNameThreshold(thresholds.phoneName());
            }
        }
        if (doc.authoritativeSources() != null) {
            doc.authoritativeSources().forEach((field, tags) -> {
                ContactField contactField = ContactField.valueOf(field.trim().toUpperCase(Locale.ROOT));
                builder.authoritativeSources(contactField,
                        tags.stream().map(SourcePlatform::fromTag).toList());
            });
        }
        return builder.build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PolicyDocument(
            List<String> freeMailDomains,
            List<String> aliasDomains,
            List<String> dotInsensitiveDomains,
            List<List<String>> nicknames,
            Thresholds thresholds,
            Map<String, List<String>> authoritativeSources
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Thresholds(
            Double nameMatch,
            Double nameWithCompany,
            Double companyMatch,
            Double phoneName
    ) {}
}
