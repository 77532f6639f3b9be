package com.contact.resolution.rules;

import com.contact.resolution.config.MatchingPolicy;
import com.contact.resolution.core.model.NormalizedRecord;
import com.contact.resolution.core.model.RawContactRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw field values before any comparison.
 * Email is lowercased, phone reduced to comparison digits, names get a case-insensitive key,
 * and a company is derived from a business email domain when none was supplied.
 * Pure: the same raw record always yields the same normalized record.
 */
public class ContactNormalizer {
    private static final Logger log = LoggerFactory.getLogger(ContactNormalizer.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern NAME_KEY_STRIP = Pattern.compile("[.,]");
    private static final Pattern DOMAIN_SEPARATORS = Pattern.compile("[-_]+");

    private final MatchingPolicy policy;

    public ContactNormalizer(MatchingPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
    }

    /**
     * Normalizes a raw record.
     *
     * @throws ValidationException if the platform is missing or no name, email or phone is present
     */
    public NormalizedRecord normalize(RawContactRecord raw) {
        if (raw == null) {
            throw new ValidationException("record", "Record is required");
        }
        if (raw.sourcePlatform() == null) {
            throw new ValidationException("sourcePlatform", "Record " + raw.reference() + " has no source platform");
        }

        String email = normalizeEmail(raw.email());
        String phone = normalizePhone(raw.phone());
        String name = normalizeName(raw.name());
        String nameKey = nameKey(name);

        if (email == null && phone == null && nameKey == null) {
            throw new ValidationException("identity",
                    "Record " + raw.reference() + " has no name, email or phone");
        }

        String company = collapse(raw.company());
        boolean companyDerived = false;
        if (company == null && email != null) {
            company = companyFromEmail(email);
            companyDerived = company != null;
        }

        NormalizedRecord normalized = new NormalizedRecord(
                raw.sourcePlatform(),
                blankToNull(raw.sourceRecordId()),
                name,
                nameKey,
                email,
                phone,
                phone != null ? raw.phone().trim() : null,
                company,
                companyDerived,
                collapse(raw.title()),
                blankToNull(raw.notes() != null ? raw.notes().strip() : null),
                raw.createdAt(),
                raw.lastActivityDate(),
                blankToNull(raw.assignedOwner()),
                raw.events());

        log.debug("record.normalized ref={} email={} phone={} nameKey={} company={} derived={}",
                normalized.reference(), email, phone, nameKey, company, companyDerived);
        return normalized;
    }

    /**
     * Trims and lowercases. Blank input yields {@code null}.
     */
    public String normalizeEmail(String email) {
        if (email == null) {
            return null;
        }
        String trimmed = email.trim().toLowerCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Strips every non-digit. An 11-digit number with country code 1 drops the leading 1.
     */
    public String normalizePhone(String phone) {
        return phoneDigits(phone);
    }

    public static String phoneDigits(String phone) {
        if (phone == null) {
            return null;
        }
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            digits = digits.substring(1);
        }
        return digits.isEmpty() ? null : digits;
    }

    public String normalizeName(String name) {
        return collapse(name);
    }

    /**
     * Case-insensitive comparison key: lowercase, periods and commas removed, whitespace collapsed.
     */
    public String nameKey(String name) {
        if (name == null) {
            return null;
        }
        String key = NAME_KEY_STRIP.matcher(name.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return collapse(key);
    }

    /**
     * Derives a display company from a business email domain.
     * Returns {@code null} for free-mail domains and malformed addresses.
     */
    public String companyFromEmail(String email) {
        int at = email.lastIndexOf('@');
        if (at < 0 || at == email.length() - 1) {
            return null;
        }
        String domain = email.substring(at + 1);
        if (policy.isFreeMailDomain(domain)) {
            return null;
        }
        String[] labels = domain.split("\\.");
        if (labels.length < 2) {
            return null;
        }
        String label = DOMAIN_SEPARATORS.matcher(labels[labels.length - 2]).replaceAll(" ").trim();
        if (label.isEmpty()) {
            return null;
        }
        return titleCase(label);
    }

    static String titleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        for (String word : WHITESPACE.split(value)) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0)))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String collapse(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = WHITESPACE.matcher(value.trim()).replaceAll(" ");
        return collapsed.isEmpty() ? null : collapsed;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
