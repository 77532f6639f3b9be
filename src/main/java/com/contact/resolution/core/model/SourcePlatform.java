package com.contact.resolution.core.model;

import java.util.Locale;

/**
 * External platform a contact record or touchpoint came from.
 */
public enum SourcePlatform {
    CLOSE("close"),
    CALENDLY("calendly"),
    TYPEFORM("typeform");

    private final String tag;

    SourcePlatform(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the lowercase tag used in lead-source lists (e.g. {@code calendly}).
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a platform from its tag, case-insensitively.
     *
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static SourcePlatform fromTag(String tag) {
        if (tag == null) {
            throw new IllegalArgumentException("Platform tag is required");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (SourcePlatform platform : values()) {
            if (platform.tag.equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform tag: " + tag);
    }
}
