package com.contact.resolution.core.model;

/**
 * Scalar identity fields governed by the merge precedence policy.
 */
public enum ContactField {
    NAME,
    EMAIL,
    PHONE,
    COMPANY,
    TITLE
}
