package com.contact.resolution.attribution;

/**
 * How a deal's credit is assigned to the touchpoints before it.
 */
public enum AttributionModel {
    /**
     * The last meeting before the deal is the primary touchpoint.
     */
    LAST_TOUCH("last-touch"),

    /**
     * No meeting preceded the deal; credit is spread over the ordered touchpoints.
     */
    MULTI_TOUCH("multi-touch");

    private final String tag;

    AttributionModel(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
