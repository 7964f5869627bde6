package com.mlld.sdk.types.options;

/**
 * Parsing mode requested for a script or file.
 */
public enum ParseMode {
    STRICT("strict"),
    MARKDOWN("markdown");

    private final String value;

    ParseMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
