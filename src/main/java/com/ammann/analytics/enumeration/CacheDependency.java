package com.ammann.analytics.enumeration;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inputs a cached result depends on. Entries are tagged with the dependencies
 * they were computed from, so a change to one input can drop exactly the
 * results derived from it.
 */
public enum CacheDependency
{
    DATA("data"),
    TIME_RANGE("time"),
    PLATFORM("platform"),
    CONFIG("config");

    private final String tag;

    CacheDependency(String tag) {
        this.tag = tag;
    }

    /**
     * Tag of results computed for one platform, for example {@code platform:reddit}.
     * A {@code null} platform maps to the generic {@link #PLATFORM} tag.
     */
    public static String platform(String platform) {
        return platform == null ? PLATFORM.tag : PLATFORM.tag + ":" + platform;
    }

    @JsonValue
    public String getTag() { return tag; }
}
