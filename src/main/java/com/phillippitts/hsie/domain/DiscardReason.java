package com.phillippitts.hsie.domain;

/**
 * Why a Raw word span was not mapped to any segment.
 */
public enum DiscardReason {
    BLANK_TOKEN("blank_token"),
    NON_SPEECH_MARKER("non_speech_marker");

    private final String wireName;

    DiscardReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static DiscardReason fromWireName(String name) {
        for (DiscardReason r : values()) {
            if (r.wireName.equals(name)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown discard reason: " + name);
    }
}
