package com.phillippitts.hsie.domain;

/**
 * Evidence version kinds in lineage order: {@code RAW < PREPROCESSED < ANALYZED < SCORED}.
 *
 * <p>A child Evidence must be of the kind immediately following its parent's kind. Only
 * {@link #RAW} Evidence has no parent.
 */
public enum VersionKind {
    RAW("Raw"),
    PREPROCESSED("Preprocessed"),
    ANALYZED("Analyzed"),
    SCORED("Scored");

    private final String wireName;

    VersionKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Name used in the Evidence JSON schema.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * @return true if this kind comes strictly before {@code other} in lineage order
     */
    public boolean precedes(VersionKind other) {
        return ordinal() < other.ordinal();
    }

    /**
     * @return the only kind a parent of this kind may have, or {@code null} for {@link #RAW}
     */
    public VersionKind requiredParentKind() {
        return this == RAW ? null : values()[ordinal() - 1];
    }

    public static VersionKind fromWireName(String name) {
        for (VersionKind kind : values()) {
            if (kind.wireName.equalsIgnoreCase(name) || kind.name().equalsIgnoreCase(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown version kind: " + name);
    }
}
