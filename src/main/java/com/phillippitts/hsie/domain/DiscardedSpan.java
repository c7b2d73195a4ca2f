package com.phillippitts.hsie.domain;

import java.util.Objects;

/**
 * Raw word span explicitly excluded from segmentation, with the reason.
 */
public record DiscardedSpan(int word, double start, double end, String text, DiscardReason reason) {

    public DiscardedSpan {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
