package com.phillippitts.hsie.domain;

/**
 * Closed set of analysis dimensions.
 */
public enum AnalyzerKind {
    ACOUSTIC,
    SEMANTIC,
    LINGUISTIC;

    public static AnalyzerKind parse(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
