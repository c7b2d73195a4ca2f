package com.phillippitts.hsie.service.analysis;

/**
 * Raw output of an analyzer call. Not validated here: the Analysis Stage records values outside
 * [0, 1] as {@code out_of_range} failures instead of rejecting the whole call.
 *
 * @param value      score
 * @param confidence analyzer confidence in its own score
 */
public record AnalyzerScore(double value, double confidence) {
}
