package com.phillippitts.hsie.testutil;

import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.service.analysis.Analyzer;
import com.phillippitts.hsie.service.analysis.AnalyzerScore;
import com.phillippitts.hsie.service.analysis.ScoringTarget;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Analyzer whose behavior per target is supplied by the test. Records every target it scored.
 */
public class ScriptedAnalyzer implements Analyzer {

    private final AnalyzerKind kind;
    private final String version;
    private final Function<ScoringTarget, AnalyzerScore> behavior;
    private final AtomicInteger calls = new AtomicInteger();
    private final List<ScoringTarget> targets = new CopyOnWriteArrayList<>();

    public ScriptedAnalyzer(AnalyzerKind kind, String version, Function<ScoringTarget, AnalyzerScore> behavior) {
        this.kind = kind;
        this.version = version;
        this.behavior = behavior;
    }

    /**
     * Scores every segment with the same value and full confidence.
     */
    public static ScriptedAnalyzer constant(AnalyzerKind kind, double value) {
        return new ScriptedAnalyzer(kind, "v1", t -> new AnalyzerScore(value, 1.0));
    }

    @Override
    public AnalyzerKind kind() {
        return kind;
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public AnalyzerScore score(ScoringTarget target) {
        calls.incrementAndGet();
        targets.add(target);
        return behavior.apply(target);
    }

    public int calls() {
        return calls.get();
    }

    public List<ScoringTarget> targets() {
        return targets;
    }

    /**
     * Sleeps without swallowing interruption; for timeout and cancellation tests.
     */
    public static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        }
    }
}
