package com.phillippitts.hsie.config.analysis;

import com.phillippitts.hsie.domain.AnalyzerKind;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed properties for the Analysis Stage.
 *
 * <pre>
 * hsie.analysis.analyzer-set=acoustic,semantic,linguistic
 * hsie.analysis.analyzer-versions.acoustic=prosody-v2
 * hsie.analysis.commands.acoustic=python3,scorers/acoustic.py
 * hsie.analysis.call-timeout-ms=30000
 * </pre>
 * Each configured command registers a {@code CommandAnalyzer} under the version given for its
 * dimension (or {@code "default"}).
 */
@Validated
@ConfigurationProperties(prefix = "hsie.analysis")
public class AnalysisProperties {

    static final String DEFAULT_VERSION = "default";

    /** Dimensions scored when the caller does not name any. */
    private final List<AnalyzerKind> analyzerSet;

    /** Analyzer version per dimension. */
    private final Map<AnalyzerKind, String> analyzerVersions;

    /** External scorer command line per dimension. */
    private final Map<AnalyzerKind, List<String>> commands;

    /** Per (segment, analyzer) call timeout. */
    @Min(1)
    private final long callTimeoutMs;

    @ConstructorBinding
    public AnalysisProperties(List<AnalyzerKind> analyzerSet, Map<AnalyzerKind, String> analyzerVersions,
                              Map<AnalyzerKind, List<String>> commands, Long callTimeoutMs) {
        this.analyzerSet = analyzerSet == null || analyzerSet.isEmpty()
                ? Arrays.asList(AnalyzerKind.values())
                : List.copyOf(analyzerSet);
        Map<AnalyzerKind, String> versions = new EnumMap<>(AnalyzerKind.class);
        if (analyzerVersions != null) {
            versions.putAll(analyzerVersions);
        }
        this.analyzerVersions = Collections.unmodifiableMap(versions);
        Map<AnalyzerKind, List<String>> cmds = new EnumMap<>(AnalyzerKind.class);
        if (commands != null) {
            commands.forEach((k, v) -> {
                if (v != null && !v.isEmpty()) {
                    cmds.put(k, List.copyOf(v));
                }
            });
        }
        this.commands = Collections.unmodifiableMap(cmds);
        this.callTimeoutMs = callTimeoutMs == null ? 30_000L : callTimeoutMs;
    }

    public List<AnalyzerKind> getAnalyzerSet() {
        return analyzerSet;
    }

    public Map<AnalyzerKind, String> getAnalyzerVersions() {
        return analyzerVersions;
    }

    public Map<AnalyzerKind, List<String>> getCommands() {
        return commands;
    }

    public long getCallTimeoutMs() {
        return callTimeoutMs;
    }

    /**
     * @return configured version for a dimension, or {@code "default"}
     */
    public String versionOf(AnalyzerKind kind) {
        return analyzerVersions.getOrDefault(kind, DEFAULT_VERSION);
    }
}
