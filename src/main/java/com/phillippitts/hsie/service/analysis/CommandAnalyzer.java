package com.phillippitts.hsie.service.analysis;

import com.phillippitts.hsie.domain.AnalysisFailure;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.exception.PartialAnalysisException;
import com.phillippitts.hsie.service.process.ExternalProcessException;
import com.phillippitts.hsie.service.process.ExternalProcessRunner;
import com.phillippitts.hsie.service.process.ProcessResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Analyzer backed by an external scorer process, one process per call.
 *
 * <p>Request on stdin:
 * <pre>
 * {"dimension": "acoustic", "version": "v1", "language": "ja",
 *  "segment": {"index", "start", "end", "speaker_id", "text"},
 *  "audio": {"uri", "format", "sha256"}}
 * </pre>
 * Response on stdout: {@code {"value": 0.42, "confidence": 0.9}}.
 */
public class CommandAnalyzer implements Analyzer {

    private static final Logger LOG = LogManager.getLogger(CommandAnalyzer.class);

    private static final int MAX_STDOUT_BYTES = 64 * 1024;

    private final AnalyzerKind kind;
    private final String version;
    private final List<String> command;
    private final Duration timeout;
    private final ExternalProcessRunner runner;

    public CommandAnalyzer(AnalyzerKind kind, String version, List<String> command, Duration timeout,
                           ExternalProcessRunner runner) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.version = Objects.requireNonNull(version, "version");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Analyzer command for " + kind + " must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.runner = Objects.requireNonNull(runner, "runner");
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
        int segment = target.segment().index();
        ProcessResult result;
        try {
            result = runner.run(command, null, request(target).toString(), timeout, MAX_STDOUT_BYTES);
        } catch (ExternalProcessException e) {
            String reason = e.getFailure() == ExternalProcessException.Failure.TIMEOUT
                    ? AnalysisFailure.TIMEOUT
                    : AnalysisFailure.ANALYZER_ERROR;
            throw new PartialAnalysisException(e.getMessage(), segment, kind, reason, null, e);
        }
        LOG.debug("{} scored segment {} in {}ms", kind, segment, result.durationMs());
        return parse(result.stdout(), segment);
    }

    JSONObject request(ScoringTarget target) {
        Segment s = target.segment();
        JSONObject seg = new JSONObject();
        seg.put("index", s.index());
        seg.put("start", s.start());
        seg.put("end", s.end());
        seg.put("speaker_id", s.speakerId());
        seg.put("text", s.text());

        JSONObject req = new JSONObject();
        req.put("dimension", kind.name().toLowerCase());
        req.put("version", version);
        if (target.language() != null) {
            req.put("language", target.language());
        }
        req.put("segment", seg);
        if (target.source() != null) {
            JSONObject audio = new JSONObject();
            audio.put("uri", target.source().uri());
            audio.put("format", target.source().format());
            audio.put("sha256", target.source().sha256());
            req.put("audio", audio);
        }
        return req;
    }

    private AnalyzerScore parse(String stdout, int segment) {
        try {
            JSONObject obj = new JSONObject(stdout.trim());
            return new AnalyzerScore(obj.getDouble("value"), obj.optDouble("confidence", 1.0));
        } catch (JSONException e) {
            throw new PartialAnalysisException("Malformed " + kind + " scorer output: " + e.getMessage(),
                    segment, kind, AnalysisFailure.ANALYZER_ERROR, null, e);
        }
    }
}
