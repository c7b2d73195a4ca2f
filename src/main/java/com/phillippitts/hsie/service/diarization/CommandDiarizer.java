package com.phillippitts.hsie.service.diarization;

import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.WordTiming;
import com.phillippitts.hsie.exception.DiarizationException;
import com.phillippitts.hsie.service.process.ExternalProcessException;
import com.phillippitts.hsie.service.process.ExternalProcessRunner;
import com.phillippitts.hsie.service.process.ProcessResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Diarizer backed by an external process.
 *
 * <p>Request on stdin:
 * <pre>
 * {"audio": "/abs/path.wav", "format": "wav", "duration": 12.5,
 *  "words": [{"index": 0, "text": "...", "start": 0.0, "end": 0.4}, ...]}
 * </pre>
 * Response on stdout, either {@code {"turns": [...]}} or a bare array of
 * {@code {"start", "end", "speaker", "confidence"}}.
 */
public class CommandDiarizer implements Diarizer {

    private static final Logger LOG = LogManager.getLogger(CommandDiarizer.class);

    private static final int MAX_STDOUT_BYTES = 4 * 1024 * 1024;

    private final List<String> command;
    private final Duration timeout;
    private final ExternalProcessRunner runner;

    public CommandDiarizer(List<String> command, Duration timeout, ExternalProcessRunner runner) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Diarizer command must not be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    @Override
    public List<SpeakerTurn> diarize(RawPayload raw) {
        ProcessResult result;
        try {
            result = runner.run(command, null, request(raw).toString(), timeout, MAX_STDOUT_BYTES);
        } catch (ExternalProcessException e) {
            throw new DiarizationException("Diarizer failed: " + e.getMessage()
                    + (e.getStderrSnippet().isEmpty() ? "" : " (stderr=" + e.getStderrSnippet() + ")"), null, e);
        }
        List<SpeakerTurn> turns = parseTurns(result.stdout());
        LOG.debug("Diarizer returned {} turns in {}ms", turns.size(), result.durationMs());
        return turns;
    }

    @Override
    public String name() {
        return "command:" + command.get(0);
    }

    static JSONObject request(RawPayload raw) {
        JSONObject req = new JSONObject();
        req.put("audio", raw.source().uri());
        if (raw.source().format() != null) {
            req.put("format", raw.source().format());
        }
        if (raw.source().duration() != null) {
            req.put("duration", raw.source().duration());
        }
        JSONArray words = new JSONArray();
        for (WordTiming w : raw.words()) {
            JSONObject jw = new JSONObject();
            jw.put("index", w.index());
            jw.put("text", w.text());
            jw.put("start", w.start());
            jw.put("end", w.end());
            words.put(jw);
        }
        req.put("words", words);
        return req;
    }

    static List<SpeakerTurn> parseTurns(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            throw new DiarizationException("Diarizer produced no output", null);
        }
        try {
            String trimmed = stdout.trim();
            JSONArray arr = trimmed.startsWith("[")
                    ? new JSONArray(trimmed)
                    : new JSONObject(trimmed).getJSONArray("turns");
            List<SpeakerTurn> turns = new ArrayList<>(arr.length());
            for (int i = 0; i < arr.length(); i++) {
                JSONObject t = arr.getJSONObject(i);
                turns.add(new SpeakerTurn(
                        t.getDouble("start"),
                        t.getDouble("end"),
                        t.getString("speaker"),
                        t.optDouble("confidence", 1.0)));
            }
            return turns;
        } catch (JSONException | IllegalArgumentException e) {
            throw new DiarizationException("Malformed diarizer output: " + e.getMessage(), null, e);
        }
    }
}
