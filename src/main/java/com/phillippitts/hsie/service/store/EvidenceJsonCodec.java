package com.phillippitts.hsie.service.store;

import com.phillippitts.hsie.domain.AnalysisFailure;
import com.phillippitts.hsie.domain.AnalysisResult;
import com.phillippitts.hsie.domain.AnalyzedPayload;
import com.phillippitts.hsie.domain.AnalyzerKind;
import com.phillippitts.hsie.domain.AudioSource;
import com.phillippitts.hsie.domain.CaptureInfo;
import com.phillippitts.hsie.domain.DiarizationInfo;
import com.phillippitts.hsie.domain.DimensionOutcome;
import com.phillippitts.hsie.domain.DiscardReason;
import com.phillippitts.hsie.domain.DiscardedSpan;
import com.phillippitts.hsie.domain.Evidence;
import com.phillippitts.hsie.domain.EvidencePayload;
import com.phillippitts.hsie.domain.HsiContribution;
import com.phillippitts.hsie.domain.HsiScore;
import com.phillippitts.hsie.domain.PauseLevel;
import com.phillippitts.hsie.domain.PreprocessedPayload;
import com.phillippitts.hsie.domain.RawPayload;
import com.phillippitts.hsie.domain.ScoredPayload;
import com.phillippitts.hsie.domain.Segment;
import com.phillippitts.hsie.domain.SegmentAnalysis;
import com.phillippitts.hsie.domain.TranscriptChunk;
import com.phillippitts.hsie.domain.VersionKind;
import com.phillippitts.hsie.domain.WeightingConfig;
import com.phillippitts.hsie.domain.WordTiming;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converts Evidence to and from the persisted JSON schema
 * {@code {id, version_kind, parent_id, created_at, producer, payload}}.
 *
 * <p>Field names are snake_case. Optional fields are omitted when absent and tolerated when
 * missing on read, so documents written by older versions stay readable. Unknown fields are
 * ignored.
 *
 * <p>{@code version_kind} is one of {@code Raw}, {@code Preprocessed}, {@code Analyzed} and
 * {@code Scored}. {@code Scored} extends the three-layer transcript chain: it is always a child of
 * an {@code Analyzed} document and carries the HSI/HSIE result together with the weighting that
 * produced it.
 */
public final class EvidenceJsonCodec {

    static final String STATUS_OK = "ok";
    static final String STATUS_FAILED = "failed";

    private EvidenceJsonCodec() {}

    // ---------------------------------------------------------------- Evidence

    public static JSONObject toJson(Evidence evidence) {
        JSONObject obj = new JSONObject();
        obj.put("id", evidence.id());
        obj.put("version_kind", evidence.versionKind().wireName());
        obj.put("parent_id", evidence.parentId() == null ? JSONObject.NULL : evidence.parentId());
        obj.put("created_at", evidence.createdAt().toString());
        obj.put("producer", evidence.producer());
        obj.put("payload", payloadToJson(evidence.payload()));
        return obj;
    }

    /**
     * @throws IllegalArgumentException if the document does not follow the schema
     */
    public static Evidence fromJson(JSONObject obj) {
        try {
            VersionKind kind = VersionKind.fromWireName(obj.getString("version_kind"));
            String parentId = obj.isNull("parent_id") ? null : obj.getString("parent_id");
            return new Evidence(
                    obj.getString("id"),
                    kind,
                    parentId,
                    Instant.parse(obj.getString("created_at")),
                    obj.getString("producer"),
                    payloadFromJson(kind, obj.getJSONObject("payload")));
        } catch (JSONException | java.time.format.DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed Evidence document: " + e.getMessage(), e);
        }
    }

    public static Evidence parse(String json) {
        try {
            return fromJson(new JSONObject(json));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed Evidence document: " + e.getMessage(), e);
        }
    }

    /**
     * Canonical content the Evidence id is computed from. Audit metadata (creation time and
     * producer) is not part of it.
     */
    public static String contentOf(VersionKind kind, String parentId, EvidencePayload payload) {
        JSONObject content = new JSONObject();
        content.put("version_kind", kind.wireName());
        content.put("parent_id", parentId == null ? JSONObject.NULL : parentId);
        content.put("payload", payloadToJson(payload));
        return CanonicalJson.write(content);
    }

    /**
     * Canonical rendering of a whole document, used when writing to disk.
     */
    public static String canonical(Evidence evidence) {
        return CanonicalJson.write(toJson(evidence));
    }

    // ---------------------------------------------------------------- payloads

    public static JSONObject payloadToJson(EvidencePayload payload) {
        if (payload instanceof RawPayload raw) {
            return rawToJson(raw);
        } else if (payload instanceof PreprocessedPayload pre) {
            return preprocessedToJson(pre);
        } else if (payload instanceof AnalyzedPayload analyzed) {
            return analyzedToJson(analyzed);
        } else if (payload instanceof ScoredPayload scored) {
            return scoredToJson(scored);
        }
        throw new IllegalArgumentException("Unsupported payload type: " + payload.getClass().getName());
    }

    static EvidencePayload payloadFromJson(VersionKind kind, JSONObject obj) {
        return switch (kind) {
            case RAW -> rawFromJson(obj);
            case PREPROCESSED -> preprocessedFromJson(obj);
            case ANALYZED -> analyzedFromJson(obj);
            case SCORED -> scoredFromJson(obj);
        };
    }

    // Raw

    private static JSONObject rawToJson(RawPayload raw) {
        JSONObject obj = new JSONObject();
        obj.put("transcript", raw.transcript());
        putOptional(obj, "language", raw.language());
        obj.put("overall_confidence", raw.overallConfidence());

        JSONArray words = new JSONArray();
        for (WordTiming w : raw.words()) {
            JSONObject jw = new JSONObject();
            jw.put("index", w.index());
            jw.put("text", w.text());
            jw.put("start", w.start());
            jw.put("end", w.end());
            putOptional(jw, "probability", w.probability());
            jw.put("chunk", w.chunk());
            words.put(jw);
        }
        obj.put("words", words);

        JSONArray chunks = new JSONArray();
        for (TranscriptChunk c : raw.chunks()) {
            JSONObject jc = new JSONObject();
            jc.put("index", c.index());
            jc.put("start", c.start());
            jc.put("end", c.end());
            jc.put("text", c.text());
            chunks.put(jc);
        }
        obj.put("chunks", chunks);

        AudioSource s = raw.source();
        JSONObject source = new JSONObject();
        source.put("uri", s.uri());
        putOptional(source, "format", s.format());
        source.put("sha256", s.sha256());
        source.put("size_bytes", s.sizeBytes());
        putOptional(source, "duration", s.duration());
        putOptional(source, "sample_rate", s.sampleRate());
        putOptional(source, "channels", s.channels());
        putOptional(source, "modified_at", s.modifiedAt() == null ? null : s.modifiedAt().toString());
        obj.put("source", source);

        CaptureInfo c = raw.capture();
        JSONObject capture = new JSONObject();
        capture.put("session_id", c.sessionId());
        capture.put("engine", c.engine());
        putOptional(capture, "model", c.model());
        capture.put("captured_by", c.capturedBy());
        obj.put("capture", capture);
        return obj;
    }

    private static RawPayload rawFromJson(JSONObject obj) {
        List<WordTiming> words = new ArrayList<>();
        JSONArray jw = obj.getJSONArray("words");
        for (int i = 0; i < jw.length(); i++) {
            JSONObject w = jw.getJSONObject(i);
            words.add(new WordTiming(
                    w.getInt("index"),
                    w.getString("text"),
                    w.getDouble("start"),
                    w.getDouble("end"),
                    optDouble(w, "probability"),
                    w.optInt("chunk", 0)));
        }
        List<TranscriptChunk> chunks = new ArrayList<>();
        JSONArray jc = obj.optJSONArray("chunks");
        if (jc != null) {
            for (int i = 0; i < jc.length(); i++) {
                JSONObject c = jc.getJSONObject(i);
                chunks.add(new TranscriptChunk(c.getInt("index"), c.getDouble("start"),
                        c.getDouble("end"), c.getString("text")));
            }
        }
        JSONObject s = obj.getJSONObject("source");
        String modifiedAt = s.optString("modified_at", null);
        AudioSource source = new AudioSource(
                s.getString("uri"),
                s.optString("format", null),
                s.getString("sha256"),
                s.optLong("size_bytes", 0L),
                optDouble(s, "duration"),
                s.has("sample_rate") ? s.getInt("sample_rate") : null,
                s.optString("channels", null),
                modifiedAt == null ? null : Instant.parse(modifiedAt));
        JSONObject c = obj.getJSONObject("capture");
        CaptureInfo capture = new CaptureInfo(
                c.getString("session_id"),
                c.getString("engine"),
                c.optString("model", null),
                c.getString("captured_by"));
        return new RawPayload(
                obj.getString("transcript"),
                obj.optString("language", null),
                obj.getDouble("overall_confidence"),
                words, chunks, source, capture);
    }

    // Preprocessed

    private static JSONObject preprocessedToJson(PreprocessedPayload pre) {
        JSONObject obj = new JSONObject();
        obj.put("source_start", pre.sourceStart());
        obj.put("source_end", pre.sourceEnd());
        JSONArray segments = new JSONArray();
        for (Segment s : pre.segments()) {
            JSONObject js = new JSONObject();
            js.put("index", s.index());
            js.put("start", s.start());
            js.put("end", s.end());
            js.put("speaker_id", s.speakerId());
            js.put("speaker_confidence", s.speakerConfidence());
            js.put("text", s.text());
            js.put("first_word", s.firstWord());
            js.put("last_word", s.lastWord());
            js.put("pause_before", s.pauseBefore());
            js.put("pause_level", s.pauseLevel().name());
            segments.put(js);
        }
        obj.put("segments", segments);
        JSONArray discarded = new JSONArray();
        for (DiscardedSpan d : pre.discarded()) {
            JSONObject jd = new JSONObject();
            jd.put("word", d.word());
            jd.put("start", d.start());
            jd.put("end", d.end());
            jd.put("text", d.text());
            jd.put("reason", d.reason().wireName());
            discarded.put(jd);
        }
        obj.put("discarded", discarded);
        JSONObject diarization = new JSONObject();
        diarization.put("diarizer", pre.diarization().diarizer());
        diarization.put("threshold", pre.diarization().threshold());
        obj.put("diarization", diarization);
        return obj;
    }

    private static PreprocessedPayload preprocessedFromJson(JSONObject obj) {
        List<Segment> segments = new ArrayList<>();
        JSONArray js = obj.getJSONArray("segments");
        for (int i = 0; i < js.length(); i++) {
            JSONObject s = js.getJSONObject(i);
            segments.add(new Segment(
                    s.getInt("index"),
                    s.getDouble("start"),
                    s.getDouble("end"),
                    s.getString("speaker_id"),
                    s.optDouble("speaker_confidence", 1.0),
                    s.getString("text"),
                    s.getInt("first_word"),
                    s.getInt("last_word"),
                    s.optDouble("pause_before", 0.0),
                    PauseLevel.valueOf(s.optString("pause_level", PauseLevel.NORMAL.name()))));
        }
        List<DiscardedSpan> discarded = new ArrayList<>();
        JSONArray jd = obj.optJSONArray("discarded");
        if (jd != null) {
            for (int i = 0; i < jd.length(); i++) {
                JSONObject d = jd.getJSONObject(i);
                discarded.add(new DiscardedSpan(d.getInt("word"), d.getDouble("start"), d.getDouble("end"),
                        d.getString("text"), DiscardReason.fromWireName(d.getString("reason"))));
            }
        }
        JSONObject dz = obj.getJSONObject("diarization");
        return new PreprocessedPayload(
                obj.getDouble("source_start"),
                obj.getDouble("source_end"),
                segments,
                discarded,
                new DiarizationInfo(dz.getString("diarizer"), dz.getDouble("threshold")));
    }

    // Analyzed

    private static JSONObject analyzedToJson(AnalyzedPayload analyzed) {
        JSONObject obj = new JSONObject();
        JSONObject set = new JSONObject();
        analyzed.analyzerSet().forEach((k, v) -> set.put(k.name(), v));
        obj.put("analyzer_set", set);

        JSONArray segments = new JSONArray();
        for (SegmentAnalysis sa : analyzed.segments()) {
            JSONObject js = new JSONObject();
            js.put("segment", sa.segment());
            js.put("start", sa.start());
            js.put("end", sa.end());
            js.put("speaker_id", sa.speakerId());
            JSONObject results = new JSONObject();
            sa.results().forEach((k, outcome) -> results.put(k.name(), outcomeToJson(outcome)));
            js.put("results", results);
            segments.put(js);
        }
        obj.put("segments", segments);
        return obj;
    }

    private static JSONObject outcomeToJson(DimensionOutcome outcome) {
        JSONObject o = new JSONObject();
        if (outcome instanceof AnalysisResult r) {
            o.put("status", STATUS_OK);
            o.put("value", r.value());
            o.put("confidence", r.confidence());
        } else if (outcome instanceof AnalysisFailure f) {
            o.put("status", STATUS_FAILED);
            o.put("error", AnalysisFailure.ERROR_KIND);
            o.put("reason", f.reason());
            o.put("message", f.message());
        } else {
            throw new IllegalArgumentException("Unsupported outcome type: " + outcome.getClass().getName());
        }
        o.put("analyzer_version", outcome.analyzerVersion());
        return o;
    }

    private static AnalyzedPayload analyzedFromJson(JSONObject obj) {
        Map<AnalyzerKind, String> set = new EnumMap<>(AnalyzerKind.class);
        JSONObject js = obj.getJSONObject("analyzer_set");
        for (String key : js.keySet()) {
            set.put(AnalyzerKind.parse(key), js.getString(key));
        }
        List<SegmentAnalysis> segments = new ArrayList<>();
        JSONArray arr = obj.getJSONArray("segments");
        for (int i = 0; i < arr.length(); i++) {
            JSONObject s = arr.getJSONObject(i);
            Map<AnalyzerKind, DimensionOutcome> results = new EnumMap<>(AnalyzerKind.class);
            JSONObject jr = s.getJSONObject("results");
            for (String key : jr.keySet()) {
                AnalyzerKind kind = AnalyzerKind.parse(key);
                results.put(kind, outcomeFromJson(kind, jr.getJSONObject(key)));
            }
            segments.add(new SegmentAnalysis(s.getInt("segment"), s.getDouble("start"), s.getDouble("end"),
                    s.getString("speaker_id"), results));
        }
        return new AnalyzedPayload(set, segments);
    }

    private static DimensionOutcome outcomeFromJson(AnalyzerKind kind, JSONObject o) {
        String version = o.getString("analyzer_version");
        if (STATUS_OK.equals(o.getString("status"))) {
            return new AnalysisResult(kind, o.getDouble("value"), o.getDouble("confidence"), version);
        }
        return new AnalysisFailure(kind, version, o.getString("reason"), o.optString("message", ""));
    }

    // Scored

    private static JSONObject scoredToJson(ScoredPayload scored) {
        HsiScore score = scored.score();
        JSONObject obj = new JSONObject();
        obj.put("hsi", score.hsi());
        obj.put("hsie", score.hsie());
        obj.put("dimension_weights", dimensionMap(score.dimensionWeights()));
        obj.put("segments_considered", score.segmentsConsidered());
        JSONArray components = new JSONArray();
        for (HsiContribution c : score.components()) {
            JSONObject jc = new JSONObject();
            jc.put("segment", c.segment());
            jc.put("dimension", c.dimension().name());
            jc.put("speaker_id", c.speakerId());
            jc.put("score", c.score());
            jc.put("weight", c.weight());
            jc.put("contribution", c.contribution());
            jc.put("escalation", c.escalation());
            components.put(jc);
        }
        obj.put("components", components);
        obj.put("weighting", weightingToJson(scored.weighting()));
        return obj;
    }

    public static JSONObject weightingToJson(WeightingConfig weighting) {
        JSONObject w = new JSONObject();
        w.put("weights", dimensionMap(weighting.weights()));
        w.put("escalation_step", weighting.escalationStep());
        w.put("escalation_cap", weighting.escalationCap());
        return w;
    }

    private static ScoredPayload scoredFromJson(JSONObject obj) {
        List<HsiContribution> components = new ArrayList<>();
        JSONArray arr = obj.getJSONArray("components");
        for (int i = 0; i < arr.length(); i++) {
            JSONObject c = arr.getJSONObject(i);
            components.add(new HsiContribution(
                    c.getInt("segment"),
                    AnalyzerKind.parse(c.getString("dimension")),
                    c.getString("speaker_id"),
                    c.getDouble("score"),
                    c.getDouble("weight"),
                    c.getDouble("contribution"),
                    c.optDouble("escalation", 1.0)));
        }
        HsiScore score = new HsiScore(
                obj.getDouble("hsi"),
                obj.getDouble("hsie"),
                dimensionMapFrom(obj.getJSONObject("dimension_weights")),
                obj.getInt("segments_considered"),
                components);
        JSONObject w = obj.getJSONObject("weighting");
        WeightingConfig weighting = new WeightingConfig(
                dimensionMapFrom(w.getJSONObject("weights")),
                w.getDouble("escalation_step"),
                w.getDouble("escalation_cap"));
        return new ScoredPayload(score, weighting);
    }

    // ---------------------------------------------------------------- helpers

    private static JSONObject dimensionMap(Map<AnalyzerKind, Double> map) {
        JSONObject obj = new JSONObject();
        map.forEach((k, v) -> obj.put(k.name(), v.doubleValue()));
        return obj;
    }

    private static Map<AnalyzerKind, Double> dimensionMapFrom(JSONObject obj) {
        Map<AnalyzerKind, Double> map = new EnumMap<>(AnalyzerKind.class);
        for (String key : obj.keySet()) {
            map.put(AnalyzerKind.parse(key), obj.getDouble(key));
        }
        return map;
    }

    private static void putOptional(JSONObject obj, String key, Object value) {
        if (value != null) {
            obj.put(key, value);
        }
    }

    private static Double optDouble(JSONObject obj, String key) {
        return obj.has(key) && !obj.isNull(key) ? obj.getDouble(key) : null;
    }
}
