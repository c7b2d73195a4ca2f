package com.phillippitts.hsie.service.transcription;

import com.phillippitts.hsie.domain.TranscriptChunk;
import com.phillippitts.hsie.domain.TranscriptResult;
import com.phillippitts.hsie.domain.WordTiming;
import com.phillippitts.hsie.exception.TranscriptionException;
import com.phillippitts.hsie.exception.TranscriptionFailureReason;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses whisper JSON output into a {@link TranscriptResult}.
 *
 * <p>Two layouts are accepted:
 * <ul>
 *   <li>openai-whisper: {@code {"text", "language", "segments":[{"start","end","text",
 *       "words":[{"word","start","end","probability"}]}]}}</li>
 *   <li>whisper.cpp full JSON: {@code {"result":{"language"}, "transcription":[{"offsets":{"from","to"},
 *       "text", "tokens":[{"text","offsets","p"}]}]}} with offsets in milliseconds; sub-word tokens
 *       are joined into words and special tokens ({@code [_...]}) are dropped</li>
 * </ul>
 *
 * <p>Unlike a best-effort parser, malformed output is an error: a transcript is either complete or
 * not produced. Engine timings are clamped to be monotonic (a word never starts before the previous
 * one ended); no other adjustment is made.
 */
final class WhisperTranscriptParser {

    private WhisperTranscriptParser() {}

    static TranscriptResult parse(String json, String engineName, String modelName, String requestedLanguage) {
        if (json == null || json.isBlank()) {
            throw malformed("empty output", engineName, null);
        }
        try {
            JSONObject obj = new JSONObject(json);
            Builder b = new Builder();
            String language;
            if (obj.has("segments")) {
                language = obj.optString("language", requestedLanguage);
                parseOpenAiSegments(obj.getJSONArray("segments"), b);
            } else if (obj.has("transcription")) {
                JSONObject result = obj.optJSONObject("result");
                language = result == null ? requestedLanguage : result.optString("language", requestedLanguage);
                parseCppTranscription(obj.getJSONArray("transcription"), b);
            } else {
                throw malformed("neither 'segments' nor 'transcription' present", engineName, null);
            }
            String text = obj.has("text") ? obj.optString("text", "").trim() : b.joinedText();
            return new TranscriptResult(text, language, b.words, b.chunks, b.confidence(), engineName, modelName);
        } catch (JSONException | IllegalArgumentException e) {
            throw malformed(e.getMessage(), engineName, e);
        }
    }

    private static void parseOpenAiSegments(JSONArray segs, Builder b) {
        for (int i = 0; i < segs.length(); i++) {
            JSONObject seg = segs.getJSONObject(i);
            double start = seg.getDouble("start");
            double end = seg.getDouble("end");
            String text = seg.optString("text", "").trim();
            int chunk = b.addChunk(start, end, text);
            if (chunk < 0) {
                continue;
            }
            JSONArray words = seg.optJSONArray("words");
            if (words == null || words.isEmpty()) {
                b.addWord(text, start, end, null, chunk);
                continue;
            }
            for (int w = 0; w < words.length(); w++) {
                JSONObject word = words.getJSONObject(w);
                Double p = word.has("probability") ? word.getDouble("probability") : null;
                b.addWord(word.getString("word").trim(), word.getDouble("start"), word.getDouble("end"), p, chunk);
            }
        }
    }

    private static void parseCppTranscription(JSONArray items, Builder b) {
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.getJSONObject(i);
            JSONObject offsets = item.getJSONObject("offsets");
            double start = offsets.getDouble("from") / 1000.0;
            double end = offsets.getDouble("to") / 1000.0;
            String text = item.optString("text", "").trim();
            int chunk = b.addChunk(start, end, text);
            if (chunk < 0) {
                continue;
            }
            JSONArray tokens = item.optJSONArray("tokens");
            if (tokens == null || tokens.isEmpty()) {
                b.addWord(text, start, end, null, chunk);
                continue;
            }
            CppWord current = null;
            for (int t = 0; t < tokens.length(); t++) {
                JSONObject token = tokens.getJSONObject(t);
                String raw = token.optString("text", "");
                if (raw.startsWith("[_") || raw.isBlank()) {
                    continue;
                }
                JSONObject to = token.getJSONObject("offsets");
                double ts = to.getDouble("from") / 1000.0;
                double te = to.getDouble("to") / 1000.0;
                Double p = token.has("p") ? token.getDouble("p") : null;
                if (current == null || Character.isWhitespace(raw.charAt(0))) {
                    if (current != null) {
                        current.emit(b, chunk);
                    }
                    current = new CppWord(raw.trim(), ts, te, p);
                } else {
                    current.append(raw, te, p);
                }
            }
            if (current != null) {
                current.emit(b, chunk);
            }
        }
    }

    private static TranscriptionException malformed(String detail, String engineName, Throwable cause) {
        return new TranscriptionException("Malformed " + engineName + " output: " + detail,
                TranscriptionFailureReason.MALFORMED_OUTPUT, engineName, cause);
    }

    /**
     * Word assembled from whisper.cpp sub-word tokens; probability is the minimum over its tokens.
     */
    private static final class CppWord {
        private final StringBuilder text;
        private final double start;
        private double end;
        private Double probability;

        CppWord(String text, double start, double end, Double probability) {
            this.text = new StringBuilder(text);
            this.start = start;
            this.end = end;
            this.probability = probability;
        }

        void append(String token, double tokenEnd, Double p) {
            text.append(token);
            end = Math.max(end, tokenEnd);
            if (p != null) {
                probability = probability == null ? p : Math.min(probability, p);
            }
        }

        void emit(Builder b, int chunk) {
            b.addWord(text.toString().trim(), start, end, probability, chunk);
        }
    }

    private static final class Builder {
        final List<WordTiming> words = new ArrayList<>();
        final List<TranscriptChunk> chunks = new ArrayList<>();
        private double lastEnd = 0.0;
        private double probabilitySum = 0.0;
        private int probabilityCount = 0;

        /**
         * @return chunk index, or -1 if the chunk has no text
         */
        int addChunk(double start, double end, String text) {
            if (text.isEmpty()) {
                return -1;
            }
            double s = Math.max(0.0, start);
            chunks.add(new TranscriptChunk(chunks.size(), s, Math.max(s, end), text));
            return chunks.size() - 1;
        }

        void addWord(String text, double start, double end, Double probability, int chunk) {
            if (text.isEmpty()) {
                return;
            }
            double s = Math.max(start, lastEnd);
            double e = Math.max(end, s);
            Double p = probability == null || probability.isNaN() ? null
                    : Math.min(1.0, Math.max(0.0, probability));
            words.add(new WordTiming(words.size(), text, s, e, p, chunk));
            lastEnd = e;
            if (p != null) {
                probabilitySum += p;
                probabilityCount++;
            }
        }

        double confidence() {
            return probabilityCount == 0 ? 1.0 : probabilitySum / probabilityCount;
        }

        String joinedText() {
            StringBuilder sb = new StringBuilder();
            for (TranscriptChunk c : chunks) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(c.text());
            }
            return sb.toString();
        }
    }
}
