package com.phillippitts.hsie.service.store;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Deterministic JSON rendering: object keys sorted, no insignificant whitespace, numbers in
 * {@link JSONObject#numberToString(Number)} form. Two structurally equal trees always render to the
 * same string, which makes the output suitable as hash input.
 */
final class CanonicalJson {

    private CanonicalJson() {}

    static String write(Object value) {
        StringBuilder sb = new StringBuilder(256);
        append(sb, value);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            sb.append("null");
        } else if (value instanceof JSONObject obj) {
            List<String> keys = new ArrayList<>(obj.keySet());
            Collections.sort(keys);
            sb.append('{');
            boolean first = true;
            for (String key : keys) {
                if (!first) {
                    sb.append(',');
                }
                sb.append(JSONObject.quote(key)).append(':');
                append(sb, obj.opt(key));
                first = false;
            }
            sb.append('}');
        } else if (value instanceof JSONArray arr) {
            sb.append('[');
            for (int i = 0; i < arr.length(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                append(sb, arr.opt(i));
            }
            sb.append(']');
        } else if (value instanceof Number n) {
            sb.append(JSONObject.numberToString(n));
        } else if (value instanceof Boolean b) {
            sb.append(b.booleanValue());
        } else {
            sb.append(JSONObject.quote(value.toString()));
        }
    }
}
