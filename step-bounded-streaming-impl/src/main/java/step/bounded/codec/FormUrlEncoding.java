package step.bounded.codec;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversion between maps and {@code application/x-www-form-urlencoded} strings (UTF-8).
 * <p>
 * Multi-valued entries (iterables and arrays) are encoded as repeated keys; when decoding,
 * repeated keys are collected into lists.
 */
final class FormUrlEncoding {

    private FormUrlEncoding() {
    }

    static String encode(Map<?, ?> values) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value instanceof Iterable) {
                for (Object item : (Iterable<?>) value) {
                    append(sb, key, item);
                }
            } else if (value instanceof Object[]) {
                for (Object item : (Object[]) value) {
                    append(sb, key, item);
                }
            } else {
                append(sb, key, value);
            }
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String key, Object value) {
        if (sb.length() > 0) {
            sb.append('&');
        }
        sb.append(URLEncoder.encode(key, StandardCharsets.UTF_8)).append('=');
        if (value != null) {
            sb.append(URLEncoder.encode(String.valueOf(value), StandardCharsets.UTF_8));
        }
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> decode(String encoded) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (String pair : encoded.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            Object existing = result.get(key);
            if (existing == null) {
                result.put(key, value);
            } else if (existing instanceof List) {
                ((List<Object>) existing).add(value);
            } else {
                List<Object> values = new ArrayList<>();
                values.add(existing);
                values.add(value);
                result.put(key, values);
            }
        }
        return result;
    }
}
