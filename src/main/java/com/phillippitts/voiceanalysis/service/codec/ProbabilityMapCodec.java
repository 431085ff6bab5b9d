package com.phillippitts.voiceanalysis.service.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Text codec for label-to-confidence maps stored in a single column.
 *
 * <p>Format: {@code [k1:v1,k2:v2,...]}. An empty map is {@code []}; an absent map is
 * {@code null}, which is distinct from {@code []}.
 *
 * <p>Decoding is tolerant: rows written by older schema versions must never break reads.
 * A malformed envelope decodes to {@code null}; a malformed pair is dropped while the
 * remaining pairs are kept. Encoding is strict and rejects anything that would not decode
 * back to the same map.
 */
public final class ProbabilityMapCodec {

    private static final char OPEN = '[';
    private static final char CLOSE = ']';
    private static final char PAIR_SEPARATOR = ',';
    private static final char KEY_VALUE_SEPARATOR = ':';

    private ProbabilityMapCodec() {}

    /**
     * Encodes a map to its column form.
     *
     * @param map label to confidence, may be {@code null}
     * @return encoded string, or {@code null} when {@code map} is {@code null}
     * @throws IllegalArgumentException if a key is blank or contains a delimiter, or a value is
     *                                  null or not finite
     */
    public static String encode(Map<String, Double> map) {
        if (map == null) {
            return null;
        }
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (Map.Entry<String, Double> entry : map.entrySet()) {
            String key = entry.getKey();
            Double value = entry.getValue();
            validateKey(key);
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException("Value for '" + key + "' must be finite, got: " + value);
            }
            joiner.add(key + KEY_VALUE_SEPARATOR + value);
        }
        return joiner.toString();
    }

    /**
     * Decodes a column value, returning {@code null} for absent or malformed input.
     */
    public static Map<String, Double> decode(String raw) {
        return decodeDetailed(raw).map();
    }

    /**
     * Decodes a column value and reports how many pairs were dropped.
     *
     * @param raw encoded string, may be {@code null}
     * @return never {@code null}
     */
    public static DecodeResult decodeDetailed(String raw) {
        if (raw == null) {
            return DecodeResult.unparseable();
        }
        String trimmed = raw.trim();
        if (trimmed.length() < 2 || trimmed.charAt(0) != OPEN || trimmed.charAt(trimmed.length() - 1) != CLOSE) {
            return DecodeResult.unparseable();
        }
        String body = trimmed.substring(1, trimmed.length() - 1);
        if (body.isBlank()) {
            return DecodeResult.parsed(Collections.emptyMap(), 0);
        }

        Map<String, Double> map = new LinkedHashMap<>();
        int dropped = 0;
        for (String pair : body.split(String.valueOf(PAIR_SEPARATOR), -1)) {
            int sep = pair.indexOf(KEY_VALUE_SEPARATOR);
            if (sep < 0) {
                dropped++;
                continue;
            }
            String key = pair.substring(0, sep).trim();
            Double value = parseFinite(pair.substring(sep + 1).trim());
            if (value == null) {
                dropped++;
                continue;
            }
            map.put(key, value);
        }
        return DecodeResult.parsed(Collections.unmodifiableMap(map), dropped);
    }

    private static Double parseFinite(String text) {
        if (text.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(text);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isBlank() || !key.equals(key.trim())) {
            throw new IllegalArgumentException("Label must be non-blank without surrounding whitespace: '" + key + "'");
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (c == OPEN || c == CLOSE || c == PAIR_SEPARATOR || c == KEY_VALUE_SEPARATOR) {
                throw new IllegalArgumentException("Label contains a reserved character: '" + key + "'");
            }
        }
    }
}
