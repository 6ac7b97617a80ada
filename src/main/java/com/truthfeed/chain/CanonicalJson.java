package com.truthfeed.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Canonical JSON encoding used for hashing.
 *
 * Object keys are sorted, output is compact. Only JSON-shaped values are
 * accepted: String, Boolean, finite Number, null, List and Map with String keys.
 */
public final class CanonicalJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CanonicalJson() {
    }

    public static String encode(Object value) {
        Object normalized = normalize(value, "$");
        try {
            return MAPPER.writeValueAsString(normalized);
        } catch (JsonProcessingException ex) {
            throw new NonCanonicalPayloadException("payload cannot be encoded: " + ex.getOriginalMessage());
        }
    }

    /**
     * Deep copy of a JSON-shaped map whose nested maps and lists are
     * unmodifiable. Insertion order and null values are kept; leaf values
     * are shared since they are immutable.
     */
    public static Map<String, Object> immutableCopy(Map<String, Object> value) {
        @SuppressWarnings("unchecked")
        Map<String, Object> copy = (Map<String, Object>) copyValue(value);
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(entry.getKey(), copyValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(copyValue(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    private static Object normalize(Object value, String path) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return normalizeNumber(number, path);
        }
        if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new NonCanonicalPayloadException(path + " has a non-string key: " + entry.getKey());
                }
                sorted.put(key, normalize(entry.getValue(), path + "." + key));
            }
            return sorted;
        }
        if (value instanceof Set<?>) {
            throw new NonCanonicalPayloadException(path + " is an unordered set; supply a list");
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                items.add(normalize(list.get(i), path + "[" + i + "]"));
            }
            return items;
        }
        throw new NonCanonicalPayloadException(
            path + " has unsupported type " + value.getClass().getName());
    }

    private static Number normalizeNumber(Number number, String path) {
        if (number instanceof Double d && (d.isNaN() || d.isInfinite())) {
            throw new NonCanonicalPayloadException(path + " is not a finite number");
        }
        if (number instanceof Float f && (f.isNaN() || f.isInfinite())) {
            throw new NonCanonicalPayloadException(path + " is not a finite number");
        }
        if (number instanceof Integer || number instanceof Long || number instanceof Short
            || number instanceof Byte || number instanceof Double || number instanceof Float
            || number instanceof BigDecimal || number instanceof BigInteger) {
            return number;
        }
        throw new NonCanonicalPayloadException(
            path + " has unsupported number type " + number.getClass().getName());
    }
}
