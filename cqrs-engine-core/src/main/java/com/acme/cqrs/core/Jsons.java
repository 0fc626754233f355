package com.acme.cqrs.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Jsons() {
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new PermanentException("Cannot serialize " + o.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new PermanentException("Cannot deserialize " + clazz.getSimpleName(), e);
        }
    }

    /** Parse a JSON object into an insertion-ordered map. Null or blank input yields an empty map. */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return M.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            throw new PermanentException("Cannot deserialize attributes", e);
        }
    }

    /**
     * Shallow merge: keys of {@code patch} replace keys of {@code base}, everything else in
     * {@code base} is preserved.
     */
    public static Map<String, Object> merge(Map<String, Object> base, Map<String, Object> patch) {
        var m = new LinkedHashMap<String, Object>();
        if (base != null) {
            m.putAll(base);
        }
        if (patch != null) {
            m.putAll(patch);
        }
        return m;
    }

    /**
     * Structural equality through the JSON tree, so that {@code 1} and {@code 1L} or differently
     * ordered maps compare equal.
     */
    public static boolean sameContent(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        try {
            // re-read the text so numeric node types depend on the value, not on the Java type
            return M.readTree(M.writeValueAsString(a)).equals(M.readTree(M.writeValueAsString(b)));
        } catch (Exception e) {
            throw new PermanentException("Cannot compare " + a.getClass().getSimpleName(), e);
        }
    }
}
