package com.netsim.telemetry.shared.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Centralized JSON utility. Every sink and test layer uses this so rows
 * serialize identically wherever they end up.
 *
 * Two shapes:
 *   - pretty documents (reports, fixtures) via {@link #toJson} / {@link #writeToFile}
 *   - one compact object per line (row output) via {@link #toJsonLine}
 */
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectWriter LINE_WRITER = MAPPER.writer()
            .without(SerializationFeature.INDENT_OUTPUT);

    private JsonUtil() {}

    public static ObjectMapper getMapper() {
        return MAPPER;
    }

    public static String toJson(Object obj) {
        try {
            return MAPPER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    /**
     * Compact, single-line JSON for JSON Lines output and message payloads.
     */
    public static String toJsonLine(Object obj) {
        try {
            return LINE_WRITER.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize row to JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return MAPPER.readValue(json, clazz);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize from JSON: " + json, e);
        }
    }

    public static <T> T fromJson(String json, TypeReference<T> typeRef) {
        try {
            return MAPPER.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to deserialize from JSON", e);
        }
    }

    public static void writeToFile(Object obj, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                parent.toFile().mkdirs();
            }
            MAPPER.writeValue(path.toFile(), obj);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write JSON to file: " + path, e);
        }
    }

    public static <T> T readFromFile(Path path, Class<T> clazz) {
        try {
            return MAPPER.readValue(path.toFile(), clazz);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read JSON from file: " + path, e);
        }
    }
}
