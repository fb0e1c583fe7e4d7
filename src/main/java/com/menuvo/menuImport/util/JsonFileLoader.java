package com.menuvo.menuImport.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON files from the classpath.
 * Supports deserializing into plain classes or generic types (maps, lists).
 */
public class JsonFileLoader {

    private static final Logger log = LoggerFactory.getLogger(JsonFileLoader.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {}

    /**
     * Loads a JSON file from the classpath as a String.
     *
     * @param resourcePath The path to the JSON file (e.g., "data/menus.json")
     * @return The JSON content as a String
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a JSON file from the classpath and deserializes it to a generic type,
     * e.g. {@code new TypeReference<Map<String, Menu>>() {}}.
     *
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> T loadAsObject(String resourcePath, TypeReference<T> type) throws IOException {
        return objectMapper.readValue(loadAsString(resourcePath), type);
    }

    /**
     * Same as {@link #loadAsObject(String, TypeReference)}, returning null if the file doesn't
     * exist or cannot be parsed. Useful for optional resources.
     */
    public static <T> T loadAsObjectOrNull(String resourcePath, TypeReference<T> type) {
        try {
            return loadAsObject(resourcePath, type);
        } catch (IOException e) {
            log.warn("Failed to load JSON file from classpath: {}", resourcePath, e);
            return null;
        }
    }
}
