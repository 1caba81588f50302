package com.openBudget.normalizer.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON files from the classpath.
 * Numbers are read as BigDecimal so reference values keep their exact precision.
 */
public class JsonFileLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private JsonFileLoader() {
    }

    /**
     * Loads a classpath resource as a UTF-8 String.
     *
     * @param resourcePath The path to the resource (e.g., "datasets/cpi-yearly.json")
     * @return The content as a String
     * @throws IOException if the resource cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new ResourceNotFoundException(resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Deserializes JSON content into the specified type.
     *
     * @param json JSON text
     * @param clazz The class to deserialize the JSON into
     * @param <T> The type to deserialize to
     * @return An instance of the specified type
     * @throws IOException if the content is not valid JSON for the type
     */
    public static <T> T parse(String json, Class<T> clazz) throws IOException {
        return objectMapper.readValue(json, clazz);
    }

    /**
     * Loads a JSON file from the classpath and deserializes it to the specified type.
     *
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> T loadAsObject(String resourcePath, Class<T> clazz) throws IOException {
        return parse(loadAsString(resourcePath), clazz);
    }

    /**
     * Raised when a classpath resource does not exist, so callers can tell
     * "missing" apart from "unreadable".
     */
    public static class ResourceNotFoundException extends IOException {

        public ResourceNotFoundException(String resourcePath) {
            super("Resource not found: " + resourcePath);
        }
    }
}
