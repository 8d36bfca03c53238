package com.latticeMarket.latticeLedger.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Utility class for loading JSON seed files from the classpath.
 */
@Slf4j
public class JsonFileLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param resourcePath Classpath location (e.g., "data/genesis-balances.json")
     * @return true if the resource exists on the classpath
     */
    public static boolean exists(String resourcePath) {
        return JsonFileLoader.class.getClassLoader().getResource(resourcePath) != null;
    }

    /**
     * Loads a JSON file from the classpath as a String.
     *
     * @param resourcePath The path to the JSON file
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
     * Loads a JSON file containing an array of JSON objects from the classpath
     * and deserializes it to a List of the specified type.
     *
     * @param resourcePath The path to the JSON file containing a JSON array
     * @param clazz The class to deserialize each JSON object into
     * @param <T> The type of objects in the list
     * @return A List of objects of the specified type
     * @throws IOException if the file cannot be read, doesn't exist, or cannot be deserialized
     */
    public static <T> List<T> loadAsList(String resourcePath, Class<T> clazz) throws IOException {
        String jsonString = loadAsString(resourcePath);
        List<T> values = objectMapper.readValue(jsonString,
            objectMapper.getTypeFactory().constructCollectionType(List.class, clazz));
        log.debug("Loaded {} entries from {}", values.size(), resourcePath);
        return values;
    }
}
