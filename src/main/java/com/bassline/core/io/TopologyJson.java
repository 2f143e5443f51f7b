package com.bassline.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link TopologyDefinition}s from JSON.
 */
public final class TopologyJson {
    private static final ObjectMapper MAPPER = SnapshotJson.createMapper();

    private TopologyJson() {
        // Utility class
    }

    /** Parses a JSON file into a TopologyDefinition. */
    public static TopologyDefinition parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /** Parses a JSON stream, for example a classpath resource. */
    public static TopologyDefinition parse(InputStream in) throws IOException {
        return MAPPER.readValue(in, TopologyDefinition.class);
    }

    /**
     * Parses a JSON string into a TopologyDefinition.
     *
     * @throws UncheckedIOException if the text is not valid JSON for a topology.
     */
    public static TopologyDefinition parse(String json) {
        try {
            return MAPPER.readValue(json, TopologyDefinition.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String write(TopologyDefinition def) {
        try {
            return MAPPER.writeValueAsString(def);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
