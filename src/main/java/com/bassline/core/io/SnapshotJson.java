package com.bassline.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link NetworkSnapshot}s as JSON.
 *
 * Contact values use the {@link LatticeJson} encoding; an unset contact is
 * written as {@code "content": null}.
 */
public final class SnapshotJson {
    private static final ObjectMapper MAPPER = createMapper();

    private SnapshotJson() {
        // Utility class
    }

    /** A mapper that understands lattice values. */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        mapper.registerModule(LatticeJson.module());
        return mapper;
    }

    public static String write(NetworkSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * @throws UncheckedIOException if the text is not a valid snapshot.
     */
    public static NetworkSnapshot read(String json) {
        try {
            return MAPPER.readValue(json, NetworkSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void writeFile(NetworkSnapshot snapshot, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), snapshot);
    }

    public static NetworkSnapshot readFile(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), NetworkSnapshot.class);
    }
}
