package com.flowmodel.graph.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowmodel.graph.GraphStore;
import com.flowmodel.graph.InMemoryGraphStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON persistence for graph snapshots. Element identities are written as plain numbers and
 * restored unchanged, so references held by callers stay valid across save and reload.
 */
public final class GraphSnapshots {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private GraphSnapshots() {
    }

    public static String toJson(GraphStore store) {
        return toJson(store.snapshot());
    }

    public static String toJson(GraphSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize graph snapshot", e);
        }
    }

    public static GraphSnapshot fromJson(String json) {
        try {
            return MAPPER.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Invalid graph snapshot JSON", e);
        }
    }

    public static void write(GraphStore store, Path file) {
        try {
            Files.writeString(file, toJson(store));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write graph snapshot to " + file, e);
        }
    }

    public static InMemoryGraphStore read(Path file) {
        try {
            return InMemoryGraphStore.fromSnapshot(fromJson(Files.readString(file)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph snapshot from " + file, e);
        }
    }
}
