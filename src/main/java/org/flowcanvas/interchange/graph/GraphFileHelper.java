package org.flowcanvas.interchange.graph;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes graphs as JSON, the form the editor stores them in.
 */
public class GraphFileHelper {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static String toJson(ProcessGraph graph) {
        try {
            return MAPPER.writeValueAsString(GraphSnapshot.of(graph));
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize graph", e);
        }
    }

    public static ProcessGraph fromJson(String json) {
        try {
            return MAPPER.readValue(json, GraphSnapshot.class).toGraph();
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to read graph JSON", e);
        }
    }

    public static void writeGraph(ProcessGraph graph, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, toJson(graph), StandardCharsets.UTF_8);
    }

    public static ProcessGraph readGraph(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }
}
