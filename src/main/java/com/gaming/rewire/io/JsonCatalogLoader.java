package com.gaming.rewire.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gaming.rewire.engine.ConnectorOptions;
import com.gaming.rewire.engine.WorldGraph;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads world catalogs and connector options from JSON.
 *
 * I/O failures are rethrown as {@link UncheckedIOException} naming the
 * source; malformed JSON surfaces the same way, with Jackson's location in
 * the cause.
 */
public final class JsonCatalogLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonCatalogLoader() {
        // Utility class
    }

    public static WorldDefinition load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, WorldDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog " + path, e);
        }
    }

    public static WorldDefinition load(InputStream in, String sourceName) {
        try {
            return MAPPER.readValue(in, WorldDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read catalog " + sourceName, e);
        }
    }

    /** Loads a catalog from the classpath, e.g. {@code "catalogs/minimal.json"}. */
    public static WorldDefinition loadResource(String resource) {
        InputStream in = JsonCatalogLoader.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new UncheckedIOException("Catalog resource not found: " + resource,
                    new IOException("Missing resource " + resource));
        }
        try (in) {
            return load(in, resource);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close catalog resource " + resource, e);
        }
    }

    /** Loads and compiles a catalog in one step. */
    public static WorldGraph compile(Path path) {
        return new WorldCompiler().compile(load(path));
    }

    public static ConnectorOptions loadOptions(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, ConnectorOptions.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read options " + path, e);
        }
    }

    public static ConnectorOptions loadOptions(InputStream in, String sourceName) {
        try {
            return MAPPER.readValue(in, ConnectorOptions.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read options " + sourceName, e);
        }
    }

    /** Serializes a catalog back to pretty-printed JSON. */
    public static String toJson(WorldDefinition def) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(def);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to serialize catalog " + def.getName(), e);
        }
    }
}
