package com.moreremesas.sdk;

import com.fasterxml.jackson.core.type.TypeReference;
import com.moreremesas.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Table from endpoint key (see {@link Operation#endpointPathKey()}) to the URL path under the configured host. The
 * sandbox and production tables ship in {@code endpoints.json}.
 */
public final class EndpointPaths {

    private static final String RESOURCE = "endpoints.json";

    private final Map<String, String> paths;

    private EndpointPaths(Map<String, String> paths) {
        this.paths = Collections.unmodifiableMap(new LinkedHashMap<>(paths));
    }

    public static EndpointPaths of(Map<String, String> paths) {
        Objects.requireNonNull(paths, "paths");
        Map<String, String> normalized = new LinkedHashMap<>();
        paths.forEach((key, path) -> {
            if (key == null || key.isBlank() || path == null || path.isBlank()) {
                throw new IllegalArgumentException("endpoint key and path are required");
            }
            String trimmed = path.trim();
            normalized.put(key.trim(), trimmed.startsWith("/") ? trimmed : "/" + trimmed);
        });
        return new EndpointPaths(normalized);
    }

    public static EndpointPaths sandbox() {
        return Tables.SANDBOX;
    }

    public static EndpointPaths production() {
        return Tables.PRODUCTION;
    }

    /**
     * @return the path for {@code key}, or {@code null} when the table has no such endpoint.
     */
    public String path(String key) {
        return key == null ? null : paths.get(key);
    }

    public Map<String, String> asMap() {
        return paths;
    }

    private static final class Tables {
        private static final EndpointPaths SANDBOX;
        private static final EndpointPaths PRODUCTION;

        static {
            try (InputStream stream = Json.resource(RESOURCE)) {
                Map<String, Map<String, String>> tables = Json.mapper().readValue(stream,
                    new TypeReference<Map<String, Map<String, String>>>() {
                    });
                SANDBOX = of(tables.getOrDefault("sandbox", Map.of()));
                PRODUCTION = of(tables.getOrDefault("production", Map.of()));
            } catch (IOException ex) {
                throw new IllegalStateException("load " + RESOURCE + ": " + ex.getMessage(), ex);
            }
        }
    }
}
