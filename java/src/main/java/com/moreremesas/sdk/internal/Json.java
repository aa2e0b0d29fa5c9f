package com.moreremesas.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;

/**
 * Centralised ObjectMapper configuration, used for the bundled JSON configuration resources and for diagnostic
 * rendering of payloads.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .setSerializationInclusion(JsonInclude.Include.ALWAYS);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Opens a classpath resource relative to the SDK root package.
     *
     * @throws IOException when the resource is not on the classpath.
     */
    public static InputStream resource(String name) throws IOException {
        InputStream stream = Json.class.getResourceAsStream("/com/moreremesas/sdk/" + name);
        if (stream == null) {
            throw new IOException("resource not found: " + name);
        }
        return stream;
    }
}
