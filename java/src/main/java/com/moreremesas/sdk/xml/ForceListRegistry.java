package com.moreremesas.sdk.xml;

import com.fasterxml.jackson.core.type.TypeReference;
import com.moreremesas.sdk.internal.Json;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Parent element → child elements that decode as a list even when only one occurrence is present.
 *
 * <p>
 * Without a schema a single {@code <Branch>} under {@code <Branches>} cannot be told apart from a required singleton.
 * The registry resolves that for the containers the vendor is known to repeat. The defaults are read from the bundled
 * {@code force-list.json}; callers can extend or replace them through {@link #builder()} or {@link #fromJson(InputStream)}
 * when the vendor adds repeatable containers.
 * </p>
 */
public final class ForceListRegistry {

    private static final String DEFAULT_RESOURCE = "force-list.json";

    private final Map<String, Set<String>> rules;

    private ForceListRegistry(Map<String, Set<String>> rules) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        rules.forEach((parent, children) -> copy.put(parent, Collections.unmodifiableSet(new LinkedHashSet<>(children))));
        this.rules = Collections.unmodifiableMap(copy);
    }

    /**
     * @return the registry bundled with the SDK.
     */
    public static ForceListRegistry defaults() {
        return DefaultsHolder.INSTANCE;
    }

    public static ForceListRegistry empty() {
        return new ForceListRegistry(Map.of());
    }

    /**
     * Reads a JSON object mapping parent names to arrays of child names, e.g. {@code {"Branches": ["Branch"]}}.
     */
    public static ForceListRegistry fromJson(InputStream stream) throws IOException {
        Objects.requireNonNull(stream, "stream");
        Map<String, List<String>> raw = Json.mapper().readValue(stream, new TypeReference<Map<String, List<String>>>() {
        });
        Builder builder = builder();
        if (raw != null) {
            raw.forEach((parent, children) -> builder.force(parent, children == null ? List.<String>of() : children));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this registry's rules.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        rules.forEach(builder::force);
        return builder;
    }

    /**
     * @return child names forced to lists under {@code parent}; empty when the parent has no rule.
     */
    public Set<String> childrenOf(String parent) {
        Set<String> children = rules.get(parent);
        return children == null ? Set.of() : children;
    }

    public boolean isForced(String parent, String child) {
        return childrenOf(parent).contains(child);
    }

    public Map<String, Set<String>> rules() {
        return rules;
    }

    public static final class Builder {
        private final Map<String, Set<String>> rules = new LinkedHashMap<>();

        public Builder force(String parent, String... children) {
            return force(parent, List.of(children));
        }

        public Builder force(String parent, Iterable<String> children) {
            if (parent == null || parent.isBlank()) {
                throw new IllegalArgumentException("parent element name is required");
            }
            Set<String> target = rules.computeIfAbsent(parent.trim(), key -> new LinkedHashSet<>());
            for (String child : children) {
                if (child != null && !child.isBlank()) {
                    target.add(child.trim());
                }
            }
            return this;
        }

        public ForceListRegistry build() {
            return new ForceListRegistry(rules);
        }
    }

    private static final class DefaultsHolder {
        private static final ForceListRegistry INSTANCE = load();

        private static ForceListRegistry load() {
            try (InputStream stream = Json.resource(DEFAULT_RESOURCE)) {
                return fromJson(stream);
            } catch (IOException ex) {
                throw new IllegalStateException("load " + DEFAULT_RESOURCE + ": " + ex.getMessage(), ex);
            }
        }
    }
}
