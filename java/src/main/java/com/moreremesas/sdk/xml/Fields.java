package com.moreremesas.sdk.xml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.moreremesas.sdk.internal.Json;
import com.moreremesas.sdk.internal.Redaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Ordered set of named values forming a request body or a decoded response.
 *
 * <p>
 * Keys are unique and keep insertion order, which is the order the fields are serialized in. Vendor field sets vary
 * per operation and grow over time, so requests are assembled here rather than through fixed request classes:
 * </p>
 *
 * <pre>{@code
 * Fields params = Fields.of("Country", "HT", "Type", "2")
 *     .put("Customer", Fields.of("FirstName", "JEAN", "LastName", "MERCIDIEU"));
 * }</pre>
 *
 * <p>
 * A {@code null} value is allowed and encodes as an empty element. Instances are mutable and not thread-safe.
 * </p>
 */
public final class Fields implements XmlValue {

    private static final Pattern NAME = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_.\\-]*");

    private final LinkedHashMap<String, XmlValue> values = new LinkedHashMap<>();

    public Fields() {
    }

    /**
     * Creates a container from alternating keys and text values.
     *
     * @throws IllegalArgumentException when an odd number of arguments is supplied or a key is not a legal element name.
     */
    public static Fields of(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keys and values must come in pairs");
        }
        Fields fields = new Fields();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            fields.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return fields;
    }

    /**
     * Shallow copy preserving order.
     */
    public static Fields copyOf(Fields source) {
        Objects.requireNonNull(source, "source");
        Fields copy = new Fields();
        copy.values.putAll(source.values);
        return copy;
    }

    public Fields put(String key, String value) {
        return put(key, value == null ? null : new TextValue(value));
    }

    public Fields put(String key, XmlValue value) {
        checkName(key);
        values.put(key, value);
        return this;
    }

    /**
     * Returns a new container with {@code key} placed first, followed by the entries of this container. An existing
     * entry under the same key is dropped from its old position.
     */
    public Fields withFirst(String key, XmlValue value) {
        checkName(key);
        Fields result = new Fields();
        result.values.put(key, value);
        for (Map.Entry<String, XmlValue> entry : values.entrySet()) {
            if (!entry.getKey().equals(key)) {
                result.values.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    void putUnchecked(String key, XmlValue value) {
        values.put(key, value);
    }

    public XmlValue get(String key) {
        return values.get(key);
    }

    /**
     * @return the text stored under {@code key}, or {@code null} when absent or not a scalar.
     */
    public String getText(String key) {
        XmlValue value = values.get(key);
        return value != null && value.isText() ? value.asText() : null;
    }

    /**
     * @return the nested container stored under {@code key}, or {@code null} when absent or not a container.
     */
    public Fields getFields(String key) {
        XmlValue value = values.get(key);
        return value != null && value.isFields() ? value.asFields() : null;
    }

    /**
     * Views the value under {@code key} as a list: absent, empty text and empty containers yield an empty list, a
     * sequence yields its items and any other single value yields a one-element list.
     */
    public List<XmlValue> getList(String key) {
        XmlValue value = values.get(key);
        if (value == null) {
            return List.of();
        }
        if (value.isList()) {
            return value.asList();
        }
        if (isEmptyValue(value)) {
            return List.of();
        }
        return List.of(value);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public XmlValue remove(String key) {
        return values.remove(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Set<Map.Entry<String, XmlValue>> entries() {
        return Collections.unmodifiableMap(values).entrySet();
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Converts to plain Java collections: nested {@link Map}s, {@link List}s and {@link String}s.
     */
    public Map<String, Object> toMap() {
        return toMap(false);
    }

    static boolean isEmptyValue(XmlValue value) {
        if (value == null) {
            return true;
        }
        if (value.isText()) {
            return value.asText().isEmpty();
        }
        if (value.isFields()) {
            return value.asFields().isEmpty();
        }
        return false;
    }

    private Map<String, Object> toMap(boolean redact) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, XmlValue> entry : values.entrySet()) {
            if (redact && Redaction.isSensitiveKey(entry.getKey()) && entry.getValue() != null && entry.getValue().isText()) {
                out.put(entry.getKey(), Redaction.redact(entry.getValue().asText()));
            } else {
                out.put(entry.getKey(), plain(entry.getValue(), redact));
            }
        }
        return out;
    }

    private static Object plain(XmlValue value, boolean redact) {
        if (value == null) {
            return null;
        }
        if (value.isText()) {
            return value.asText();
        }
        if (value.isFields()) {
            return ((Fields) value).toMap(redact);
        }
        List<Object> items = new ArrayList<>();
        for (XmlValue item : value.asList()) {
            items.add(plain(item, redact));
        }
        return items;
    }

    private static void checkName(String key) {
        if (key == null || !NAME.matcher(key).matches()) {
            throw new IllegalArgumentException("invalid field name: " + key);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Fields)) {
            return false;
        }
        return values.equals(((Fields) other).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    /**
     * Renders the fields as JSON with credentials and tokens masked, suitable for logs.
     */
    @Override
    public String toString() {
        try {
            return Json.mapper().writeValueAsString(toMap(true));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("render fields: " + ex.getMessage(), ex);
        }
    }
}
