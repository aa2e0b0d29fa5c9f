package com.moreremesas.sdk.xml;

import java.util.ArrayList;
import java.util.List;

/**
 * Schema-less value exchanged with the web service: a text scalar ({@link TextValue}), an ordered set of named
 * fields ({@link Fields}) or a sequence of values sharing one element name ({@link ListValue}).
 *
 * <p>
 * Request payloads are built from these types and decoded responses are returned as them. Leaves are always text;
 * numeric and date interpretation is left to the caller.
 * </p>
 */
public interface XmlValue {

    static XmlValue text(String value) {
        return new TextValue(value);
    }

    static XmlValue list(List<? extends XmlValue> items) {
        return new ListValue(items == null ? null : new ArrayList<>(items));
    }

    default boolean isText() {
        return this instanceof TextValue;
    }

    default boolean isFields() {
        return this instanceof Fields;
    }

    default boolean isList() {
        return this instanceof ListValue;
    }

    /**
     * @return the scalar text.
     * @throws IllegalStateException when this value is not a scalar.
     */
    default String asText() {
        if (!isText()) {
            throw new IllegalStateException("not a text value: " + getClass().getSimpleName());
        }
        return ((TextValue) this).text();
    }

    /**
     * @throws IllegalStateException when this value is not a field container.
     */
    default Fields asFields() {
        if (!isFields()) {
            throw new IllegalStateException("not a fields value: " + getClass().getSimpleName());
        }
        return (Fields) this;
    }

    /**
     * @throws IllegalStateException when this value is not a sequence.
     */
    default List<XmlValue> asList() {
        if (!isList()) {
            throw new IllegalStateException("not a list value: " + getClass().getSimpleName());
        }
        return ((ListValue) this).items();
    }
}
