package com.moreremesas.sdk.xml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sequence of values encoded as sibling elements with the same tag. Items may be {@code null}, which encodes as an
 * empty element.
 */
public record ListValue(List<XmlValue> items) implements XmlValue {

    public ListValue {
        items = items == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(items));
    }

    public int size() {
        return items.size();
    }

    public XmlValue get(int index) {
        return items.get(index);
    }
}
