package com.moreremesas.sdk.xml;

import java.util.Objects;

public record TextValue(String text) implements XmlValue {

    public TextValue {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
        return text;
    }
}
