package com.moreremesas.sdk.xml;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between {@link XmlValue} trees and {@code mmt}-prefixed XML.
 *
 * <p>
 * Encoding writes fields in insertion order and repeats the element tag once per list item. Decoding keys children by
 * local name: the first occurrence of a name is stored as-is and a second occurrence promotes the entry to a list, so
 * document order decides the shape. {@link ForceListRegistry} rules are then applied for the element being decoded.
 * </p>
 *
 * <p>
 * An empty {@link Fields} encodes to an empty element, which decodes back as empty text: XML carries no marker that
 * tells the two apart.
 * </p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class XmlCodec {

    public static final String PREFIX = "mmt";

    /**
     * Key under which a scalar payload is returned by {@link #decodePayload(Element)}.
     */
    public static final String TEXT_KEY = "#text";

    private final ForceListRegistry forceList;

    public XmlCodec(ForceListRegistry forceList) {
        this.forceList = Objects.requireNonNull(forceList, "forceList");
    }

    /**
     * Encodes {@code value} under {@code name}. When {@code name} is {@code null} a container's fields are written
     * without a wrapper element and a {@code null} value yields an empty string.
     */
    public String encode(XmlValue value, String name) {
        StringBuilder out = new StringBuilder();
        encode(value, name, out);
        return out.toString();
    }

    private void encode(XmlValue value, String name, StringBuilder out) {
        if (value == null) {
            if (name != null) {
                open(name, out);
                close(name, out);
            }
            return;
        }
        if (value.isList()) {
            for (XmlValue item : value.asList()) {
                encode(item, name, out);
            }
            return;
        }
        if (name != null) {
            open(name, out);
        }
        if (value.isText()) {
            out.append(escape(value.asText()));
        } else {
            for (Map.Entry<String, XmlValue> entry : value.asFields().entries()) {
                encode(entry.getValue(), entry.getKey(), out);
            }
        }
        if (name != null) {
            close(name, out);
        }
    }

    /**
     * Decodes an element. Leaves become trimmed text (never {@code null}); other elements become {@link Fields}.
     */
    public XmlValue decode(Element element) {
        Objects.requireNonNull(element, "element");
        List<Element> children = childElements(element);
        if (children.isEmpty()) {
            String text = element.getTextContent();
            return new TextValue(text == null ? "" : text.trim());
        }

        Fields bucket = new Fields();
        for (Element child : children) {
            String key = localName(child);
            XmlValue value = decode(child);
            if (bucket.containsKey(key)) {
                XmlValue existing = bucket.get(key);
                List<XmlValue> items = new ArrayList<>();
                if (existing != null && existing.isList()) {
                    items.addAll(existing.asList());
                } else {
                    items.add(existing);
                }
                items.add(value);
                bucket.putUnchecked(key, new ListValue(items));
            } else {
                bucket.putUnchecked(key, value);
            }
        }

        for (String forced : forceList.childrenOf(localName(element))) {
            if (!bucket.containsKey(forced)) {
                continue;
            }
            XmlValue value = bucket.get(forced);
            if (value != null && value.isList()) {
                continue;
            }
            bucket.putUnchecked(forced, Fields.isEmptyValue(value) ? new ListValue(List.of()) : new ListValue(List.of(value)));
        }
        return bucket;
    }

    /**
     * Decodes a response payload element, always yielding a container. A scalar payload is stored under
     * {@link #TEXT_KEY}.
     */
    public Fields decodePayload(Element element) {
        XmlValue value = decode(element);
        if (value.isFields()) {
            return value.asFields();
        }
        Fields wrapped = new Fields();
        wrapped.putUnchecked(TEXT_KEY, value);
        return wrapped;
    }

    public static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null) {
            return local;
        }
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&':
                    out.append("&amp;");
                    break;
                case '<':
                    out.append("&lt;");
                    break;
                case '>':
                    out.append("&gt;");
                    break;
                case '"':
                    out.append("&quot;");
                    break;
                case '\'':
                    out.append("&apos;");
                    break;
                default:
                    out.append(c);
            }
        }
        return out.toString();
    }

    private static List<Element> childElements(Element element) {
        NodeList nodes = element.getChildNodes();
        List<Element> out = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                out.add((Element) node);
            }
        }
        return out;
    }

    private static void open(String name, StringBuilder out) {
        out.append('<').append(PREFIX).append(':').append(name).append('>');
    }

    private static void close(String name, StringBuilder out) {
        out.append("</").append(PREFIX).append(':').append(name).append('>');
    }
}
