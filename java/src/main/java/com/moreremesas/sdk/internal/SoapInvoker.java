package com.moreremesas.sdk.internal;

import com.moreremesas.sdk.Operation;
import com.moreremesas.sdk.RemesasException;
import com.moreremesas.sdk.ValidationException;
import com.moreremesas.sdk.xml.Fields;
import com.moreremesas.sdk.xml.SoapEnvelope;
import com.moreremesas.sdk.xml.XmlCodec;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.util.Objects;

/**
 * Encodes one operation's request, posts it and decodes the {@code Response} payload. Session handling lives with
 * the callers; this class only carries the token it is handed into the SOAP header.
 */
public final class SoapInvoker {

    static final String RESPONSE = "Response";

    private final SoapTransport transport;
    private final XmlCodec codec;

    public SoapInvoker(SoapTransport transport, XmlCodec codec) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @param token access token for the {@code AuthHeader}; {@code null} or empty sends an empty header.
     * @throws ValidationException when the response holds no payload element.
     */
    public Fields invoke(Operation operation, Fields params, String token) throws RemesasException {
        Objects.requireNonNull(operation, "operation");
        Fields request = new Fields().put(operation.requestWrapper(), params == null ? new Fields() : params);
        String body = codec.encode(request, operation.soapActionName());
        String envelope = SoapEnvelope.build(body, SoapEnvelope.authHeader(token));

        Document document = transport.post(operation.endpointPathKey(), operation.soapAction(), envelope);
        Element payload = locatePayload(document);
        if (payload == null) {
            throw new ValidationException("Response not found");
        }
        return codec.decodePayload(payload);
    }

    /**
     * Finds the payload element: {@code {MMT}Response} first, then a {@code Response} element in any namespace, then
     * the first element in document order whose local name contains {@code Response}.
     */
    static Element locatePayload(Document document) {
        NodeList exact = document.getElementsByTagNameNS(SoapEnvelope.MMT_NAMESPACE, RESPONSE);
        if (exact.getLength() > 0) {
            return (Element) exact.item(0);
        }
        NodeList all = document.getElementsByTagNameNS("*", "*");
        Element partial = null;
        for (int i = 0; i < all.getLength(); i++) {
            Element element = (Element) all.item(i);
            String local = XmlCodec.localName(element);
            if (RESPONSE.equals(local)) {
                return element;
            }
            if (partial == null && local.contains(RESPONSE)) {
                partial = element;
            }
        }
        return partial;
    }
}
