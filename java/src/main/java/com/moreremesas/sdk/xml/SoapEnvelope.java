package com.moreremesas.sdk.xml;

/**
 * Assembles SOAP 1.1 envelopes. Fragments are concatenated as given; their well-formedness is the codec's concern.
 */
public final class SoapEnvelope {

    public static final String SOAP11_NAMESPACE = "http://schemas.xmlsoap.org/soap/envelope/";
    public static final String MMT_NAMESPACE = "MMT";
    public static final String ACTION_PREFIX = "MMTaction/";

    private SoapEnvelope() {
    }

    public static String build(String bodyXml, String headerXml) {
        return "<?xml version=\"1.0\" encoding=\"utf-8\"?>"
            + "<soap:Envelope xmlns:soap=\"" + SOAP11_NAMESPACE + "\" xmlns:" + XmlCodec.PREFIX + "=\"" + MMT_NAMESPACE + "\">"
            + "<soap:Header>" + (headerXml == null ? "" : headerXml) + "</soap:Header>"
            + "<soap:Body>" + (bodyXml == null ? "" : bodyXml) + "</soap:Body>"
            + "</soap:Envelope>";
    }

    /**
     * @return the {@code AuthHeader} block carrying {@code token}, or an empty string when there is no token.
     */
    public static String authHeader(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        return "<mmt:AuthHeader><mmt:AccessToken>" + XmlCodec.escape(token) + "</mmt:AccessToken></mmt:AuthHeader>";
    }
}
