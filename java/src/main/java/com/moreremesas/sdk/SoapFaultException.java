package com.moreremesas.sdk;

/**
 * SOAP fault declared by the server. Fault code and fault string are kept verbatim.
 */
public final class SoapFaultException extends RemesasException {

    private static final long serialVersionUID = 1L;

    private final String faultCode;
    private final String faultString;

    public SoapFaultException(String faultCode, String faultString) {
        super(faultCode + ": " + faultString);
        this.faultCode = faultCode;
        this.faultString = faultString;
    }

    public String getFaultCode() {
        return faultCode;
    }

    public String getFaultString() {
        return faultString;
    }
}
