package com.moreremesas.sdk;

import com.moreremesas.sdk.xml.SoapEnvelope;

/**
 * Descriptor of each web service operation: the vendor action name carried in {@code SOAPAction}, the element that
 * wraps the request fields and the key of the endpoint path in {@link EndpointPaths}.
 */
public enum Operation {
    AUTH("AWS_API_AUTH2.Execute", "Logintype"),
    RATES("AWS_API_RATES2.Execute", "Rates2Request"),
    BRANCHES("AWS_API_BRANCHESLIST2.Execute", "BranchList2Request"),
    ORDERS_STATUS("AWS_API_ORDERSSTATUS2.Execute", "OrderStatus2Request"),
    ORDER_CALC("AWS_API_ORDERCALC2.Execute", "OrderCalc2Request"),
    RESERVE_KEY("AWS_API_RESERVEKEY2.Execute", "ReserveKey2Request"),
    ORDER_IMPORT("AWS_API_ORDERIMPORT2.Execute", "OrderImport2Request"),
    ORDER_UPDATE("AWS_API_ORDERUPDATE2.Execute", "OrderUpdate2Request"),
    ORDER_CANCEL("AWS_API_ORDERCANCEL2.Execute", "OrderCancel2Request"),
    ORDER_ACTIVATE("AWS_API_ORDERACTIVATE2.Execute", "OrderActivate2Request"),
    ORDER_REFUND("AWS_API_ORDERREFUND2.Execute", "OrderRefund2Request"),
    ORDER_VOUCHER("AWS_API_ORDERVOUCHER2.Execute", "OrderVoucher2Request"),
    ORDER_VALIDATE("AWS_API_ORDERVALIDATE2.Execute", "OrderValidate2Request");

    private final String soapActionName;
    private final String requestWrapper;

    Operation(String soapActionName, String requestWrapper) {
        this.soapActionName = soapActionName;
        this.requestWrapper = requestWrapper;
    }

    public String soapActionName() {
        return soapActionName;
    }

    public String requestWrapper() {
        return requestWrapper;
    }

    public String endpointPathKey() {
        return name();
    }

    /**
     * @return the full {@code SOAPAction} header value, e.g. {@code MMTaction/AWS_API_ORDERCALC2.Execute}.
     */
    public String soapAction() {
        return SoapEnvelope.ACTION_PREFIX + soapActionName;
    }
}
