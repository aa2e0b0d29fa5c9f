package com.moreremesas.sdk;

import com.moreremesas.sdk.xml.Fields;
import com.moreremesas.sdk.xml.XmlValue;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.Objects;

/**
 * Builders for the minimal person and order structures accepted by the order operations.
 */
public final class Orders {

    private Orders() {
    }

    /**
     * @param extra optional person fields such as {@code Phone}, {@code Document} or {@code Address}, appended after the
     *              names in iteration order; may be {@code null}.
     */
    public static Fields person(String firstName, String lastName, Fields extra) {
        Fields person = new Fields()
            .put("FirstName", Objects.requireNonNull(firstName, "firstName"))
            .put("LastName", Objects.requireNonNull(lastName, "lastName"));
        appendAll(person, extra);
        return person;
    }

    public static Fields person(String firstName, String lastName) {
        return person(firstName, lastName, null);
    }

    /**
     * Builds an order carrying every required field. {@code amount} is written with two decimals.
     *
     * @param extra optional order fields ({@code PayoutCurrency}, {@code BankInfo}, ...) appended last; may be
     *              {@code null}.
     */
    public static Fields orderInfo(
        String orderDate,
        String sourceCountry,
        String sourceBranchId,
        String orderCurrency,
        BigDecimal amount,
        String payoutBranchId,
        Fields customer,
        Fields beneficiary,
        Fields extra
    ) {
        Fields order = new Fields()
            .put("OrderDate", orderDate)
            .put("SourceCountry", sourceCountry)
            .put("SourceBranchID", sourceBranchId)
            .put("OrderCurrency", orderCurrency)
            .put("OrderAmount", formatAmount(amount))
            .put("PayoutBranchID", payoutBranchId)
            .put("Customer", customer)
            .put("Beneficiary", beneficiary);
        appendAll(order, extra);
        return order;
    }

    /**
     * Formats an amount with exactly two decimals, rounding half up, e.g. {@code 100} as {@code 100.00}.
     */
    public static String formatAmount(BigDecimal amount) {
        Objects.requireNonNull(amount, "amount");
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    public static String formatAmount(double amount) {
        return formatAmount(BigDecimal.valueOf(amount));
    }

    private static void appendAll(Fields target, Fields extra) {
        if (extra == null) {
            return;
        }
        for (Map.Entry<String, XmlValue> entry : extra.entries()) {
            target.put(entry.getKey(), entry.getValue());
        }
    }
}
