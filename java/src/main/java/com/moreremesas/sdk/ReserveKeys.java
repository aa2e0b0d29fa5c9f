package com.moreremesas.sdk;

import com.moreremesas.sdk.xml.Fields;

import java.util.List;

/**
 * Reads the reservation key out of a reserve-key response. Deployments name the field differently, so the known
 * spellings are tried in order, first at the top level and then under {@code Attributes}.
 */
public final class ReserveKeys {

    private static final List<String> TOP_LEVEL = List.of("ReservationKey", "ReserveKey", "PaymentKey", "OrderPayoutKey");
    private static final List<String> IN_ATTRIBUTES = List.of("ReserveKey", "ReservationKey");

    private ReserveKeys() {
    }

    /**
     * @return the first non-blank key found, trimmed, or an empty string.
     */
    public static String extract(Fields response) {
        if (response == null) {
            return "";
        }
        String key = firstText(response, TOP_LEVEL);
        if (!key.isEmpty()) {
            return key;
        }
        Fields attributes = response.getFields("Attributes");
        return attributes == null ? "" : firstText(attributes, IN_ATTRIBUTES);
    }

    private static String firstText(Fields fields, List<String> keys) {
        for (String key : keys) {
            String value = fields.getText(key);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }
}
