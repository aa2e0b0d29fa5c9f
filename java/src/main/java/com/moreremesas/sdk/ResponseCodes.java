package com.moreremesas.sdk;

import com.moreremesas.sdk.xml.Fields;
import com.moreremesas.sdk.xml.XmlValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vendor response codes and their descriptions.
 *
 * <p>
 * Only codes the service is known to return are listed; any other code is reported as
 * {@code "Unknown response code <code>"} so callers fall back to the server's own message text.
 * </p>
 */
public final class ResponseCodes {

    public static final String SUCCESS = "1000";

    private static final Map<String, String> MESSAGES;

    static {
        Map<String, String> messages = new LinkedHashMap<>();
        messages.put(SUCCESS, "Success");
        messages.put("22", "Agent credit limit exceeded");
        MESSAGES = Collections.unmodifiableMap(messages);
    }

    private static final List<String> MESSAGE_TEXT_KEYS = List.of("MessageText", "Message", "Description");

    private ResponseCodes() {
    }

    public static String codeToMessage(String code) {
        String message = code == null ? null : MESSAGES.get(code.trim());
        return message != null ? message : "Unknown response code " + code;
    }

    public static Map<String, String> table() {
        return MESSAGES;
    }

    /**
     * Extracts code, message and detail entry from a decoded response.
     *
     * <p>
     * The message is taken from the first {@code Messages/Message} entry ({@code MessageText}, {@code Message} or
     * {@code Description}), then the top-level {@code ResponseMessage}, then the code table.
     * </p>
     */
    public static ResponseError errorFromResponse(Fields response) {
        if (response == null) {
            return new ResponseError("", codeToMessage(""), new Fields());
        }
        String code = response.getText("ResponseCode");
        if (code == null) {
            code = "";
        }

        List<XmlValue> entries = messageEntries(response);
        Fields details = new Fields();
        String message = null;
        if (!entries.isEmpty()) {
            XmlValue first = entries.get(0);
            if (first.isFields()) {
                details = first.asFields();
                for (String key : MESSAGE_TEXT_KEYS) {
                    String text = details.getText(key);
                    if (text != null && !text.isEmpty()) {
                        message = text;
                        break;
                    }
                }
            } else if (first.isText() && !first.asText().isEmpty()) {
                message = first.asText();
            }
        }
        if (message == null) {
            String top = response.getText("ResponseMessage");
            message = top == null || top.isEmpty() ? codeToMessage(code) : top;
        }
        return new ResponseError(code, message, details);
    }

    /**
     * @return every {@code MessageCode} in the {@code Messages} block, in document order.
     */
    public static List<String> messageCodes(Fields response) {
        List<String> codes = new ArrayList<>();
        if (response == null) {
            return codes;
        }
        for (XmlValue entry : messageEntries(response)) {
            if (entry.isFields()) {
                String code = entry.asFields().getText("MessageCode");
                if (code != null && !code.isEmpty()) {
                    codes.add(code);
                }
            }
        }
        return codes;
    }

    private static List<XmlValue> messageEntries(Fields response) {
        Fields messages = response.getFields("Messages");
        if (messages == null) {
            return List.of();
        }
        List<XmlValue> entries = new ArrayList<>();
        for (XmlValue entry : messages.getList("Message")) {
            if (entry != null) {
                entries.add(entry);
            }
        }
        return entries;
    }
}
