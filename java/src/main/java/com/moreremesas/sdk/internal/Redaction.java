package com.moreremesas.sdk.internal;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks credentials and tokens before they can reach logs, exception messages or diagnostics.
 */
public final class Redaction {

    public static final Set<String> SENSITIVE_KEYS = Set.of("LoginUser", "LoginPass", "AccessToken", "AccessKey");

    private static final List<String> SENSITIVE_HEADERS = List.of("Authorization", "Cookie", "Set-Cookie");
    private static final String REDACTED = "<redacted>";

    private static final Pattern SENSITIVE_ELEMENT = Pattern.compile(
        "<((?:[\\w.\\-]+:)?(?:LoginUser|LoginPass|AccessToken|AccessKey))>([^<]*)</\\1>");

    private Redaction() {
    }

    public static boolean isSensitiveKey(String key) {
        return key != null && SENSITIVE_KEYS.contains(key);
    }

    /**
     * Values up to six characters are fully masked; longer ones keep the first three and last two characters.
     */
    public static String redact(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        if (value.length() <= 6) {
            return "******";
        }
        return value.substring(0, 3) + "****" + value.substring(value.length() - 2);
    }

    /**
     * Copies {@code headers}, replacing authorization and cookie bearing values with a placeholder.
     */
    public static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        if (headers == null) {
            return out;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            String name = entry.getKey();
            boolean sensitive = false;
            for (String candidate : SENSITIVE_HEADERS) {
                if (name != null && name.toLowerCase(Locale.ROOT).contains(candidate.toLowerCase(Locale.ROOT))) {
                    sensitive = true;
                    break;
                }
            }
            out.put(name, sensitive ? REDACTED : entry.getValue());
        }
        return out;
    }

    /**
     * Masks the text content of credential and token elements in an XML document or fragment.
     */
    public static String scrubXml(String xml) {
        if (xml == null || xml.isEmpty()) {
            return xml;
        }
        Matcher matcher = SENSITIVE_ELEMENT.matcher(xml);
        StringBuilder out = new StringBuilder(xml.length());
        while (matcher.find()) {
            String tag = matcher.group(1);
            String masked = "<" + tag + ">" + redact(matcher.group(2)) + "</" + tag + ">";
            matcher.appendReplacement(out, Matcher.quoteReplacement(masked));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
