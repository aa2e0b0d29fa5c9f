package com.moreremesas.sdk.internal;

import com.moreremesas.sdk.EndpointPaths;
import com.moreremesas.sdk.RemesasException;
import com.moreremesas.sdk.ServerException;
import com.moreremesas.sdk.SoapFaultException;
import com.moreremesas.sdk.TransportException;
import com.moreremesas.sdk.ValidationException;
import com.moreremesas.sdk.xml.SoapEnvelope;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Posts SOAP envelopes and returns the parsed response document.
 *
 * <p>
 * Transport failures and the statuses in {@link #RETRYABLE_STATUS} are retried up to the configured attempt budget,
 * waiting {@code backoff × 2^(attempt-1)} between attempts. A SOAP fault anywhere in a successful response is raised
 * as {@link SoapFaultException}. The transport keeps no per-call state and may be shared across threads.
 * </p>
 */
public final class SoapTransport {

    private static final Logger LOGGER = Logger.getLogger(SoapTransport.class.getName());

    public static final Set<Integer> RETRYABLE_STATUS = Set.of(429, 500, 502, 503, 504);
    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final HttpClient httpClient;
    private final String host;
    private final EndpointPaths paths;
    private final Duration requestTimeout;
    private final int maxAttempts;
    private final Duration backoff;

    public SoapTransport(
        HttpClient httpClient,
        String host,
        EndpointPaths paths,
        Duration requestTimeout,
        int maxAttempts,
        Duration backoff
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.host = Objects.requireNonNull(host, "host");
        this.paths = Objects.requireNonNull(paths, "paths");
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff == null || backoff.isNegative() ? Duration.ZERO : backoff;
    }

    /**
     * Posts {@code envelopeXml} to the endpoint registered under {@code pathKey}.
     *
     * @throws ValidationException when {@code pathKey} has no path in the active table.
     * @throws TransportException  when every attempt failed at the IO level.
     * @throws ServerException     when the final status is 400 or above, or the body is not XML.
     * @throws SoapFaultException  when the response carries a SOAP fault.
     */
    public Document post(String pathKey, String soapAction, String envelopeXml) throws RemesasException {
        String path = paths.path(pathKey);
        if (path == null) {
            throw new ValidationException("no endpoint path configured for " + pathKey);
        }
        String url = host + path;
        String requestId = UUID.randomUUID().toString();

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "text/xml; charset=utf-8");
        headers.put("SOAPAction", soapAction);
        headers.put("Accept", "text/xml");
        headers.put(REQUEST_ID_HEADER, requestId);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(envelopeXml, StandardCharsets.UTF_8));
        headers.forEach(builder::header);
        HttpRequest request = builder.build();

        LOGGER.info(() -> String.format(Locale.ROOT,
            "[remesas-sdk] POST %s action=%s request-id=%s", url, soapAction, requestId));
        LOGGER.fine(() -> "[remesas-sdk] request envelope " + Redaction.scrubXml(envelopeXml));

        HttpResponse<byte[]> response = null;
        IOException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
                lastFailure = null;
                if (!RETRYABLE_STATUS.contains(response.statusCode()) || attempt == maxAttempts) {
                    break;
                }
                int status = response.statusCode();
                int current = attempt;
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[remesas-sdk] POST %s returned %d (attempt %d/%d); retrying", url, status, current, maxAttempts));
            } catch (IOException ex) {
                lastFailure = ex;
                response = null;
                if (attempt == maxAttempts) {
                    break;
                }
                int current = attempt;
                LOGGER.warning(() -> String.format(Locale.ROOT,
                    "[remesas-sdk] POST %s failed (attempt %d/%d): %s; retrying", url, current, maxAttempts, ex));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new TransportException("POST " + url + " interrupted", ex);
            }
            pause(backoffFor(attempt), url);
        }

        if (lastFailure != null || response == null) {
            String reason = lastFailure == null ? "no response" : String.valueOf(lastFailure.getMessage());
            throw new TransportException(String.format(Locale.ROOT,
                "POST %s failed after %d attempts: %s", url, maxAttempts, reason), lastFailure);
        }

        int status = response.statusCode();
        if (status >= 400) {
            throw new ServerException(status, url,
                "HTTP " + status + " at " + url + " hdr=" + Redaction.sanitizeHeaders(headers));
        }

        Document document;
        try {
            document = Xml.parse(response.body());
        } catch (SAXException | IOException ex) {
            throw new ServerException(status, url, "invalid XML from " + url + ": " + ex.getMessage(), ex);
        }

        checkFault(document);
        return document;
    }

    Duration backoffFor(int attempt) {
        return backoff.multipliedBy(1L << Math.min(attempt - 1, 16));
    }

    private static void pause(Duration delay, String url) throws TransportException {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportException("POST " + url + " interrupted during backoff", ex);
        }
    }

    private static void checkFault(Document document) throws SoapFaultException {
        NodeList faults = document.getElementsByTagNameNS(SoapEnvelope.SOAP11_NAMESPACE, "Fault");
        if (faults.getLength() == 0) {
            return;
        }
        Element fault = (Element) faults.item(0);
        throw new SoapFaultException(childText(fault, "faultcode"), childText(fault, "faultstring"));
    }

    private static String childText(Element parent, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS("*", localName);
        if (nodes.getLength() == 0) {
            return "";
        }
        String text = nodes.item(0).getTextContent();
        return text == null ? "" : text.trim();
    }
}
