package com.moreremesas.sdk.internal;

import com.moreremesas.sdk.EndpointPaths;
import com.moreremesas.sdk.ServerException;
import com.moreremesas.sdk.SoapFaultException;
import com.moreremesas.sdk.TransportException;
import com.moreremesas.sdk.ValidationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SoapTransportTest {

    private static final String OK_BODY = "<soap:Envelope xmlns:soap=\"http://schemas.xmlsoap.org/soap/envelope/\">"
        + "<soap:Body><m:Response xmlns:m=\"MMT\"><m:ResponseCode>1000</m:ResponseCode></m:Response></soap:Body>"
        + "</soap:Envelope>";

    private static final String ENVELOPE = "<soap:Envelope xmlns:soap=\"http://schemas.xmlsoap.org/soap/envelope/\" "
        + "xmlns:mmt=\"MMT\"><soap:Header/><soap:Body><mmt:Req><mmt:LoginPass>very-secret-pass</mmt:LoginPass>"
        + "</mmt:Req></soap:Body></soap:Envelope>";

    private HttpServer server;
    private URI baseUri;
    private final AtomicInteger calls = new AtomicInteger();
    private final DelegatingHandler handler = new DelegatingHandler();

    private volatile String lastContentType;
    private volatile String lastSoapAction;
    private volatile String lastRequestId;
    private volatile String lastBody;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/svc/calc.aspx", exchange -> {
            calls.incrementAndGet();
            lastContentType = exchange.getRequestHeaders().getFirst("Content-Type");
            lastSoapAction = exchange.getRequestHeaders().getFirst("SOAPAction");
            lastRequestId = exchange.getRequestHeaders().getFirst(SoapTransport.REQUEST_ID_HEADER);
            try (InputStream in = exchange.getRequestBody()) {
                lastBody = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            handler.handle(exchange);
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        calls.set(0);
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void sendsSoapHeadersAndReturnsDocument() throws Exception {
        handler.delegate = exchange -> respond(exchange, 200, OK_BODY);

        Document document = transport(3).post("ORDER_CALC", "MMTaction/AWS_API_ORDERCALC2.Execute", ENVELOPE);

        assertNotNull(document);
        assertEquals(1, calls.get());
        assertEquals("text/xml; charset=utf-8", lastContentType);
        assertEquals("MMTaction/AWS_API_ORDERCALC2.Execute", lastSoapAction);
        assertNotNull(lastRequestId);
        assertFalse(lastRequestId.isBlank());
        assertEquals(ENVELOPE, lastBody);
    }

    @Test
    void retriesTransientStatusesUntilSuccess() throws Exception {
        AtomicInteger attempt = new AtomicInteger();
        handler.delegate = exchange -> {
            if (attempt.incrementAndGet() <= 2) {
                respond(exchange, 503, "busy");
            } else {
                respond(exchange, 200, OK_BODY);
            }
        };

        Document document = transport(3).post("ORDER_CALC", "MMTaction/X", ENVELOPE);

        assertNotNull(document);
        assertEquals(3, calls.get());
    }

    @Test
    void exhaustedRetriesRaiseServerErrorWithoutSecrets() {
        handler.delegate = exchange -> respond(exchange, 500, "down");

        ServerException ex = assertThrows(ServerException.class,
            () -> transport(3).post("ORDER_CALC", "MMTaction/X", ENVELOPE));

        assertEquals(3, calls.get());
        assertEquals(500, ex.getStatusCode());
        assertTrue(ex.getUrl().endsWith("/svc/calc.aspx"));
        assertTrue(ex.getMessage().contains("500"));
        assertFalse(ex.getMessage().contains("very-secret-pass"));
    }

    @Test
    void clientErrorsAreNotRetried() {
        handler.delegate = exchange -> respond(exchange, 404, "missing");

        ServerException ex = assertThrows(ServerException.class,
            () -> transport(3).post("ORDER_CALC", "MMTaction/X", ENVELOPE));

        assertEquals(1, calls.get());
        assertEquals(404, ex.getStatusCode());
    }

    @Test
    void faultAnywhereInBodyIsRaised() {
        handler.delegate = exchange -> respond(exchange, 200,
            "<soap:Envelope xmlns:soap=\"http://schemas.xmlsoap.org/soap/envelope/\"><soap:Body>"
                + "<m:Response xmlns:m=\"MMT\"><m:ResponseCode>1000</m:ResponseCode></m:Response>"
                + "<soap:Fault><faultcode>soap:Server</faultcode><faultstring> Object reference not set </faultstring>"
                + "</soap:Fault></soap:Body></soap:Envelope>");

        SoapFaultException ex = assertThrows(SoapFaultException.class,
            () -> transport(3).post("ORDER_CALC", "MMTaction/X", ENVELOPE));

        assertEquals("soap:Server", ex.getFaultCode());
        assertEquals("Object reference not set", ex.getFaultString());
        assertEquals(1, calls.get());
    }

    @Test
    void malformedBodyRaisesServerError() {
        handler.delegate = exchange -> respond(exchange, 200, "<html><body>maintenance");

        ServerException ex = assertThrows(ServerException.class,
            () -> transport(1).post("ORDER_CALC", "MMTaction/X", ENVELOPE));

        assertTrue(ex.getMessage().contains("invalid XML"));
    }

    @Test
    void unknownEndpointKeyFailsBeforeSending() {
        assertThrows(ValidationException.class, () -> transport(1).post("NOPE", "MMTaction/X", ENVELOPE));
        assertEquals(0, calls.get());
    }

    @Test
    void refusedConnectionRaisesTransportError() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        SoapTransport transport = new SoapTransport(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build(),
            "http://localhost:" + closedPort,
            EndpointPaths.of(Map.of("ORDER_CALC", "/svc/calc.aspx")),
            Duration.ofSeconds(2),
            2,
            Duration.ofMillis(5)
        );

        TransportException ex = assertThrows(TransportException.class,
            () -> transport.post("ORDER_CALC", "MMTaction/X", ENVELOPE));

        assertTrue(ex.getMessage().contains("2 attempts"));
    }

    @Test
    void backoffDoublesPerAttempt() {
        SoapTransport transport = new SoapTransport(HttpClient.newHttpClient(), baseUri.toString(),
            EndpointPaths.of(Map.of()), Duration.ofSeconds(1), 3, Duration.ofMillis(500));

        assertEquals(Duration.ofMillis(500), transport.backoffFor(1));
        assertEquals(Duration.ofMillis(1000), transport.backoffFor(2));
        assertEquals(Duration.ofMillis(2000), transport.backoffFor(3));
    }

    private SoapTransport transport(int attempts) {
        return new SoapTransport(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
            baseUri.toString(),
            EndpointPaths.of(Map.of("ORDER_CALC", "/svc/calc.aspx")),
            Duration.ofSeconds(5),
            attempts,
            Duration.ofMillis(10)
        );
    }

    private static class DelegatingHandler implements HttpHandler {
        volatile HttpHandler delegate;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (delegate == null) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            } else {
                delegate.handle(exchange);
            }
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "text/xml; charset=utf-8");
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
