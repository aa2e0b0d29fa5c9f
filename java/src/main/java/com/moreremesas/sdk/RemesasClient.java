package com.moreremesas.sdk;

import com.moreremesas.sdk.auth.Session;
import com.moreremesas.sdk.auth.SessionManager;
import com.moreremesas.sdk.auth.Token;
import com.moreremesas.sdk.internal.SoapInvoker;
import com.moreremesas.sdk.internal.SoapTransport;
import com.moreremesas.sdk.xml.Fields;
import com.moreremesas.sdk.xml.TextValue;
import com.moreremesas.sdk.xml.XmlCodec;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for the More Remesas web service. The client is thread-safe: create one per set of credentials and reuse
 * it. Every operation authenticates on demand (unless auto-auth is disabled), sends the request fields under the
 * operation's wrapper element and returns the decoded {@code Response} element.
 * </p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>The session token is renewed when it is missing, has no usable {@code DueDate}, or has reached it.</li>
 *   <li>An {@code AccessKey} is added as the first request field when the caller did not supply one: the configured
 *       key if any, otherwise the session token.</li>
 *   <li>Vendor business results ({@code ResponseCode} other than {@code 1000}) are returned as data. Use
 *       {@link #errorFromResponse(Fields)} to interpret them.</li>
 *   <li>HTTP errors, SOAP faults and malformed responses raise subclasses of {@link RemesasException}.</li>
 * </ul>
 *
 * <pre>{@code
 * Config config = Config.builder().loginUser("agent").loginPass("secret").build();
 * try (RemesasClient client = new RemesasClient(config)) {
 *     Fields calc = client.orderCalc(Fields.of("PayoutCountry", "HT", "OrderAmount", "100.00"));
 *     for (XmlValue option : calc.getFields("Options").getList("Option")) { ... }
 * }
 * }</pre>
 */
public final class RemesasClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RemesasClient.class.getName());

    /**
     * Order fields checked before an order is imported, validated or has a key reserved.
     */
    public static final List<String> REQUIRED_ORDER_FIELDS = List.of(
        "OrderDate", "SourceCountry", "SourceBranchID", "OrderCurrency",
        "OrderAmount", "PayoutBranchID", "Customer", "Beneficiary");

    static final String ACCESS_KEY = "AccessKey";
    static final String ORDER_INFO = "OrderInfo";
    static final String RESERVE_KEY = "ReserveKey";

    private final Config config;
    private final SoapInvoker invoker;
    private final SessionManager sessions;

    /**
     * @param config caller-supplied configuration. Defaults are applied to a copy, so later builder changes do not
     *               affect this client.
     */
    public RemesasClient(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
        SoapTransport transport = new SoapTransport(
            this.config.getHttpClient(),
            this.config.getHost(),
            this.config.getPaths(),
            this.config.getHttpTimeout(),
            this.config.getRetries(),
            this.config.getBackoff()
        );
        this.invoker = new SoapInvoker(transport, new XmlCodec(this.config.getForceList()));
        this.sessions = new SessionManager(
            invoker,
            new Session(this.config.getLoginUser(), this.config.getLoginPass(), this.config.getAccessKey()),
            this.config.isAutoAuth(),
            this.config.getClock()
        );
    }

    /**
     * Authenticates now, replacing any current token.
     *
     * @throws AuthException when the credentials are missing or rejected.
     */
    public Token authenticate() throws RemesasException {
        return sessions.authenticate();
    }

    /**
     * Authenticates when the current token is missing or due. Does nothing when auto-auth is disabled.
     */
    public void ensureValid() throws RemesasException {
        sessions.ensureValid();
    }

    /**
     * Installs a token obtained elsewhere. Useful with auto-auth disabled.
     */
    public void useToken(String accessToken, String dueDate) {
        sessions.useToken(accessToken, dueDate);
    }

    public SessionManager sessions() {
        return sessions;
    }

    public Config config() {
        return config;
    }

    /**
     * Invokes {@code operation} with {@code params} as the request fields.
     *
     * @return the decoded {@code Response} element; a scalar response is returned under {@link XmlCodec#TEXT_KEY}.
     * @throws ValidationException when the response holds no {@code Response} element.
     */
    public Fields call(Operation operation, Fields params) throws RemesasException {
        Objects.requireNonNull(operation, "operation");
        Fields request = params == null ? new Fields() : params;
        if (operation != Operation.AUTH) {
            sessions.ensureValid();
            if (!request.containsKey(ACCESS_KEY)) {
                request = request.withFirst(ACCESS_KEY, new TextValue(sessions.accessKey()));
            }
        }

        Fields body = request;
        LOGGER.info(() -> String.format(Locale.ROOT, "[remesas-sdk] %s fields=%s", operation, body.keys()));
        Fields response = invoker.invoke(operation, request, sessions.currentToken());
        LOGGER.fine(() -> String.format(Locale.ROOT, "[remesas-sdk] %s response=%s", operation, response));
        return response;
    }

    public Fields rates(Fields params) throws RemesasException {
        return call(Operation.RATES, params);
    }

    public Fields branches(Fields params) throws RemesasException {
        return call(Operation.BRANCHES, params);
    }

    public Fields ordersStatus(Fields params) throws RemesasException {
        return call(Operation.ORDERS_STATUS, params);
    }

    public Fields orderCalc(Fields params) throws RemesasException {
        return call(Operation.ORDER_CALC, params);
    }

    /**
     * Reserves a payment key for {@code order}; see {@link com.moreremesas.sdk.ReserveKeys#extract(Fields)}.
     *
     * @throws ValidationException when required order fields are missing; nothing is sent.
     */
    public Fields reserveKey(Fields order) throws RemesasException {
        requireOrderFields(order);
        return call(Operation.RESERVE_KEY, new Fields().put(ORDER_INFO, order));
    }

    /**
     * @throws ValidationException when required order fields are missing; nothing is sent.
     */
    public Fields orderImport(Fields order) throws RemesasException {
        return orderImport(order, null);
    }

    /**
     * Imports {@code order}, quoting a key obtained from {@link #reserveKey(Fields)} when {@code reserveKey} is not
     * blank.
     *
     * @throws ValidationException when required order fields are missing; nothing is sent.
     */
    public Fields orderImport(Fields order, String reserveKey) throws RemesasException {
        requireOrderFields(order);
        Fields params = new Fields();
        if (reserveKey != null && !reserveKey.isBlank()) {
            params.put(RESERVE_KEY, reserveKey);
        }
        params.put(ORDER_INFO, order);
        return call(Operation.ORDER_IMPORT, params);
    }

    public Fields orderUpdate(Fields params) throws RemesasException {
        return call(Operation.ORDER_UPDATE, params);
    }

    public Fields orderCancel(Fields params) throws RemesasException {
        return call(Operation.ORDER_CANCEL, params);
    }

    public Fields orderActivate(Fields params) throws RemesasException {
        return call(Operation.ORDER_ACTIVATE, params);
    }

    public Fields orderRefund(Fields params) throws RemesasException {
        return call(Operation.ORDER_REFUND, params);
    }

    public Fields orderVoucher(Fields params) throws RemesasException {
        return call(Operation.ORDER_VOUCHER, params);
    }

    /**
     * @throws ValidationException when required order fields are missing; nothing is sent.
     */
    public Fields orderValidate(Fields order) throws RemesasException {
        requireOrderFields(order);
        return call(Operation.ORDER_VALIDATE, new Fields().put(ORDER_INFO, order));
    }

    public static String codeToMessage(String code) {
        return ResponseCodes.codeToMessage(code);
    }

    public static ResponseError errorFromResponse(Fields response) {
        return ResponseCodes.errorFromResponse(response);
    }

    /**
     * The client does not own the {@link java.net.http.HttpClient}; nothing to release.
     */
    @Override
    public void close() {
        // httpClient is managed by the caller or shared with it.
    }

    static void requireOrderFields(Fields order) throws ValidationException {
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_ORDER_FIELDS) {
            if (order == null || !order.containsKey(key)) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("order is missing required fields: " + String.join(", ", missing), missing);
        }
    }
}
