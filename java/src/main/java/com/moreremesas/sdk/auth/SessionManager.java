package com.moreremesas.sdk.auth;

import com.moreremesas.sdk.AuthException;
import com.moreremesas.sdk.Operation;
import com.moreremesas.sdk.RemesasException;
import com.moreremesas.sdk.ResponseCodes;
import com.moreremesas.sdk.ValidationException;
import com.moreremesas.sdk.internal.SoapInvoker;
import com.moreremesas.sdk.xml.Fields;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Owns the session token and re-authenticates when it is missing or due.
 *
 * <p>
 * Refreshes are serialized behind a lock with a re-check after acquiring it, so concurrent callers that find the
 * token expired trigger a single authentication call.
 * </p>
 */
public final class SessionManager {

    private static final Logger LOGGER = Logger.getLogger(SessionManager.class.getName());

    public static final String SUCCESS_CODE = "1000";

    private final SoapInvoker invoker;
    private final Session session;
    private final boolean autoAuth;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    public SessionManager(SoapInvoker invoker, Session session, boolean autoAuth, Clock clock) {
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.session = Objects.requireNonNull(session, "session");
        this.autoAuth = autoAuth;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Calls the authentication endpoint with the configured credentials and stores the issued token.
     *
     * @throws AuthException when credentials are missing, the vendor answers with a code other than {@code 1000},
     *                       the answer carries no payload or no AUTH path is configured. The session is left
     *                       unauthenticated.
     */
    public Token authenticate() throws RemesasException {
        lock.lock();
        try {
            return doAuthenticate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Authenticates when auto-auth is on and the token is absent, of unknown expiry, or at or past its expiry.
     */
    public void ensureValid() throws RemesasException {
        if (!autoAuth) {
            return;
        }
        if (isUsable(session.token())) {
            return;
        }

        lock.lock();
        try {
            if (isUsable(session.token())) {
                return;
            }
            doAuthenticate();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Installs a token obtained elsewhere, e.g. restored from a previous process.
     */
    public void useToken(String accessToken, String dueDate) {
        Objects.requireNonNull(accessToken, "accessToken");
        session.token(Token.issued(accessToken, dueDate));
    }

    public void invalidate() {
        session.clear();
    }

    /**
     * @return the token text, or {@code null} when unauthenticated.
     */
    public String currentToken() {
        Token token = session.token();
        return token == null ? null : token.getAccessToken();
    }

    /**
     * @return the {@code AccessKey} for request bodies: the operator override, else the current token, else empty.
     */
    public String accessKey() {
        String override = session.accessKeyOverride();
        if (override != null) {
            return override;
        }
        String token = currentToken();
        return token == null ? "" : token;
    }

    public Session session() {
        return session;
    }

    private boolean isUsable(Token token) {
        return token != null && !token.isExpired(clock.instant());
    }

    private Token doAuthenticate() throws RemesasException {
        if (!session.hasCredentials()) {
            session.clear();
            throw new AuthException("LoginUser and LoginPass are required to authenticate");
        }

        Fields login = new Fields()
            .put("LoginUser", session.loginUser())
            .put("LoginPass", session.loginPass());

        Fields response;
        try {
            response = invoker.invoke(Operation.AUTH, login, null);
        } catch (ValidationException ex) {
            session.clear();
            throw new AuthException("authentication request failed: " + ex.getMessage(), ex);
        } catch (RemesasException ex) {
            session.clear();
            throw ex;
        }

        String code = response.getText("ResponseCode");
        if (!SUCCESS_CODE.equals(code)) {
            session.clear();
            String message = ResponseCodes.errorFromResponse(response).message();
            LOGGER.warning(() -> String.format(Locale.ROOT, "[remesas-sdk] authentication rejected code=%s", code));
            throw new AuthException(String.format(Locale.ROOT, "authentication failed: code=%s message=%s", code, message));
        }

        Token token = Token.issued(response.getText("AccessToken"), response.getText("DueDate"));
        session.token(token);
        Instant expiry = token.getExpiry();
        if (expiry == null) {
            LOGGER.warning(() -> "[remesas-sdk] authentication succeeded without a usable DueDate; token will be renewed on next use");
        } else {
            LOGGER.info(() -> "[remesas-sdk] authenticated; token valid until " + expiry);
        }
        return token;
    }
}
