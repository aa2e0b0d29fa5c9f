package com.moreremesas.sdk.auth;

import com.moreremesas.sdk.internal.Redaction;

/**
 * Credentials and the current token of one client. Owned by a single {@link SessionManager}; the token reference is
 * replaced atomically so readers never see a token paired with another token's expiry.
 */
public final class Session {

    private final String loginUser;
    private final String loginPass;
    private final String accessKeyOverride;

    private volatile Token token;

    public Session(String loginUser, String loginPass, String accessKeyOverride) {
        this.loginUser = loginUser;
        this.loginPass = loginPass;
        this.accessKeyOverride = accessKeyOverride;
    }

    public boolean hasCredentials() {
        return loginUser != null && !loginUser.isBlank() && loginPass != null && !loginPass.isBlank();
    }

    String loginUser() {
        return loginUser;
    }

    String loginPass() {
        return loginPass;
    }

    /**
     * @return the operator supplied {@code AccessKey}, or {@code null} when the token doubles as the key.
     */
    public String accessKeyOverride() {
        return accessKeyOverride == null || accessKeyOverride.isEmpty() ? null : accessKeyOverride;
    }

    public Token token() {
        return token;
    }

    void token(Token token) {
        this.token = token;
    }

    void clear() {
        this.token = null;
    }

    public boolean isAuthenticated() {
        return token != null;
    }

    @Override
    public String toString() {
        return "Session{loginUser=" + Redaction.redact(loginUser)
            + ", accessKey=" + Redaction.redact(accessKeyOverride)
            + ", token=" + token + "}";
    }
}
