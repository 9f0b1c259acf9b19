package satchel.core.model.session;

import io.vertx.core.http.CookieSameSite;

/**
 * Cookie and expiry settings for a session.
 *
 * <p>The store keeps one instance as its defaults and hands every session its own
 * {@link #copy()}, so changing a session's options never affects the store or
 * other sessions.
 *
 * <p>{@code maxAge} is in seconds. A value of zero or less marks the session for
 * deletion on save. When the store persists a session whose {@code maxAge} is
 * zero it falls back to its default TTL.
 */
public final class SessionOptions {

    /** Thirty days, in seconds. */
    public static final int DEFAULT_MAX_AGE = 86400 * 30;

    private String path = "/";
    private String domain;
    private int maxAge = DEFAULT_MAX_AGE;
    private boolean secure;
    private boolean httpOnly = true;
    private CookieSameSite sameSite;

    public String path() {
        return path;
    }

    public SessionOptions setPath(String path) {
        this.path = path;
        return this;
    }

    /** Cookie domain, or null for the request host. */
    public String domain() {
        return domain;
    }

    public SessionOptions setDomain(String domain) {
        this.domain = domain;
        return this;
    }

    public int maxAge() {
        return maxAge;
    }

    public SessionOptions setMaxAge(int maxAge) {
        this.maxAge = maxAge;
        return this;
    }

    public boolean secure() {
        return secure;
    }

    public SessionOptions setSecure(boolean secure) {
        this.secure = secure;
        return this;
    }

    public boolean httpOnly() {
        return httpOnly;
    }

    public SessionOptions setHttpOnly(boolean httpOnly) {
        this.httpOnly = httpOnly;
        return this;
    }

    /** SameSite attribute, or null to omit it. */
    public CookieSameSite sameSite() {
        return sameSite;
    }

    public SessionOptions setSameSite(CookieSameSite sameSite) {
        this.sameSite = sameSite;
        return this;
    }

    /**
     * Create an independent copy of these options.
     *
     * @return a new instance with the same values
     */
    public SessionOptions copy() {
        return new SessionOptions()
                .setPath(path)
                .setDomain(domain)
                .setMaxAge(maxAge)
                .setSecure(secure)
                .setHttpOnly(httpOnly)
                .setSameSite(sameSite);
    }

    @Override
    public String toString() {
        return "SessionOptions{path=" + path + ", domain=" + domain + ", maxAge=" + maxAge + ", secure=" + secure
                + ", httpOnly=" + httpOnly + ", sameSite=" + sameSite + "}";
    }
}
