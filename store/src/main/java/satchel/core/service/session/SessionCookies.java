package satchel.core.service.session;

import io.vertx.core.http.Cookie;

import satchel.core.model.session.SessionOptions;

/**
 * Builds session cookies from session options.
 */
final class SessionCookies {

    private SessionCookies() {}

    /**
     * Creates a cookie carrying an encoded session id.
     *
     * <p>Max-Age is only emitted for a positive {@code maxAge}; otherwise the
     * cookie lives for the browser session.
     */
    static Cookie create(String name, String value, SessionOptions options) {
        Cookie cookie = base(name, value, options);
        if (options.maxAge() > 0) {
            cookie.setMaxAge(options.maxAge());
        }
        return cookie;
    }

    /**
     * Creates a cookie that clears the session cookie immediately.
     */
    static Cookie expired(String name, SessionOptions options) {
        return base(name, "", options).setMaxAge(-1);
    }

    private static Cookie base(String name, String value, SessionOptions options) {
        Cookie cookie = Cookie.cookie(name, value)
                .setPath(options.path())
                .setSecure(options.secure())
                .setHttpOnly(options.httpOnly());

        if (options.domain() != null) {
            cookie.setDomain(options.domain());
        }
        if (options.sameSite() != null) {
            cookie.setSameSite(options.sameSite());
        }
        return cookie;
    }
}
