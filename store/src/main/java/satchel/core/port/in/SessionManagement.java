package satchel.core.port.in;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;

import satchel.core.model.session.Session;

/**
 * Inbound port for session lifecycle operations.
 *
 * <p>A request handler obtains a session with {@link #get} or {@link #newSession},
 * mutates its values, and then calls {@link #save} or {@link #delete}. Nothing is
 * persisted implicitly.
 */
public interface SessionManagement {

    /**
     * Create a session for the request, restoring it from the cookie {@code name} when present.
     *
     * @param request the inbound request
     * @param name cookie name
     * @return the session; fails with {@code SessionLoadException} when the cookie
     *         cannot be decoded or the stored data cannot be read
     */
    Uni<Session> newSession(HttpServerRequest request, String name);

    /**
     * Like {@link #newSession} but cached per request, so repeated lookups of the
     * same name during one request return the same instance.
     *
     * @param context the routing context of the request
     * @param name cookie name
     * @return the session registered for {@code name}
     */
    Uni<Session> get(RoutingContext context, String name);

    /**
     * Persist the session and set its cookie, or erase it when its max-age is zero or less.
     *
     * @param request the inbound request
     * @param response the response receiving the cookie
     * @param session the session to save
     * @return Uni completing once the backend write and the cookie are done
     */
    Uni<Void> save(HttpServerRequest request, HttpServerResponse response, Session session);

    /**
     * Erase the session from the backend, expire its cookie and clear its values.
     *
     * @param request the inbound request
     * @param response the response receiving the expired cookie
     * @param session the session to delete
     * @return Uni completing once the backend delete is done
     */
    Uni<Void> delete(HttpServerRequest request, HttpServerResponse response, Session session);
}
