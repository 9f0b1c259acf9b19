package satchel.core.service.session;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;

import satchel.core.model.session.Session;
import satchel.core.model.session.SessionLoadException;
import satchel.core.port.in.SessionManagement;

/**
 * Sessions looked up during one request, keyed by cookie name.
 *
 * <p>The registry lives in the {@link RoutingContext} data, so it is created on
 * first use and discarded with the request. A name is resolved against its store
 * once: the first lookup registers a memoized result, and every later lookup for
 * that name, including one made before the first has completed, shares it. The
 * result is either the session or the {@link SessionLoadException} raised while
 * restoring it. Other failures are not kept, so the next lookup retries.
 */
public final class SessionRegistry {

    static final String CONTEXT_KEY = SessionRegistry.class.getName();

    private final HttpServerRequest request;
    private final Map<String, Entry> sessions = new LinkedHashMap<>();

    private record Entry(SessionManagement store, Uni<Session> session) {}

    SessionRegistry(HttpServerRequest request) {
        this.request = request;
    }

    /**
     * Returns the registry of the request, creating it if needed.
     *
     * @param context the routing context of the request
     * @return the request's registry
     */
    public static SessionRegistry of(RoutingContext context) {
        SessionRegistry registry = context.get(CONTEXT_KEY);
        if (registry == null) {
            registry = new SessionRegistry(context.request());
            context.put(CONTEXT_KEY, registry);
        }
        return registry;
    }

    /**
     * Returns the session registered under {@code name}, asking {@code store} for it on first use.
     *
     * @param store the store that owns the session
     * @param name cookie name
     * @return the registered session
     */
    public Uni<Session> get(SessionManagement store, String name) {
        return sessions.computeIfAbsent(name, n -> new Entry(store, lookup(store, n))).session();
    }

    private Uni<Session> lookup(SessionManagement store, String name) {
        return store.newSession(request, name)
                .onFailure(failure -> !(failure instanceof SessionLoadException))
                .invoke(() -> sessions.remove(name))
                .memoize()
                .indefinitely();
    }

    /**
     * Save every registered session, in registration order, stopping at the first failure.
     *
     * <p>A session whose restore failed is saved as the fresh session carried by
     * its {@link SessionLoadException}.
     *
     * @param response the response receiving the cookies
     * @return Uni completing when all sessions are saved
     */
    public Uni<Void> saveAll(HttpServerResponse response) {
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (Entry entry : List.copyOf(sessions.values())) {
            chain = chain.chain(() -> entry.session()
                    .onFailure(SessionLoadException.class)
                    .recoverWithItem(failure -> ((SessionLoadException) failure).getSession())
                    .chain(session -> entry.store().save(request, response, session)));
        }
        return chain;
    }

    /** Returns the number of registered sessions. */
    public int size() {
        return sessions.size();
    }
}
