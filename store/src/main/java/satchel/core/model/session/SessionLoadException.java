package satchel.core.model.session;

/**
 * Thrown when a session could not be restored from the request cookie or the backend.
 *
 * <p>The cause is the underlying failure (cookie decoding, payload deserialization
 * or the backend call). {@link #getSession()} returns the session that was being
 * prepared, still marked new, so handlers can carry on with an empty session:
 *
 * <pre>{@code
 * store.newSession(request, "sid")
 *         .onFailure(SessionLoadException.class)
 *         .recoverWithItem(e -> ((SessionLoadException) e).getSession());
 * }</pre>
 */
public class SessionLoadException extends RuntimeException {

    private final transient Session session;

    public SessionLoadException(Session session, Throwable cause) {
        super("Failed to load session '" + session.name() + "': " + cause.getMessage(), cause);
        this.session = session;
    }

    /** Returns the fresh session prepared for the request. */
    public Session getSession() {
        return session;
    }
}
