package satchel.core.service.session;

import java.util.List;
import java.util.Objects;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.Cookie;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.jboss.logging.Logger;

import satchel.core.model.session.Session;
import satchel.core.model.session.SessionLoadException;
import satchel.core.model.session.SessionOptions;
import satchel.core.model.session.SessionTooLargeException;
import satchel.core.port.in.SessionManagement;
import satchel.core.port.out.SessionDataRepository;
import satchel.spi.MaxAgeConfigurable;
import satchel.spi.SessionIdCodec;
import satchel.spi.SessionSerializer;
import satchel.spi.StorageProviderException;

/**
 * Session store keeping session values in a remote key-value backend.
 *
 * <p>The cookie only carries the session id, authenticated by the configured
 * codecs. Values are serialized and written under {@code keyPrefix + id} with a
 * TTL, so the backend expires abandoned sessions on its own.
 *
 * <h2>Expiry</h2>
 * <ul>
 *   <li>{@code maxAge > 0} - saved with a TTL of {@code maxAge} seconds</li>
 *   <li>{@code maxAge <= 0} - {@link #save} erases the session instead</li>
 *   <li>A TTL of zero at write time falls back to {@link #getDefaultMaxAge()}</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * The store is shared by all requests. Configuration fields are volatile, so a
 * setter call is seen by operations started after it; operations already in
 * flight may use either value. Sessions themselves are request-scoped.
 */
public class SessionStore implements SessionManagement, AutoCloseable {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    public static final String DEFAULT_KEY_PREFIX = "session_";
    public static final int DEFAULT_MAX_LENGTH = 4096;
    public static final int DEFAULT_TTL_SECONDS = 60 * 20;

    private static final String PONG = "PONG";

    private final SessionDataRepository repository;
    private final SessionIdCodecChain codecs;
    private final SessionIdGenerator idGenerator;
    private final SessionOptions options = new SessionOptions();

    private volatile String keyPrefix = DEFAULT_KEY_PREFIX;
    private volatile int maxLength = DEFAULT_MAX_LENGTH;
    private volatile int defaultMaxAge = DEFAULT_TTL_SECONDS;
    private volatile SessionSerializer serializer;

    public SessionStore(
            SessionDataRepository repository, SessionSerializer serializer, List<? extends SessionIdCodec> codecs) {
        this(repository, serializer, codecs, new SessionIdGenerator());
    }

    SessionStore(
            SessionDataRepository repository,
            SessionSerializer serializer,
            List<? extends SessionIdCodec> codecs,
            SessionIdGenerator idGenerator) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.codecs = new SessionIdCodecChain(codecs);
        this.idGenerator = idGenerator;
    }

    /**
     * Create a store and verify that its backend is reachable.
     *
     * @param repository backend access
     * @param serializer payload serializer
     * @param codecs cookie codecs, primary first
     * @return the store; fails with {@link StorageProviderException} if the
     *         backend does not answer the liveness check with {@code PONG}
     */
    public static Uni<SessionStore> create(
            SessionDataRepository repository, SessionSerializer serializer, List<? extends SessionIdCodec> codecs) {
        SessionStore store = new SessionStore(repository, serializer, codecs);
        return store.verifyBackend().replaceWith(store);
    }

    /**
     * Ping the backend.
     *
     * @return Uni failing with {@link StorageProviderException} on an unexpected reply
     */
    public Uni<Void> verifyBackend() {
        return repository
                .ping()
                .invoke(reply -> {
                    if (!PONG.equals(reply)) {
                        throw new StorageProviderException("Session backend liveness check failed, got: " + reply);
                    }
                    LOG.debug("Session backend answered liveness check");
                })
                .replaceWithVoid();
    }

    @Override
    public Uni<Session> newSession(HttpServerRequest request, String name) {
        Session session = new Session(name, options.copy());
        Cookie cookie = request.getCookie(name);
        if (cookie == null) {
            return Uni.createFrom().item(session);
        }

        String id;
        try {
            id = codecs.decode(name, cookie.getValue());
        } catch (RuntimeException e) {
            return Uni.createFrom().failure(new SessionLoadException(session, e));
        }
        session.setId(id);

        return load(session)
                .map(found -> {
                    session.setNew(!found);
                    return session;
                })
                .onFailure()
                .transform(failure -> new SessionLoadException(session, failure));
    }

    @Override
    public Uni<Session> get(RoutingContext context, String name) {
        return SessionRegistry.of(context).get(this, name);
    }

    @Override
    public Uni<Void> save(HttpServerRequest request, HttpServerResponse response, Session session) {
        if (session.options().maxAge() <= 0) {
            return repository
                    .delete(keyFor(session))
                    .invoke(() -> response.addCookie(SessionCookies.expired(session.name(), session.options())));
        }

        if (session.id().isEmpty()) {
            session.setId(idGenerator.generate());
        }
        return persist(session).invoke(() -> {
            String encoded = codecs.encode(session.name(), session.id());
            response.addCookie(SessionCookies.create(session.name(), encoded, session.options()));
        });
    }

    @Override
    public Uni<Void> delete(HttpServerRequest request, HttpServerResponse response, Session session) {
        return repository.delete(keyFor(session)).invoke(() -> {
            response.addCookie(SessionCookies.expired(session.name(), session.options()));
            session.values().clear();
        });
    }

    /**
     * Serialize the session and write it with its TTL.
     *
     * <p>The payload length is checked before the backend is contacted.
     */
    Uni<Void> persist(Session session) {
        return Uni.createFrom()
                .item(() -> encodePayload(session))
                .chain(payload -> {
                    int age = session.options().maxAge();
                    if (age == 0) {
                        age = defaultMaxAge;
                    }
                    LOG.debugf("Saving session %s with TTL %d", session.id(), age);
                    return repository.setWithExpiry(keyFor(session), age, payload);
                });
    }

    /**
     * Read the session values from the backend.
     *
     * @return true if data was found and merged into the session values
     */
    Uni<Boolean> load(Session session) {
        return repository.get(keyFor(session)).map(payload -> {
            if (payload.isEmpty()) {
                LOG.debugf("No stored data for session %s", session.id());
                return false;
            }
            serializer.deserialize(payload.get(), session.values());
            return true;
        });
    }

    private byte[] encodePayload(Session session) {
        byte[] payload = serializer.serialize(session.values());
        int limit = maxLength;
        if (limit != 0 && payload.length > limit) {
            throw new SessionTooLargeException(payload.length, limit);
        }
        return payload;
    }

    private String keyFor(Session session) {
        return keyPrefix + session.id();
    }

    /**
     * Store-wide defaults copied into every new session.
     */
    public SessionOptions getOptions() {
        return options;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    /**
     * Set the prefix prepended to session ids to form backend keys.
     */
    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
    }

    public int getMaxLength() {
        return maxLength;
    }

    /**
     * Restrict the serialized payload to {@code length} bytes; zero removes the limit.
     *
     * <p>Negative values are ignored and the previous limit is kept.
     */
    public void setMaxLength(int length) {
        if (length >= 0) {
            this.maxLength = length;
        }
    }

    public SessionSerializer getSerializer() {
        return serializer;
    }

    /**
     * Replace the payload serializer. Data written with the previous serializer
     * will fail to load.
     */
    public void setSerializer(SessionSerializer serializer) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
    }

    public int getDefaultMaxAge() {
        return defaultMaxAge;
    }

    /**
     * Set the TTL, in seconds, used when a session is persisted with a max-age of zero.
     *
     * <p>{@link #save} never persists such a session: a max-age of zero or less
     * deletes it. The fallback only applies to data written through the store's
     * internal persist path, so setting it does not make {@code maxAge == 0} keep
     * a session alive.
     */
    public void setDefaultMaxAge(int seconds) {
        this.defaultMaxAge = seconds;
    }

    /**
     * Set the max-age of new sessions and the freshness window of every codec.
     *
     * <p>Codecs that do not implement {@link MaxAgeConfigurable} are skipped with a
     * warning. To end a single session, set its own options' max-age to -1 instead.
     *
     * @param age max-age in seconds
     */
    public void setMaxAge(int age) {
        options.setMaxAge(age);
        for (SessionIdCodec codec : codecs.codecs()) {
            if (codec instanceof MaxAgeConfigurable configurable) {
                configurable.maxAge(age);
            } else {
                LOG.warnf("Can't change max age on codec %s", codec);
            }
        }
    }

    /** Returns the codecs in use, primary first. */
    public List<SessionIdCodec> getCodecs() {
        return codecs.codecs();
    }

    @Override
    public void close() {
        repository.close();
    }
}
