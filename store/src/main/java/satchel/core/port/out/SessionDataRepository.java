package satchel.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Outbound port for the key-value backend holding session payloads.
 *
 * <p>Every method is a single round trip. Keys arrive fully formed (prefix
 * included) and payloads are opaque bytes. Implementations do not retry and
 * surface backend failures unchanged.
 */
public interface SessionDataRepository {

    /**
     * Store a payload that expires after the given number of seconds.
     *
     * <p>Implementation notes:
     * <ul>
     *   <li>Redis/Valkey: {@code SETEX key seconds payload}</li>
     *   <li>In-Memory: replace the entry and record its expiry instant</li>
     * </ul>
     *
     * @param key backend key
     * @param seconds time to live, always positive
     * @param payload serialized session values
     * @return Uni completing when the write is acknowledged
     */
    Uni<Void> setWithExpiry(String key, long seconds, byte[] payload);

    /**
     * Read a payload.
     *
     * @param key backend key
     * @return the payload, or empty if the key does not exist
     */
    Uni<Optional<byte[]>> get(String key);

    /**
     * Remove a payload. Removing a missing key succeeds.
     *
     * @param key backend key
     * @return Uni completing when the key is gone
     */
    Uni<Void> delete(String key);

    /**
     * Liveness probe.
     *
     * @return the backend reply, {@code PONG} when healthy
     */
    Uni<String> ping();

    /**
     * Release connections held by this repository.
     */
    void close();
}
