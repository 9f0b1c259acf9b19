package satchel.adapter.out.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import satchel.core.port.out.SessionDataRepository;

/**
 * In-memory implementation of SessionDataRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and not shared across instances.
 *
 * <p>Entries honour their TTL: an expired entry is never returned and is
 * removed by a background sweep that runs once a minute.
 */
public class InMemorySessionDataRepository implements SessionDataRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionDataRepository.class);

    private record Entry(byte[] payload, Instant expiresAt) {}

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ScheduledExecutorService cleanupExecutor;

    public InMemorySessionDataRepository() {
        this(Clock.systemUTC());
    }

    public InMemorySessionDataRepository(Clock clock) {
        this.clock = clock;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });

        // Run cleanup every minute
        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpiredEntries, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<Void> setWithExpiry(String key, long seconds, byte[] payload) {
        return Uni.createFrom().item(() -> {
            entries.put(key, new Entry(payload.clone(), clock.instant().plusSeconds(seconds)));
            LOG.debugf("Stored session key %s for %d seconds", key, seconds);
            return null;
        });
    }

    @Override
    public Uni<Optional<byte[]>> get(String key) {
        return Uni.createFrom().item(() -> {
            Entry entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (isExpired(entry)) {
                entries.remove(key, entry);
                return Optional.empty();
            }
            return Optional.of(entry.payload().clone());
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            entries.remove(key);
            return null;
        });
    }

    @Override
    public Uni<String> ping() {
        return Uni.createFrom().item("PONG");
    }

    /**
     * Check whether a live entry exists for the key.
     */
    public boolean contains(String key) {
        Entry entry = entries.get(key);
        return entry != null && !isExpired(entry);
    }

    /**
     * Remaining time to live of a key in whole seconds, or -2 if it does not exist.
     */
    public long ttl(String key) {
        Entry entry = entries.get(key);
        if (entry == null || isExpired(entry)) {
            return -2;
        }
        return entry.expiresAt().getEpochSecond() - clock.instant().getEpochSecond();
    }

    /**
     * Get the number of live entries.
     */
    public int size() {
        return (int) entries.values().stream().filter(e -> !isExpired(e)).count();
    }

    /**
     * Remove all entries.
     */
    public void clear() {
        entries.clear();
    }

    @Override
    public void close() {
        cleanupExecutor.shutdownNow();
    }

    private boolean isExpired(Entry entry) {
        return !clock.instant().isBefore(entry.expiresAt());
    }

    private void cleanupExpiredEntries() {
        int before = entries.size();
        entries.values().removeIf(this::isExpired);
        int removed = before - entries.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired session entries", removed);
        }
    }
}
