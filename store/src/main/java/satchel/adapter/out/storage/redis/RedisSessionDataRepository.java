package satchel.adapter.out.storage.redis;

import java.util.Optional;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.redis.client.Command;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import satchel.core.port.out.SessionDataRepository;

/**
 * Redis/Valkey implementation of SessionDataRepository.
 *
 * <p>Payloads are sent as binary buffers so that any serializer output survives
 * the round trip. Each method issues exactly one command:
 * <ul>
 *   <li>{@code SETEX key seconds payload}</li>
 *   <li>{@code GET key} - a nil reply means the key does not exist</li>
 *   <li>{@code DEL key}</li>
 *   <li>{@code PING}</li>
 * </ul>
 *
 * <p>Connection handling, pooling and command timeouts belong to the Vert.x
 * Redis client; failures are passed through unchanged.
 */
public class RedisSessionDataRepository implements SessionDataRepository {

    private static final Logger LOG = Logger.getLogger(RedisSessionDataRepository.class);

    private final Redis redis;

    public RedisSessionDataRepository(Redis redis) {
        this.redis = redis;
    }

    @Override
    public Uni<Void> setWithExpiry(String key, long seconds, byte[] payload) {
        Request request = Request.cmd(Command.SETEX).arg(key).arg(seconds).arg(Buffer.buffer(payload));
        return redis.send(request)
                .invoke(() -> LOG.debugf("Stored session key %s for %d seconds", key, seconds))
                .replaceWithVoid();
    }

    @Override
    public Uni<Optional<byte[]>> get(String key) {
        return redis.send(Request.cmd(Command.GET).arg(key)).map(RedisSessionDataRepository::toBytes);
    }

    @Override
    public Uni<Void> delete(String key) {
        return redis.send(Request.cmd(Command.DEL).arg(key))
                .invoke(() -> LOG.debugf("Deleted session key %s", key))
                .replaceWithVoid();
    }

    @Override
    public Uni<String> ping() {
        return redis.send(Request.cmd(Command.PING)).map(response -> response == null ? null : response.toString());
    }

    @Override
    public void close() {
        redis.close();
    }

    private static Optional<byte[]> toBytes(Response response) {
        if (response == null) {
            return Optional.empty();
        }
        return Optional.of(response.toBuffer().getBytes());
    }
}
