package satchel.adapter.out.serialization;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.HashMap;
import java.util.Map;

import satchel.spi.SessionSerializationException;
import satchel.spi.SessionSerializer;

/**
 * Serializes session values with Java object serialization.
 *
 * <p>The value map is written as a {@link HashMap}, so keys and values may be of
 * any {@link java.io.Serializable} type, including non-string keys. Reading
 * untrusted payloads can instantiate arbitrary classes; pass an
 * {@link ObjectInputFilter} pattern such as {@code java.base/*;!*} to restrict
 * what may be read back.
 */
public class JavaSessionSerializer implements SessionSerializer {

    private final ObjectInputFilter filter;

    public JavaSessionSerializer() {
        this.filter = null;
    }

    /**
     * @param filterPattern an {@link ObjectInputFilter.Config#createFilter} pattern
     */
    public JavaSessionSerializer(String filterPattern) {
        this.filter = ObjectInputFilter.Config.createFilter(filterPattern);
    }

    @Override
    public byte[] serialize(Map<Object, Object> values) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(buffer)) {
            out.writeObject(new HashMap<>(values));
        } catch (IOException e) {
            throw new SessionSerializationException("Failed to serialize session values: " + e.getMessage(), e);
        }
        return buffer.toByteArray();
    }

    @Override
    public void deserialize(byte[] data, Map<Object, Object> target) {
        Object decoded;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            if (filter != null) {
                in.setObjectInputFilter(filter);
            }
            decoded = in.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new SessionSerializationException("Failed to deserialize session values: " + e.getMessage(), e);
        }
        if (!(decoded instanceof Map<?, ?> map)) {
            throw new SessionSerializationException(
                    "Stored session payload is not a map: "
                            + (decoded == null ? "null" : decoded.getClass().getName()));
        }
        target.putAll(map);
    }
}
