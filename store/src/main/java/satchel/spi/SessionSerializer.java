package satchel.spi;

import java.util.Map;

/**
 * SPI for converting session values to the payload stored in the backend.
 *
 * <p>Built-in implementations:
 * <ul>
 *   <li>{@code JavaSessionSerializer} - Java object serialization, any serializable key or value</li>
 *   <li>{@code JsonSessionSerializer} - JSON text, string keys only</li>
 * </ul>
 *
 * <p>A store uses exactly one serializer at a time. Payloads written by one
 * implementation are not readable by another.
 */
public interface SessionSerializer {

    /**
     * Encode the session values.
     *
     * @param values the session value map
     * @return the payload to store
     * @throws SessionSerializationException if the values cannot be encoded
     */
    byte[] serialize(Map<Object, Object> values);

    /**
     * Decode a payload and merge its entries into {@code target}.
     *
     * <p>Entries already present in {@code target} are kept unless the payload
     * contains the same key.
     *
     * @param data the stored payload
     * @param target the session value map to merge into
     * @throws SessionSerializationException if the payload cannot be decoded
     */
    void deserialize(byte[] data, Map<Object, Object> target);
}
