package satchel.adapter.out.serialization;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import satchel.spi.SessionSerializationException;
import satchel.spi.SessionSerializer;

/**
 * Serializes session values as a JSON object.
 *
 * <p>Every key must be a {@link String}. Values go through Jackson, so after a
 * round trip they come back as JSON types: maps, lists, strings, numbers and
 * booleans.
 */
public class JsonSessionSerializer implements SessionSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public JsonSessionSerializer() {
        this(new ObjectMapper());
    }

    public JsonSessionSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public byte[] serialize(Map<Object, Object> values) {
        Map<String, Object> json = new LinkedHashMap<>(values.size());
        for (var entry : values.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new SessionSerializationException(
                        "non-string key value, cannot serialize session to JSON: " + entry.getKey());
            }
            json.put(key, entry.getValue());
        }
        try {
            return objectMapper.writeValueAsBytes(json);
        } catch (IOException e) {
            throw new SessionSerializationException("Failed to write session JSON: " + e.getMessage(), e);
        }
    }

    @Override
    public void deserialize(byte[] data, Map<Object, Object> target) {
        Map<String, Object> json;
        try {
            json = objectMapper.readValue(data, MAP_TYPE);
        } catch (IOException e) {
            throw new SessionSerializationException("Failed to read session JSON: " + e.getMessage(), e);
        }
        if (json != null) {
            target.putAll(json);
        }
    }
}
