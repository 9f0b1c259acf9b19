package satchel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SessionStoreConfigMapping")
class SessionStoreConfigMappingTest {

    static SessionStoreConfigMapping mapping(Map<String, String> properties) {
        return new SmallRyeConfigBuilder()
                .withSources(new PropertiesConfigSource(properties, "test", 100))
                .withMapping(SessionStoreConfigMapping.class)
                .build()
                .getConfigMapping(SessionStoreConfigMapping.class);
    }

    @Test
    @DisplayName("should apply defaults")
    void shouldApplyDefaults() {
        var config = mapping(Map.of("satchel.session.key-pairs", "aGFzaA=="));

        assertEquals("session_", config.keyPrefix());
        assertEquals(4096, config.maxLength());
        assertEquals(Duration.ofMinutes(20), config.defaultMaxAge());
        assertEquals("java", config.serializer());
        assertEquals(Optional.empty(), config.javaFilter());
        assertEquals(List.of("aGFzaA=="), config.keyPairs());

        assertEquals("/", config.cookie().path());
        assertTrue(config.cookie().domain().isEmpty());
        assertEquals(Duration.ofDays(30), config.cookie().maxAge());
        assertFalse(config.cookie().secure());
        assertTrue(config.cookie().httpOnly());
        assertTrue(config.cookie().sameSite().isEmpty());

        assertTrue(config.redis().url().isEmpty());
        assertEquals(List.of("localhost:6379"), config.redis().addresses());
        assertTrue(config.redis().username().isEmpty());
        assertTrue(config.redis().password().isEmpty());
        assertEquals(0, config.redis().database());
    }

    @Test
    @DisplayName("should read overrides")
    void shouldReadOverrides() {
        var config = mapping(Map.of(
                "satchel.session.key-pairs", "aGFzaA==:YmxvY2s=,b2xk",
                "satchel.session.max-length", "0",
                "satchel.session.default-max-age", "PT1H",
                "satchel.session.cookie.max-age", "P7D",
                "satchel.session.cookie.domain", "example.com",
                "satchel.session.redis.addresses", "node1:6379,node2:6379",
                "satchel.session.redis.database", "3"));

        assertEquals(List.of("aGFzaA==:YmxvY2s=", "b2xk"), config.keyPairs());
        assertEquals(0, config.maxLength());
        assertEquals(Duration.ofHours(1), config.defaultMaxAge());
        assertEquals(Duration.ofDays(7), config.cookie().maxAge());
        assertEquals(Optional.of("example.com"), config.cookie().domain());
        assertEquals(List.of("node1:6379", "node2:6379"), config.redis().addresses());
        assertEquals(3, config.redis().database());
    }

    @Test
    @DisplayName("should require key pairs")
    void shouldRequireKeyPairs() {
        assertThrows(RuntimeException.class, () -> mapping(Map.of()));
    }

    @Test
    @DisplayName("load() should read META-INF/microprofile-config.properties")
    void loadShouldReadClasspathProperties() {
        var config = SessionStoreConfigLoader.load();

        assertEquals("test_", config.keyPrefix());
        assertEquals("json", config.serializer());
        assertEquals(2, config.keyPairs().size());
        assertTrue(config.cookie().secure());
        assertEquals(Optional.of("lax"), config.cookie().sameSite());
    }
}
