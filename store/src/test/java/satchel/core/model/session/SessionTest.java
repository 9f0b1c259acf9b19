package satchel.core.model.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import io.vertx.core.http.CookieSameSite;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Session")
class SessionTest {

    @Test
    @DisplayName("should start new with an empty id and no values")
    void shouldStartEmpty() {
        var session = new Session("sid", new SessionOptions());

        assertEquals("sid", session.name());
        assertEquals("", session.id());
        assertTrue(session.isNew());
        assertTrue(session.values().isEmpty());
    }

    @Test
    @DisplayName("setId() should treat null as empty")
    void setIdShouldNormalizeNull() {
        var session = new Session("sid", new SessionOptions());
        session.setId("ABC");
        session.setId(null);

        assertEquals("", session.id());
    }

    @Test
    @DisplayName("should reject a null name")
    void shouldRejectNullName() {
        assertThrows(NullPointerException.class, () -> new Session(null, new SessionOptions()));
    }

    @Nested
    @DisplayName("flashes")
    class FlashTests {

        @Test
        @DisplayName("should return flashes in insertion order and then forget them")
        void shouldConsumeFlashes() {
            var session = new Session("sid", new SessionOptions());
            session.addFlash("saved");
            session.addFlash("welcome back");

            assertEquals(List.of("saved", "welcome back"), session.flashes());
            assertTrue(session.flashes().isEmpty());
            assertFalse(session.values().containsKey(Session.FLASHES_KEY));
        }

        @Test
        @DisplayName("should keep flashes under custom keys apart")
        void shouldSeparateKeys() {
            var session = new Session("sid", new SessionOptions());
            session.addFlash("default");
            session.addFlash("oops", "errors");

            assertEquals(List.of("oops"), session.flashes("errors"));
            assertEquals(List.of("default"), session.flashes());
        }

        @Test
        @DisplayName("should replace a non-list value at the flash key")
        void shouldReplaceNonListValue() {
            var session = new Session("sid", new SessionOptions());
            session.values().put(Session.FLASHES_KEY, "stale");

            session.addFlash("fresh");

            assertEquals(List.of("fresh"), session.flashes());
        }
    }

    @Nested
    @DisplayName("SessionOptions")
    class OptionsTests {

        @Test
        @DisplayName("should use cookie defaults")
        void shouldUseDefaults() {
            var options = new SessionOptions();

            assertEquals("/", options.path());
            assertEquals(null, options.domain());
            assertEquals(SessionOptions.DEFAULT_MAX_AGE, options.maxAge());
            assertFalse(options.secure());
            assertTrue(options.httpOnly());
            assertEquals(null, options.sameSite());
        }

        @Test
        @DisplayName("copy() should not share state with its source")
        void copyShouldBeIndependent() {
            var options = new SessionOptions()
                    .setDomain("example.com")
                    .setSecure(true)
                    .setSameSite(CookieSameSite.LAX)
                    .setMaxAge(60);

            var copy = options.copy();
            copy.setMaxAge(-1).setPath("/admin");

            assertNotSame(options, copy);
            assertEquals(60, options.maxAge());
            assertEquals("/", options.path());
            assertEquals("example.com", copy.domain());
            assertTrue(copy.secure());
            assertEquals(CookieSameSite.LAX, copy.sameSite());
        }
    }
}
