package satchel.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.RoutingContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import satchel.adapter.out.crypto.SecureCookieCodec;
import satchel.adapter.out.serialization.JavaSessionSerializer;
import satchel.adapter.out.storage.memory.InMemorySessionDataRepository;
import satchel.core.model.session.Session;
import satchel.core.model.session.SessionLoadException;
import satchel.core.model.session.SessionOptions;
import satchel.core.port.in.SessionManagement;

@DisplayName("SessionRegistry")
class SessionRegistryTest {

    private static final byte[] HASH_KEY = "an-hmac-key-that-is-32-bytes-ok!".getBytes(StandardCharsets.UTF_8);

    private final Map<String, Object> data = new HashMap<>();
    private HttpServerRequest request;
    private RoutingContext context;
    private SessionManagement store;

    @BeforeEach
    void setUp() {
        request = mock(HttpServerRequest.class);
        context = mock(RoutingContext.class);
        when(context.request()).thenReturn(request);
        when(context.get(anyString())).thenAnswer(inv -> data.get(inv.<String>getArgument(0)));
        when(context.put(anyString(), any())).thenAnswer(inv -> {
            data.put(inv.getArgument(0), inv.getArgument(1));
            return context;
        });
        store = mock(SessionManagement.class);
    }

    private static Session session(String name) {
        return new Session(name, new SessionOptions());
    }

    @Test
    @DisplayName("of() should create one registry per request")
    void ofShouldReuseRegistry() {
        var first = SessionRegistry.of(context);
        var second = SessionRegistry.of(context);

        assertSame(first, second);
        assertSame(first, data.get(SessionRegistry.CONTEXT_KEY));
    }

    @Test
    @DisplayName("get() should ask the store only once per name")
    void getShouldCacheSession() {
        var session = session("sid");
        when(store.newSession(request, "sid")).thenReturn(Uni.createFrom().item(session));
        var registry = SessionRegistry.of(context);

        var first = registry.get(store, "sid").await().indefinitely();
        var second = registry.get(store, "sid").await().indefinitely();

        assertSame(session, first);
        assertSame(session, second);
        verify(store, times(1)).newSession(request, "sid");
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("get() should share one lookup between calls made before it completes")
    void getShouldShareInFlightLookup() {
        when(store.newSession(request, "sid")).thenReturn(Uni.createFrom().item(() -> session("sid")));
        var registry = SessionRegistry.of(context);

        var both = Uni.combine()
                .all()
                .unis(registry.get(store, "sid"), registry.get(store, "sid"))
                .asTuple()
                .await()
                .indefinitely();

        assertSame(both.getItem1(), both.getItem2());
        verify(store, times(1)).newSession(request, "sid");
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("get() on a store should return one instance for concurrent lookups")
    void storeGetShouldReturnOneInstance() {
        var repository = new InMemorySessionDataRepository();
        try (var sessionStore = new SessionStore(
                repository, new JavaSessionSerializer(), SecureCookieCodec.fromKeyPairs(HASH_KEY))) {
            var both = Uni.combine()
                    .all()
                    .unis(sessionStore.get(context, "sid"), sessionStore.get(context, "sid"))
                    .asTuple()
                    .await()
                    .indefinitely();

            assertSame(both.getItem1(), both.getItem2());
            both.getItem1().values().put("foo", "bar");
            var response = mock(HttpServerResponse.class);

            SessionRegistry.of(context).saveAll(response).await().indefinitely();

            assertEquals(1, repository.size());
            verify(response, times(1)).addCookie(any());
        }
    }

    @Test
    @DisplayName("saveAll() should save the fresh session of a failed restore")
    void saveAllShouldSaveFreshSessionOfFailedRestore() {
        var fresh = session("sid");
        when(store.newSession(request, "sid"))
                .thenReturn(Uni.createFrom().failure(new SessionLoadException(fresh, new IllegalStateException())));
        when(store.save(eq(request), any(), any())).thenReturn(Uni.createFrom().voidItem());
        var registry = SessionRegistry.of(context);
        assertThrows(SessionLoadException.class, () -> registry.get(store, "sid").await().indefinitely());
        var response = mock(HttpServerResponse.class);

        registry.saveAll(response).await().indefinitely();

        verify(store).save(request, response, fresh);
    }

    @Test
    @DisplayName("get() should remember a load failure together with its session")
    void getShouldCacheFailure() {
        var fresh = session("sid");
        var failure = new SessionLoadException(fresh, new IllegalStateException("bad cookie"));
        when(store.newSession(request, "sid")).thenReturn(Uni.createFrom().failure(failure));
        var registry = SessionRegistry.of(context);

        var first = assertThrows(SessionLoadException.class, () -> registry.get(store, "sid")
                .await()
                .indefinitely());
        var second = assertThrows(SessionLoadException.class, () -> registry.get(store, "sid")
                .await()
                .indefinitely());

        assertSame(failure, first);
        assertSame(failure, second);
        assertSame(fresh, second.getSession());
        verify(store, times(1)).newSession(request, "sid");
    }

    @Test
    @DisplayName("get() should not cache other failures")
    void getShouldNotCacheUnexpectedFailures() {
        when(store.newSession(request, "sid"))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("boom")))
                .thenReturn(Uni.createFrom().item(session("sid")));
        var registry = SessionRegistry.of(context);

        assertThrows(IllegalStateException.class, () -> registry.get(store, "sid").await().indefinitely());
        assertEquals(0, registry.size());

        registry.get(store, "sid").await().indefinitely();
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("saveAll() should save every registered session in order")
    void saveAllShouldSaveInOrder() {
        var other = mock(SessionManagement.class);
        var first = session("a");
        var second = session("b");
        when(store.newSession(request, "a")).thenReturn(Uni.createFrom().item(first));
        when(other.newSession(request, "b")).thenReturn(Uni.createFrom().item(second));
        when(store.save(eq(request), any(), any())).thenReturn(Uni.createFrom().voidItem());
        when(other.save(eq(request), any(), any())).thenReturn(Uni.createFrom().voidItem());
        var registry = SessionRegistry.of(context);
        registry.get(store, "a").await().indefinitely();
        registry.get(other, "b").await().indefinitely();
        var response = mock(HttpServerResponse.class);

        registry.saveAll(response).await().indefinitely();

        var order = inOrder(store, other);
        order.verify(store).save(request, response, first);
        order.verify(other).save(request, response, second);
    }

    @Test
    @DisplayName("saveAll() should stop at the first failure")
    void saveAllShouldStopAtFailure() {
        var other = mock(SessionManagement.class);
        when(store.newSession(request, "a")).thenReturn(Uni.createFrom().item(session("a")));
        when(other.newSession(request, "b")).thenReturn(Uni.createFrom().item(session("b")));
        when(store.save(eq(request), any(), any()))
                .thenReturn(Uni.createFrom().failure(new IllegalStateException("down")));
        var registry = SessionRegistry.of(context);
        registry.get(store, "a").await().indefinitely();
        registry.get(other, "b").await().indefinitely();
        var response = mock(HttpServerResponse.class);

        assertThrows(IllegalStateException.class, () -> registry.saveAll(response).await().indefinitely());

        verify(other, never()).save(any(), any(), any());
    }

    @Test
    @DisplayName("saveAll() should complete when nothing is registered")
    void saveAllShouldCompleteWhenEmpty() {
        SessionRegistry.of(context).saveAll(mock(HttpServerResponse.class)).await().indefinitely();
    }
}
