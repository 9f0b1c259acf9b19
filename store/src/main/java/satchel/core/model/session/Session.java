package satchel.core.model.session;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Server-side state for one client, referenced by a cookie.
 *
 * <p>A session is request-scoped: it is produced by the store when a request
 * arrives, mutated by the handler, and written back (or erased) by an explicit
 * save. An unsaved session is simply dropped. Instances are not thread-safe and
 * must not be shared between concurrent requests.
 *
 * <p>The id is empty until the first save assigns one; after that it never
 * changes. {@link #isNew()} stays true until the store has loaded existing data
 * for the id carried by the request cookie.
 */
public final class Session {

    /** Values key under which flash messages are kept. */
    public static final String FLASHES_KEY = "_flash";

    private final String name;
    private final SessionOptions options;
    private final Map<Object, Object> values = new HashMap<>();
    private String id = "";
    private boolean isNew = true;

    public Session(String name, SessionOptions options) {
        this.name = Objects.requireNonNull(name, "name");
        this.options = Objects.requireNonNull(options, "options");
    }

    /** Cookie name this session was created for. */
    public String name() {
        return name;
    }

    public String id() {
        return id;
    }

    public void setId(String id) {
        this.id = id == null ? "" : id;
    }

    public boolean isNew() {
        return isNew;
    }

    public void setNew(boolean isNew) {
        this.isNew = isNew;
    }

    /**
     * The live payload map. Changes are persisted on the next save.
     */
    public Map<Object, Object> values() {
        return values;
    }

    public SessionOptions options() {
        return options;
    }

    /**
     * Append a flash message under the default key.
     *
     * @param value message to keep until the next {@link #flashes()} call
     */
    public void addFlash(Object value) {
        addFlash(value, FLASHES_KEY);
    }

    /**
     * Append a flash message under the given key.
     *
     * @param value message
     * @param key values key holding the flash list
     */
    @SuppressWarnings("unchecked")
    public void addFlash(Object value, String key) {
        Object existing = values.get(key);
        List<Object> flashes;
        if (existing instanceof List<?> list) {
            flashes = (List<Object>) list;
        } else {
            flashes = new ArrayList<>();
            values.put(key, flashes);
        }
        flashes.add(value);
    }

    /**
     * Return and remove the flash messages kept under the default key.
     */
    public List<Object> flashes() {
        return flashes(FLASHES_KEY);
    }

    /**
     * Return and remove the flash messages kept under the given key.
     *
     * @param key values key holding the flash list
     * @return the messages, empty if there were none
     */
    public List<Object> flashes(String key) {
        Object removed = values.remove(key);
        if (removed instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        return new ArrayList<>();
    }

    @Override
    public String toString() {
        return "Session{name=" + name + ", id=" + id + ", isNew=" + isNew + "}";
    }
}
