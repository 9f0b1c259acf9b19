package satchel.spi;

/**
 * Capability of a {@link SessionIdCodec} whose freshness window can be adjusted.
 *
 * <p>The store pushes its max-age to every codec implementing this interface so
 * that cookie expiry and backend expiry stay aligned. Codecs without it manage
 * freshness on their own.
 */
public interface MaxAgeConfigurable {

    /**
     * Set the maximum age, in seconds, of values accepted by {@code decode}.
     *
     * @param seconds maximum age; zero disables the check
     */
    void maxAge(int seconds);

    /**
     * @return the current maximum age in seconds
     */
    int maxAge();
}
