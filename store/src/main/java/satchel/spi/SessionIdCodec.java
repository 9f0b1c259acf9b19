package satchel.spi;

/**
 * SPI for turning a session id into an authenticated cookie value and back.
 *
 * <p>Implementations must make the encoded value tamper-evident and bind it to
 * the cookie name, so a value issued for one cookie is rejected for another.
 * Several codecs may be active at once to support key rotation: the store encodes
 * with the first and accepts a value that any of them decodes.
 *
 * @see MaxAgeConfigurable
 */
public interface SessionIdCodec {

    /**
     * Encode a value for the given cookie.
     *
     * @param name cookie name
     * @param value session id
     * @return the cookie value
     * @throws SessionCodecException if encoding fails
     */
    String encode(String name, String value);

    /**
     * Decode and authenticate a cookie value.
     *
     * @param name cookie name
     * @param value cookie value
     * @return the session id
     * @throws SessionCodecException if the value is malformed, forged or expired;
     *         other runtime exceptions are treated the same way by the store
     */
    String decode(String name, String value);
}
