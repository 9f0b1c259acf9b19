package satchel.core.service.session;

import java.security.SecureRandom;

import org.apache.commons.codec.binary.Base32;

/**
 * Generate cryptographically secure session IDs.
 *
 * <p>Session IDs are 32 bytes (256 bits) of random data encoded as upper-case
 * Base32 with the {@code =} padding removed, which keeps them safe to use in
 * backend keys.
 */
public class SessionIdGenerator {

    private static final int SESSION_ID_BYTES = 32; // 256 bits
    private static final Base32 ENCODER = new Base32();

    private final SecureRandom secureRandom;

    public SessionIdGenerator() {
        this(new SecureRandom());
    }

    SessionIdGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    /**
     * Generate a new cryptographically secure session ID.
     *
     * @return A Base32 encoded session ID without padding (52 characters)
     */
    public String generate() {
        byte[] bytes = new byte[SESSION_ID_BYTES];
        secureRandom.nextBytes(bytes);
        return ENCODER.encodeToString(bytes).replace("=", "");
    }
}
