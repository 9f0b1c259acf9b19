package satchel.core.service.session;

import java.util.List;

import satchel.spi.SessionCodecException;
import satchel.spi.SessionIdCodec;

/**
 * Ordered set of codecs used for key rotation.
 *
 * <p>New cookies are always encoded with the first codec. Decoding tries every
 * codec in order so that cookies issued under a retired key stay valid until
 * that key is removed.
 */
public final class SessionIdCodecChain {

    private final List<SessionIdCodec> codecs;

    public SessionIdCodecChain(List<? extends SessionIdCodec> codecs) {
        this.codecs = List.copyOf(codecs);
    }

    public List<SessionIdCodec> codecs() {
        return codecs;
    }

    /**
     * Encode with the primary codec.
     *
     * @throws SessionCodecException if no codec is configured or encoding fails
     */
    public String encode(String name, String value) {
        if (codecs.isEmpty()) {
            throw new SessionCodecException(SessionCodecException.Reason.NO_CODECS, "No session codecs configured");
        }
        return codecs.get(0).encode(name, value);
    }

    /**
     * Decode with the first codec that accepts the value.
     *
     * <p>Any runtime failure of a codec moves on to the next one.
     *
     * @throws RuntimeException the first codec's failure, usually a
     *         {@link SessionCodecException}, with the other failures attached as
     *         suppressed exceptions
     */
    public String decode(String name, String value) {
        if (codecs.isEmpty()) {
            throw new SessionCodecException(SessionCodecException.Reason.NO_CODECS, "No session codecs configured");
        }
        RuntimeException first = null;
        for (SessionIdCodec codec : codecs) {
            try {
                return codec.decode(name, value);
            } catch (RuntimeException e) {
                if (first == null) {
                    first = e;
                } else {
                    first.addSuppressed(e);
                }
            }
        }
        throw first;
    }
}
