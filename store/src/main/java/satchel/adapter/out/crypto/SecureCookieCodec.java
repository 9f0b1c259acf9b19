package satchel.adapter.out.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import satchel.spi.MaxAgeConfigurable;
import satchel.spi.SessionCodecException;
import satchel.spi.SessionCodecException.Reason;
import satchel.spi.SessionIdCodec;

/**
 * Authenticated (and optionally encrypted) cookie values.
 *
 * <p>Values are signed with HMAC-SHA256 over the cookie name, the issue time and
 * the payload, so a value cannot be altered, replayed under another cookie name,
 * or used after {@link #maxAge()} seconds. When a block key is supplied the
 * payload is also encrypted with AES-GCM using a fresh IV per value.
 *
 * <h2>Encoded Format</h2>
 * <pre>
 * base64url( timestamp "|" base64url(payload) "|" base64url(mac) )
 * payload = value                      (sign only)
 * payload = [IV (12 bytes)][ciphertext+authTag]  (with block key)
 * mac     = HMAC-SHA256(name "|" timestamp "|" base64url(payload))
 * </pre>
 */
public final class SecureCookieCodec implements SessionIdCodec, MaxAgeConfigurable {

    private static final String MAC_ALGORITHM = "HmacSHA256";
    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public static final int DEFAULT_MAX_AGE = 86400 * 30;
    public static final int DEFAULT_MAX_LENGTH = 4096;

    private final SecretKeySpec hashKey;
    private final SecretKey blockKey;
    private final SecureRandom secureRandom;
    private final Clock clock;

    private volatile int maxAge = DEFAULT_MAX_AGE;
    private volatile int minAge;
    private volatile int maxLength = DEFAULT_MAX_LENGTH;

    /**
     * Create a codec.
     *
     * @param hashKey HMAC key, should be 32 or 64 bytes
     * @param blockKey AES key of 16, 24 or 32 bytes, or null to sign without encrypting
     */
    public SecureCookieCodec(byte[] hashKey, byte[] blockKey) {
        this(hashKey, blockKey, Clock.systemUTC());
    }

    public SecureCookieCodec(byte[] hashKey, byte[] blockKey, Clock clock) {
        if (hashKey == null || hashKey.length == 0) {
            throw new IllegalArgumentException("Hash key must not be empty");
        }
        this.hashKey = new SecretKeySpec(hashKey.clone(), MAC_ALGORITHM);
        if (blockKey != null) {
            if (blockKey.length != 16 && blockKey.length != 24 && blockKey.length != 32) {
                throw new IllegalArgumentException(
                        "Block key must be 16, 24 or 32 bytes. Got: " + blockKey.length + " bytes");
            }
            this.blockKey = new SecretKeySpec(blockKey.clone(), "AES");
        } else {
            this.blockKey = null;
        }
        this.secureRandom = new SecureRandom();
        this.clock = clock;
    }

    /**
     * Build one codec per key pair.
     *
     * <p>Arguments alternate between hash keys and block keys: {@code hash1, block1,
     * hash2, block2, ...}. A null or missing trailing block key creates a sign-only
     * codec.
     *
     * @param keyPairs hash and block keys
     * @return the codecs in argument order
     */
    public static List<SecureCookieCodec> fromKeyPairs(byte[]... keyPairs) {
        List<SecureCookieCodec> codecs = new ArrayList<>();
        for (int i = 0; i < keyPairs.length; i += 2) {
            byte[] blockKey = i + 1 < keyPairs.length ? keyPairs[i + 1] : null;
            codecs.add(new SecureCookieCodec(keyPairs[i], blockKey));
        }
        return codecs;
    }

    @Override
    public String encode(String name, String value) {
        byte[] payload = value.getBytes(StandardCharsets.UTF_8);
        if (blockKey != null) {
            payload = encrypt(payload);
        }
        String encodedPayload = ENCODER.encodeToString(payload);
        long timestamp = clock.instant().getEpochSecond();
        String mac = ENCODER.encodeToString(mac(name, timestamp, encodedPayload));

        String joined = timestamp + "|" + encodedPayload + "|" + mac;
        String encoded = ENCODER.encodeToString(joined.getBytes(StandardCharsets.UTF_8));
        int limit = maxLength;
        if (limit != 0 && encoded.length() > limit) {
            throw new SessionCodecException(Reason.VALUE_TOO_LONG, "Encoded cookie value is too long");
        }
        return encoded;
    }

    @Override
    public String decode(String name, String value) {
        int limit = maxLength;
        if (limit != 0 && value.length() > limit) {
            throw new SessionCodecException(Reason.VALUE_TOO_LONG, "Cookie value is too long");
        }

        String joined;
        try {
            joined = new String(DECODER.decode(value), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new SessionCodecException(Reason.MALFORMED, "Cookie value is not valid base64", e);
        }
        String[] parts = joined.split("\\|", -1);
        if (parts.length != 3) {
            throw new SessionCodecException(Reason.MALFORMED, "Cookie value has an invalid format");
        }

        long timestamp;
        try {
            timestamp = Long.parseLong(parts[0]);
        } catch (NumberFormatException e) {
            throw new SessionCodecException(Reason.INVALID_TIMESTAMP, "Cookie timestamp is not a number", e);
        }

        byte[] expectedMac = mac(name, timestamp, parts[1]);
        byte[] actualMac;
        try {
            actualMac = DECODER.decode(parts[2]);
        } catch (IllegalArgumentException e) {
            throw new SessionCodecException(Reason.INVALID_MAC, "Cookie MAC is not valid base64", e);
        }
        if (!MessageDigest.isEqual(expectedMac, actualMac)) {
            throw new SessionCodecException(Reason.INVALID_MAC, "Cookie MAC does not match");
        }

        long now = clock.instant().getEpochSecond();
        int min = minAge;
        if (min != 0 && timestamp > now - min) {
            throw new SessionCodecException(Reason.TIMESTAMP_TOO_NEW, "Cookie timestamp is too new");
        }
        int max = maxAge;
        if (max != 0 && timestamp < now - max) {
            throw new SessionCodecException(Reason.EXPIRED, "Cookie has expired");
        }

        byte[] payload;
        try {
            payload = DECODER.decode(parts[1]);
        } catch (IllegalArgumentException e) {
            throw new SessionCodecException(Reason.MALFORMED, "Cookie payload is not valid base64", e);
        }
        if (blockKey != null) {
            payload = decrypt(payload);
        }
        return new String(payload, StandardCharsets.UTF_8);
    }

    private byte[] mac(String name, long timestamp, String encodedPayload) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(hashKey);
            return mac.doFinal((name + "|" + timestamp + "|" + encodedPayload).getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }

    private byte[] encrypt(byte[] plaintext) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, blockKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            // Pack: [IV][ciphertext+authTag]
            return ByteBuffer.allocate(IV_LENGTH + ciphertext.length)
                    .put(iv)
                    .put(ciphertext)
                    .array();
        } catch (GeneralSecurityException e) {
            throw new SessionCodecException(Reason.ENCRYPTION_FAILED, "Failed to encrypt cookie value", e);
        }
    }

    private byte[] decrypt(byte[] data) {
        if (data.length <= IV_LENGTH) {
            throw new SessionCodecException(Reason.DECRYPTION_FAILED, "Cookie payload is too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, blockKey, new GCMParameterSpec(TAG_LENGTH_BITS, data, 0, IV_LENGTH));
            return cipher.doFinal(data, IV_LENGTH, data.length - IV_LENGTH);
        } catch (AEADBadTagException e) {
            throw new SessionCodecException(Reason.DECRYPTION_FAILED, "Cookie payload failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new SessionCodecException(Reason.DECRYPTION_FAILED, "Failed to decrypt cookie value", e);
        }
    }

    @Override
    public void maxAge(int seconds) {
        this.maxAge = seconds;
    }

    @Override
    public int maxAge() {
        return maxAge;
    }

    public int minAge() {
        return minAge;
    }

    /**
     * Reject values issued less than {@code seconds} ago; zero disables the check.
     */
    public SecureCookieCodec minAge(int seconds) {
        this.minAge = seconds;
        return this;
    }

    public int maxLength() {
        return maxLength;
    }

    /**
     * Limit the length of encoded values; zero disables the check.
     */
    public SecureCookieCodec maxLength(int length) {
        this.maxLength = length;
        return this;
    }

    /** Returns true if values are encrypted as well as signed. */
    public boolean encrypts() {
        return blockKey != null;
    }

    @Override
    public String toString() {
        return "SecureCookieCodec{encrypts=" + encrypts() + ", maxAge=" + maxAge + "}";
    }
}
