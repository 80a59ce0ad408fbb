package com.codeflag.common.crypto;

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;

/**
 * Fernet tokens: AES-128-CBC encryption authenticated with HMAC-SHA256.
 *
 * <pre>
 *   token = base64url( 0x80 | timestamp(8, big-endian) | iv(16) | ciphertext | hmac(32) )
 *   key   = base64url( signingKey(16) | encryptionKey(16) )
 * </pre>
 *
 * The layout is the published Fernet format, so tokens minted by any
 * conforming implementation with the same key decrypt here. The MAC is
 * checked before any decryption is attempted.
 */
public final class FernetCipher {

    private static final byte VERSION = (byte) 0x80;
    private static final int KEY_BYTES = 32;
    private static final int HALF_KEY_BYTES = 16;
    private static final int TIMESTAMP_BYTES = 8;
    private static final int IV_BYTES = 16;
    private static final int BLOCK_BYTES = 16;
    private static final int HMAC_BYTES = 32;
    private static final int HEADER_BYTES = 1 + TIMESTAMP_BYTES + IV_BYTES;
    private static final long MAX_CLOCK_SKEW_SECONDS = 60;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKeySpec signingKey;
    private final SecretKeySpec encryptionKey;
    private final Clock clock;

    public FernetCipher(String base64Key) {
        this(base64Key, Clock.systemUTC());
    }

    public FernetCipher(String base64Key, Clock clock) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalArgumentException("Fernet key is empty");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Fernet key must be url-safe base64", e);
        }
        if (raw.length != KEY_BYTES) {
            throw new IllegalArgumentException(
                    "Fernet key must decode to " + KEY_BYTES + " bytes, got " + raw.length);
        }
        this.signingKey    = new SecretKeySpec(raw, 0, HALF_KEY_BYTES, "HmacSHA256");
        this.encryptionKey = new SecretKeySpec(raw, HALF_KEY_BYTES, HALF_KEY_BYTES, "AES");
        this.clock         = clock;
    }

    /** Generate a fresh random key in the form accepted by the constructor. */
    public static String generateKey() {
        byte[] raw = new byte[KEY_BYTES];
        RANDOM.nextBytes(raw);
        return Base64.getUrlEncoder().encodeToString(raw);
    }

    public String encrypt(String plaintext) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    public String encrypt(byte[] plaintext) {
        byte[] iv = new byte[IV_BYTES];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.ENCRYPT_MODE, encryptionKey, new IvParameterSpec(iv));
            byte[] cipherText = cipher.doFinal(plaintext);

            ByteBuffer token = ByteBuffer.allocate(HEADER_BYTES + cipherText.length + HMAC_BYTES);
            token.put(VERSION);
            token.putLong(clock.instant().getEpochSecond());
            token.put(iv);
            token.put(cipherText);
            token.put(hmac(token.array(), HEADER_BYTES + cipherText.length));
            return Base64.getUrlEncoder().encodeToString(token.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt Fernet token", e);
        }
    }

    /** Decrypt without an age limit. */
    public byte[] decrypt(String token) {
        return decrypt(token, null);
    }

    /**
     * Verify and decrypt a token.
     *
     * @param ttl maximum token age; null, zero or negative disables the check
     * @throws InvalidTokenException on any verification or decryption failure
     */
    public byte[] decrypt(String token, Duration ttl) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        byte[] data;
        try {
            data = Base64.getUrlDecoder().decode(token.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException("Token is not url-safe base64", e);
        }
        int cipherTextLength = data.length - HEADER_BYTES - HMAC_BYTES;
        if (cipherTextLength < BLOCK_BYTES || cipherTextLength % BLOCK_BYTES != 0 || data[0] != VERSION) {
            throw new InvalidTokenException("Token layout is not recognised");
        }

        int macOffset = data.length - HMAC_BYTES;
        byte[] expected;
        try {
            expected = hmac(data, macOffset);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
        if (!MessageDigest.isEqual(expected, Arrays.copyOfRange(data, macOffset, data.length))) {
            throw new InvalidTokenException("Token signature does not match");
        }

        if (ttl != null && !ttl.isZero() && !ttl.isNegative()) {
            long issuedAt = ByteBuffer.wrap(data, 1, TIMESTAMP_BYTES).getLong();
            long now = clock.instant().getEpochSecond();
            if (issuedAt + ttl.getSeconds() < now) {
                throw new InvalidTokenException("Token has expired");
            }
            if (issuedAt > now + MAX_CLOCK_SKEW_SECONDS) {
                throw new InvalidTokenException("Token timestamp is in the future");
            }
        }

        try {
            Cipher cipher = Cipher.getInstance("AES/CBC/PKCS5Padding");
            cipher.init(Cipher.DECRYPT_MODE, encryptionKey,
                    new IvParameterSpec(data, 1 + TIMESTAMP_BYTES, IV_BYTES));
            return cipher.doFinal(data, HEADER_BYTES, cipherTextLength);
        } catch (GeneralSecurityException e) {
            throw new InvalidTokenException("Token could not be decrypted", e);
        }
    }

    private byte[] hmac(byte[] data, int length) throws GeneralSecurityException {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(signingKey);
        mac.update(data, 0, length);
        return mac.doFinal();
    }
}
