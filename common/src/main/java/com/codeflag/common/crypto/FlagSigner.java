package com.codeflag.common.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Computes flags: lowercase hex HMAC-SHA256 of a program's standard output.
 *
 * The key is used as its UTF-8 bytes, not base64-decoded, so a flag can be
 * reproduced by anyone holding the key string with any HMAC tool.
 */
public final class FlagSigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int GENERATED_KEY_BYTES = 32;

    private final SecretKeySpec key;

    public FlagSigner(String signatureKey) {
        if (signatureKey == null || signatureKey.isEmpty()) {
            throw new IllegalArgumentException("Signature key is empty");
        }
        this.key = new SecretKeySpec(signatureKey.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public static String generateKey() {
        byte[] raw = new byte[GENERATED_KEY_BYTES];
        new SecureRandom().nextBytes(raw);
        return Base64.getUrlEncoder().encodeToString(raw);
    }

    /** @param stdout program output; null is treated as the empty string */
    public String sign(String stdout) {
        String output = stdout == null ? "" : stdout;
        try {
            // Mac instances are not thread-safe; one per call.
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(output.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute flag", e);
        }
    }
}
