package com.codeflag.scheduler.crypto;

import com.codeflag.common.crypto.FernetCipher;
import com.codeflag.common.crypto.InvalidTokenException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Decrypts a settings token and extracts the recognised numeric overrides.
 *
 * Only {@code memory_limit}, {@code compile_timeout} and {@code run_timeout}
 * are read, and only when they are JSON numbers (fractions are truncated).
 * Any other key, or a recognised key with a non-numeric or out-of-int-range
 * value, is ignored.
 */
public class SettingsDecoder {

    private final FernetCipher cipher;
    private final ObjectMapper json;
    private final Duration     ttl;

    public SettingsDecoder(FernetCipher cipher, ObjectMapper json, Duration ttl) {
        this.cipher = cipher;
        this.json   = json;
        this.ttl    = ttl;
    }

    /**
     * @throws SettingsException if the token is not trustworthy or its payload is not a JSON object
     */
    public ExecutionOverrides decode(String token) {
        byte[] plain;
        try {
            plain = cipher.decrypt(token, ttl);
        } catch (InvalidTokenException e) {
            throw new SettingsException(SettingsException.Kind.INVALID_TOKEN,
                    "Invalid encrypted settings token.", e);
        }

        JsonNode root;
        try {
            root = json.readTree(new String(plain, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new SettingsException(SettingsException.Kind.MALFORMED_JSON,
                    "Decrypted settings is not valid JSON.", e);
        }
        if (root == null || !root.isObject()) {
            throw new SettingsException(SettingsException.Kind.NOT_AN_OBJECT,
                    "Decrypted settings is not a JSON object.", null);
        }

        return new ExecutionOverrides(
                intOrNull(root, "memory_limit"),
                intOrNull(root, "compile_timeout"),
                intOrNull(root, "run_timeout"));
    }

    private static Integer intOrNull(JsonNode root, String field) {
        JsonNode value = root.get(field);
        return value != null && value.isNumber() && value.canConvertToInt() ? value.intValue() : null;
    }
}
