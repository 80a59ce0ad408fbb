package com.codeflag.scheduler.crypto;

import com.codeflag.common.crypto.FernetCipher;
import com.codeflag.common.crypto.FlagSigner;
import com.codeflag.scheduler.config.SchedulerProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the two independent keys: the settings cipher and the flag signer.
 *
 * A missing or unusable key does not stop the application from starting;
 * it is logged once here and every submission is then refused with 500
 * (see {@link #isConfigured()}).
 */
@Component
public class CryptoKeys {

    private static final Logger log = LoggerFactory.getLogger(CryptoKeys.class);

    private final SettingsDecoder settingsDecoder;
    private final FlagSigner      flagSigner;

    public CryptoKeys(SchedulerProperties props, ObjectMapper objectMapper) {
        this.settingsDecoder = buildDecoder(props, objectMapper);
        this.flagSigner      = buildSigner(props);
    }

    public boolean isConfigured() {
        return settingsDecoder != null && flagSigner != null;
    }

    public SettingsDecoder settingsDecoder() {
        if (settingsDecoder == null) {
            throw new IllegalStateException("Encryption key not set or Fernet cipher not initialized.");
        }
        return settingsDecoder;
    }

    public FlagSigner flagSigner() {
        if (flagSigner == null) {
            throw new IllegalStateException("Signature key not set.");
        }
        return flagSigner;
    }

    private static SettingsDecoder buildDecoder(SchedulerProperties props, ObjectMapper objectMapper) {
        if (isBlank(props.encryptionKey())) {
            log.error("ENCRYPTION_KEY is not set. Submissions will be refused.");
            return null;
        }
        try {
            SettingsDecoder decoder = new SettingsDecoder(
                    new FernetCipher(props.encryptionKey()), objectMapper, props.settingsTtl());
            log.info("Fernet cipher initialized.");
            return decoder;
        } catch (IllegalArgumentException e) {
            log.error("Failed to initialize Fernet cipher with provided key: {}. Submissions will be refused.",
                    e.getMessage());
            return null;
        }
    }

    private static FlagSigner buildSigner(SchedulerProperties props) {
        if (isBlank(props.signatureKey())) {
            log.error("SIGNATURE_KEY is not set. Submissions will be refused.");
            return null;
        }
        return new FlagSigner(props.signatureKey());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
