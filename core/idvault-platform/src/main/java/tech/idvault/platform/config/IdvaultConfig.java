package tech.idvault.platform.config;

import io.smallrye.config.ConfigMapping;

/**
 * Key material for the platform. Loaded once at startup and read-only afterwards.
 */
@ConfigMapping(prefix = "idvault")
public interface IdvaultConfig {

    Auth auth();

    Encryption encryption();

    interface Auth {

        /**
         * Shared HMAC secret used to sign and verify session tokens.
         * Must be at least 32 bytes.
         */
        String signingSecret();
    }

    interface Encryption {

        /**
         * AES-256 key for email encryption, exactly 32 bytes (UTF-8).
         */
        String key();
    }
}
