package com.voxell.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * AuthProperties - Process-wide authentication configuration bound from the {@code auth.*} keys.
 *
 * Bound once at startup and handed to {@link SecurityConfig}, which builds the
 * password hasher and token codec from it. Nothing mutates it afterwards.
 *
 * Example (application.yml):
 * <pre>
 * auth:
 *   token:
 *     secret: ${SECRET_KEY:}
 *     expiration: 7d
 *   hashing:
 *     memory-kib: 19456
 *   store:
 *     timeout: 5s
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private Token token = new Token();

    private Hashing hashing = new Hashing();

    private Store store = new Store();

    @Data
    public static class Token {

        /**
         * HMAC-SHA256 signing secret, at least 32 bytes.
         * Blank means the insecure development default is used.
         */
        private String secret;

        /**
         * Token lifetime. Zero or negative disables the exp claim entirely,
         * so issued tokens never expire.
         */
        private Duration expiration = Duration.ofDays(7);
    }

    /**
     * Argon2id cost parameters. Defaults follow the OWASP minimum
     * (19 MiB, 2 iterations, 1 lane).
     */
    @Data
    public static class Hashing {

        private int memoryKib = 19456;

        private int iterations = 2;

        private int parallelism = 1;

        private int saltLength = 16;

        private int hashLength = 32;
    }

    @Data
    public static class Store {

        /** Upper bound for every user store transaction. */
        private Duration timeout = Duration.ofSeconds(5);
    }
}
