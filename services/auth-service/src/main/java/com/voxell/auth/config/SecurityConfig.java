package com.voxell.auth.config;

import com.voxell.auth.security.PasswordHasher;
import com.voxell.auth.security.TokenCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;

/**
 * SecurityConfig - Builds the credential primitives from {@link AuthProperties}.
 *
 * Both beans are created once at startup and are immutable afterwards.
 *
 * Secret resolution:
 * - auth.token.secret set: used as-is (must be at least 32 bytes)
 * - unset, non-production: {@link #INSECURE_DEFAULT_SECRET} with a warning
 * - unset, "prod" profile active: startup fails
 */
@Slf4j
@Configuration
public class SecurityConfig {

    static final String INSECURE_DEFAULT_SECRET = "INSECURE-dev-secret-key-change-me-before-deploying";

    static final String PRODUCTION_PROFILE = "prod";

    @Bean
    public PasswordHasher passwordHasher(AuthProperties properties) {
        AuthProperties.Hashing hashing = properties.getHashing();
        log.info("Password hashing: argon2id m={}KiB t={} p={}",
                hashing.getMemoryKib(), hashing.getIterations(), hashing.getParallelism());
        return new PasswordHasher(hashing);
    }

    @Bean
    public TokenCodec tokenCodec(AuthProperties properties, Environment environment) {
        String secret = resolveSecret(properties.getToken(), environment);
        TokenCodec codec = new TokenCodec(secret, properties.getToken().getExpiration());
        if (codec.expiresTokens()) {
            log.info("Issued tokens expire after {}", properties.getToken().getExpiration());
        } else {
            log.warn("Token expiration disabled: issued tokens never expire");
        }
        return codec;
    }

    static String resolveSecret(AuthProperties.Token token, Environment environment) {
        String secret = token.getSecret();
        if (secret != null && !secret.isBlank()) {
            return secret;
        }
        if (environment.acceptsProfiles(Profiles.of(PRODUCTION_PROFILE))) {
            throw new IllegalStateException(
                    "auth.token.secret (SECRET_KEY) must be configured when the '"
                            + PRODUCTION_PROFILE + "' profile is active");
        }
        log.warn("auth.token.secret is not set: using the INSECURE built-in development secret. "
                + "Anyone can forge tokens for this instance. Set SECRET_KEY before deploying.");
        return INSECURE_DEFAULT_SECRET;
    }
}
