package com.voxell.auth.security;

import com.voxell.auth.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/**
 * PasswordHasher - One-way salted hashing and verification of player passwords.
 *
 * New hashes use Argon2id, a memory-hard function. The output is
 * self-describing: algorithm, version, cost parameters and the random salt are
 * embedded in the PHC string, e.g.
 * <pre>
 * $argon2id$v=19$m=19456,t=2,p=1$c2FsdHNhbHRzYWx0$aGFzaGhhc2hoYXNo...
 * </pre>
 * so a hash stays verifiable after the configured parameters change.
 *
 * Records created by the previous deployment carry bcrypt hashes
 * ($2a$, $2b$, $2y$); those are still accepted by {@link #verify}.
 *
 * Thread-safe; a single instance is shared by all requests.
 */
@Slf4j
public class PasswordHasher {

    private static final String BCRYPT_PREFIX = "$2";

    private final Argon2PasswordEncoder argon2;
    private final BCryptPasswordEncoder legacyBcrypt = new BCryptPasswordEncoder();

    public PasswordHasher(AuthProperties.Hashing config) {
        this.argon2 = new Argon2PasswordEncoder(
                config.getSaltLength(),
                config.getHashLength(),
                config.getParallelism(),
                config.getMemoryKib(),
                config.getIterations());
    }

    /**
     * Hash a plaintext password with a fresh random salt.
     *
     * @param password Plaintext password, never null
     * @return Argon2id PHC string; two calls with the same password differ
     */
    public String hash(String password) {
        return argon2.encode(password);
    }

    /**
     * Check a plaintext password against a stored hash in constant time.
     *
     * A null, empty or malformed hash never raises; it simply does not match.
     * This includes PHC strings whose parameters the Argon2 engine refuses
     * (zero lanes, too little memory, truncated salt or digest).
     *
     * @param password Candidate plaintext password
     * @param hash     Stored hash string
     * @return true only if the password produced the hash
     */
    public boolean verify(String password, String hash) {
        if (password == null || hash == null || hash.isEmpty()) {
            return false;
        }
        try {
            if (hash.startsWith(BCRYPT_PREFIX)) {
                return legacyBcrypt.matches(password, hash);
            }
            return argon2.matches(password, hash);
        } catch (RuntimeException e) {
            log.debug("Stored password hash could not be parsed: {}", e.getMessage());
            return false;
        }
    }
}
