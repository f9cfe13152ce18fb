package com.voxell.auth.service;

import com.voxell.auth.dto.ProfileResponse;
import com.voxell.auth.entity.User;
import com.voxell.auth.exception.AuthException;
import com.voxell.auth.security.PasswordHasher;
import com.voxell.auth.security.TokenCodec;
import com.voxell.auth.store.UserStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * AuthService - Core business logic for player registration, login and profile lookup.
 *
 * Key Responsibilities:
 * - Registering players with a hashed password and the default role
 * - Verifying email/password credentials and issuing bearer tokens
 * - Resolving a bearer token back to the player's public profile
 *
 * Failure Model:
 * Every failure leaves this class as an {@link AuthException} carrying a stable
 * code; see {@link com.voxell.auth.exception.AuthErrorCode}.
 *
 * Security Considerations:
 * - Unknown email and wrong password produce the same INVALID_CREDENTIALS
 *   failure, and both pay for one password verification
 * - Emails are trimmed and lower-cased before any lookup
 * - The password hash never leaves the service (see {@link ProfileResponse})
 *
 * Concurrency:
 * Stateless; the existence check in {@link #register} races with concurrent
 * registrations of the same email, and the store's unique constraint decides
 * the winner.
 *
 * @see TokenCodec for token operations
 * @see UserStore for persistence
 */
@Slf4j
@Service
public class AuthService {

    private final UserStore userStore;
    private final PasswordHasher passwordHasher;
    private final TokenCodec tokenCodec;

    /** Verified against when the email is unknown, so both login failures cost the same. */
    private final String decoyHash;

    public AuthService(UserStore userStore, PasswordHasher passwordHasher, TokenCodec tokenCodec) {
        this.userStore = userStore;
        this.passwordHasher = passwordHasher;
        this.tokenCodec = tokenCodec;
        this.decoyHash = passwordHasher.hash(UUID.randomUUID().toString());
    }

    /**
     * Register a new player and sign them in.
     *
     * Flow:
     * 1. Reject if the email is already registered
     * 2. Hash the password
     * 3. Insert the player with roles {"player"} and active = true
     * 4. Issue a token for the email
     *
     * @param email     Player email (normalized here)
     * @param password  Plaintext password
     * @param nickname  Display name
     * @param avatarUrl Optional avatar URL, may be null
     * @return Bearer token for the new player
     * @throws AuthException DUPLICATE_EMAIL if the email is taken, including a lost
     *                       race against a concurrent registration; REJECTED_RECORD if the
     *                       store refuses the record; STORE_UNAVAILABLE
     */
    public String register(String email, String password, String nickname, String avatarUrl) {
        String normalizedEmail = normalizeEmail(email);
        log.info("Registration attempt for email: {}", normalizedEmail);

        if (userStore.findByEmail(normalizedEmail).isPresent()) {
            log.info("Registration rejected, email already registered: {}", normalizedEmail);
            throw AuthException.duplicateEmail();
        }

        User user = User.builder()
                .email(normalizedEmail)
                .passwordHash(passwordHasher.hash(password))
                .nickname(nickname)
                .avatarUrl(avatarUrl)
                .build();

        User stored = userStore.insert(user);
        log.info("Registered player {} ({})", stored.getId(), normalizedEmail);

        return tokenCodec.issue(normalizedEmail);
    }

    /**
     * Authenticate a player with email and password.
     *
     * @param email    Player email (normalized here)
     * @param password Plaintext password
     * @return Bearer token for the player
     * @throws AuthException INVALID_CREDENTIALS for an unknown email or a wrong
     *                       password alike; STORE_UNAVAILABLE
     */
    public String login(String email, String password) {
        String normalizedEmail = normalizeEmail(email);
        Optional<User> user = userStore.findByEmail(normalizedEmail);

        String storedHash = user.map(User::getPasswordHash).orElse(decoyHash);
        boolean passwordMatches = passwordHasher.verify(password, storedHash);

        if (user.isEmpty() || !passwordMatches) {
            log.warn("Failed login for email: {}", normalizedEmail);
            throw AuthException.invalidCredentials();
        }

        log.info("Player authenticated successfully: {}", user.get().getId());
        return tokenCodec.issue(normalizedEmail);
    }

    /**
     * Resolve a bearer token to the player's public profile.
     *
     * @param token Token previously issued by {@link #register} or {@link #login}
     * @return Profile projection, never containing the password hash
     * @throws AuthException INVALID_TOKEN if the token does not verify;
     *                       USER_NOT_FOUND if the player no longer exists; STORE_UNAVAILABLE
     */
    public ProfileResponse resolveProfile(String token) {
        String email = tokenCodec.verify(token)
                .orElseThrow(AuthException::invalidToken);

        User user = userStore.findByEmail(email)
                .orElseThrow(() -> {
                    log.warn("Valid token for unknown player: {}", email);
                    return AuthException.userNotFound();
                });

        return ProfileResponse.from(user);
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
