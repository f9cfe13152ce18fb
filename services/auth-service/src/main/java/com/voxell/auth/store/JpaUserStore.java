package com.voxell.auth.store;

import com.voxell.auth.config.AuthProperties;
import com.voxell.auth.entity.User;
import com.voxell.auth.exception.AuthException;
import com.voxell.auth.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * JpaUserStore - {@link UserStore} backed by Spring Data JPA.
 *
 * Each call runs in its own transaction bounded by {@code auth.store.timeout}.
 * The unique constraint on player_users.email is the final arbiter of
 * duplicate registrations. Any failed insert is re-checked by email: if the
 * email is now present the caller gets DUPLICATE_EMAIL, whether the database
 * reported a unique violation or (for a concurrent, still uncommitted insert)
 * a concurrency failure. With the email absent, a constraint violation such as
 * an oversized column becomes REJECTED_RECORD and anything else
 * STORE_UNAVAILABLE. Read failures (including timeouts) are always
 * STORE_UNAVAILABLE.
 */
@Slf4j
@Component
public class JpaUserStore implements UserStore {

    private final UserRepository userRepository;
    private final TransactionTemplate readTemplate;
    private final TransactionTemplate writeTemplate;

    public JpaUserStore(UserRepository userRepository,
                        PlatformTransactionManager transactionManager,
                        AuthProperties properties) {
        this.userRepository = userRepository;
        int timeoutSeconds = (int) Math.max(1, properties.getStore().getTimeout().toSeconds());

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(timeoutSeconds);

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(timeoutSeconds);
    }

    /**
     * Look up a player by email in a read-only transaction.
     *
     * @param email Normalized email address
     * @return Optional containing the player if found, empty Optional if not
     * @throws AuthException STORE_UNAVAILABLE on timeout or connectivity failure
     */
    @Override
    public Optional<User> findByEmail(String email) {
        return guarded("findByEmail", () -> readTemplate.execute(status -> userRepository.findByEmail(email)));
    }

    /**
     * Insert a new player in its own write transaction.
     *
     * A failed insert is attributed to a duplicate registration only if the
     * email is found when re-read afterwards; otherwise the failure keeps its
     * own code (REJECTED_RECORD for constraint violations, STORE_UNAVAILABLE
     * for everything else).
     *
     * @param user Player without id
     * @return The stored player with id and timestamps assigned
     * @throws AuthException DUPLICATE_EMAIL, REJECTED_RECORD or STORE_UNAVAILABLE
     */
    @Override
    public User insert(User user) {
        try {
            return writeTemplate.execute(status -> userRepository.saveAndFlush(user));
        } catch (DataIntegrityViolationException e) {
            if (emailTaken(user.getEmail())) {
                log.info("Insert rejected by unique constraint for email: {}", user.getEmail());
                throw AuthException.duplicateEmail();
            }
            log.warn("Insert rejected by a data constraint for email {}: {}", user.getEmail(), e.getMessage());
            throw AuthException.rejectedRecord(e);
        } catch (DataAccessException | TransactionException e) {
            if (emailTaken(user.getEmail())) {
                log.info("Insert lost a concurrent registration race for email: {}", user.getEmail());
                throw AuthException.duplicateEmail();
            }
            log.error("User store insert failed: {}", e.getMessage());
            throw AuthException.storeUnavailable(e);
        }
    }

    /**
     * Count registered players.
     *
     * @return Number of rows in player_users
     * @throws AuthException STORE_UNAVAILABLE on timeout or connectivity failure
     */
    @Override
    public long count() {
        Long count = guarded("count", () -> readTemplate.execute(status -> userRepository.count()));
        return count == null ? 0L : count;
    }

    private boolean emailTaken(String email) {
        return findByEmail(email).isPresent();
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException | TransactionException e) {
            log.error("User store {} failed: {}", operation, e.getMessage());
            throw AuthException.storeUnavailable(e);
        }
    }
}
