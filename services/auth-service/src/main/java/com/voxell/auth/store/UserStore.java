package com.voxell.auth.store;

import com.voxell.auth.entity.User;

import java.util.Optional;

/**
 * Document repository of players keyed by email.
 *
 * Implementations guarantee single-record atomicity only. Every call is bounded
 * in time; timeouts and connectivity failures surface as
 * {@link com.voxell.auth.exception.AuthErrorCode#STORE_UNAVAILABLE}, never as
 * an empty result.
 */
public interface UserStore {

    /**
     * @param email normalized email
     * @return the player, or empty if no player has this email
     */
    Optional<User> findByEmail(String email);

    /**
     * Inserts a new player. All-or-nothing: on failure no record is left behind.
     *
     * @param user player without id
     * @return the stored player, with id and timestamps assigned
     * @throws com.voxell.auth.exception.AuthException DUPLICATE_EMAIL if the email is taken,
     *         REJECTED_RECORD if the record violates another data constraint
     */
    User insert(User user);

    /**
     * @return number of registered players
     */
    long count();
}
