package com.voxell.auth.repository;

import com.voxell.auth.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * UserRepository - Spring Data access to the player_users table.
 *
 * Used only by {@link com.voxell.auth.store.JpaUserStore}; the rest of the
 * service talks to the {@link com.voxell.auth.store.UserStore} contract.
 *
 * Query: findByEmail -> SELECT * FROM player_users WHERE email = ?
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find a player by normalized email address.
     *
     * @param email The email address to search for (already lower-cased)
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByEmail(String email);
}
