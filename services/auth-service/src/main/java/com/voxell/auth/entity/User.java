package com.voxell.auth.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * User - JPA Entity representing a registered Voxell player.
 *
 * This entity maps to the 'player_users' table (see V1__create_player_users.sql)
 * and is the single identity record of the service.
 *
 * Table Schema:
 * - id: UUID primary key (generated before insert)
 * - email: Unique, normalized email address (login identifier)
 * - password_hash: Self-describing Argon2id (or legacy bcrypt) hash
 * - nickname: Display name, 3-32 characters
 * - avatar_url: Optional avatar image URL
 * - is_active: Account activity flag
 * - created_at / updated_at: Maintained by Hibernate
 *
 * Roles live in 'player_user_roles' and default to {"player"}.
 *
 * Lifecycle:
 * - Created on registration (via AuthService.register), email immutable afterwards
 * - Never deleted by this service
 *
 * The password hash must never leave the service; responses are built
 * through {@link com.voxell.auth.dto.ProfileResponse#from(User)}.
 *
 * @see com.voxell.auth.store.UserStore for the storage contract
 */
@Entity
@Table(name = "player_users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "passwordHash")
public class User {

    public static final String DEFAULT_ROLE = "player";

    @Id
    @Column(name = "id", columnDefinition = "UUID")
    private UUID id;

    @Column(name = "email", unique = true, nullable = false, updatable = false)
    private String email;

    @Column(name = "password_hash", nullable = false)
    private String passwordHash;

    @Column(name = "nickname", nullable = false, length = 32)
    private String nickname;

    @Column(name = "avatar_url")
    private String avatarUrl;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "player_user_roles", joinColumns = @JoinColumn(name = "user_id"))
    @Column(name = "role", nullable = false, length = 32)
    @Builder.Default
    private Set<String> roles = new LinkedHashSet<>(Set.of(DEFAULT_ROLE));

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
