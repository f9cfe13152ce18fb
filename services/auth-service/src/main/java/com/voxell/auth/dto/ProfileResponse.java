package com.voxell.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.voxell.auth.entity.User;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * ProfileResponse - Public projection of a player, returned by POST /me.
 *
 * <pre>
 * {
 *   "id": "123e4567-e89b-12d3-a456-426614174000",
 *   "email": "a@x.com",
 *   "nickname": "Alice",
 *   "avatar_url": null,
 *   "roles": ["player"]
 * }
 * </pre>
 *
 * Deliberately has no password hash field: this type is the only way a
 * {@link User} leaves the service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {

    private String id;

    private String email;

    private String nickname;

    @JsonProperty("avatar_url")
    private String avatarUrl;

    private List<String> roles;

    /**
     * Roles are sorted so the output is stable regardless of how the set was loaded.
     * A player stored without roles is reported with the default role.
     */
    public static ProfileResponse from(User user) {
        List<String> roles = user.getRoles() == null || user.getRoles().isEmpty()
                ? List.of(User.DEFAULT_ROLE)
                : user.getRoles().stream().sorted().toList();
        return ProfileResponse.builder()
                .id(String.valueOf(user.getId()))
                .email(user.getEmail())
                .nickname(user.getNickname())
                .avatarUrl(user.getAvatarUrl())
                .roles(roles)
                .build();
    }
}
