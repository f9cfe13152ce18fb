package com.voxell.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

/**
 * RegisterRequest - Payload of POST /auth/register.
 *
 * <pre>
 * {
 *   "email": "player@example.com",
 *   "password": "securePassword123",
 *   "nickname": "Alice",
 *   "avatar_url": "https://cdn.example.com/a.png"
 * }
 * </pre>
 *
 * Validation:
 * - email: non-blank, valid format
 * - password: non-blank
 * - nickname: 3 to 32 characters
 * - avatar_url: optional, a well-formed URL of at most 2048 characters
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank
    @Email
    private String email;

    @NotBlank
    private String password;

    @NotBlank
    @Size(min = 3, max = 32)
    private String nickname;

    @URL
    @Size(max = 2048)
    @JsonProperty("avatar_url")
    private String avatarUrl;
}
