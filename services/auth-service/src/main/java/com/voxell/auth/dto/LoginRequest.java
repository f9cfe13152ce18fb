package com.voxell.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginRequest - Payload of POST /auth/login.
 *
 * <pre>
 * {
 *   "email": "player@example.com",
 *   "password": "securePassword123"
 * }
 * </pre>
 *
 * Never log or persist the password field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    @Email
    private String email;

    @NotBlank
    private String password;
}
