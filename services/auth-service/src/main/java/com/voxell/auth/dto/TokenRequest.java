package com.voxell.auth.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TokenRequest - Payload of POST /me, carrying a previously issued bearer token.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenRequest {

    @NotBlank
    private String token;
}
