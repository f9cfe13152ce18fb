package com.voxell.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * TokenResponse - Returned by register and login.
 *
 * <pre>
 * {
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "token_type": "bearer"
 * }
 * </pre>
 *
 * The access token is opaque to clients.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenResponse {

    public static final String BEARER = "bearer";

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("token_type")
    private String tokenType = BEARER;

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, BEARER);
    }
}
