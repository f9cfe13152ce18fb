package com.voxell.auth.controller;

import com.voxell.auth.dto.LoginRequest;
import com.voxell.auth.dto.ProfileResponse;
import com.voxell.auth.dto.RegisterRequest;
import com.voxell.auth.dto.TokenRequest;
import com.voxell.auth.dto.TokenResponse;
import com.voxell.auth.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * AuthController - REST API endpoints for player authentication.
 *
 * Endpoints:
 * - POST /auth/register - Create a player and return a bearer token
 * - POST /auth/login    - Exchange email/password for a bearer token
 * - POST /me            - Resolve a bearer token to the player's profile
 *
 * Error Handling (see ApiExceptionHandler):
 * - 400 Bad Request: Email already registered
 * - 401 Unauthorized: Invalid credentials or token
 * - 404 Not Found: Token is valid but the player no longer exists
 * - 422 Unprocessable Entity: Request body failed validation or the store rejected the record
 * - 503 Service Unavailable: User store unreachable or timed out (retryable)
 *
 * @see AuthService for business logic
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new player and return a bearer token for them.
     *
     * Flow:
     * 1. Body is validated (email format, nickname 3-32 chars, avatar URL)
     * 2. AuthService rejects an already registered email with 400
     * 3. The player is stored with role "player" and a token is issued
     *
     * @param request Email, password, nickname and optional avatar_url
     * @return TokenResponse with access_token and token_type "bearer"
     */
    @PostMapping("/auth/register")
    public ResponseEntity<TokenResponse> register(@Valid @RequestBody RegisterRequest request) {
        String token = authService.register(
                request.getEmail(), request.getPassword(), request.getNickname(), request.getAvatarUrl());
        return ResponseEntity.ok(TokenResponse.bearer(token));
    }

    /**
     * Authenticate a player with email and password.
     *
     * Unknown email and wrong password both answer 401 with the same body,
     * so the endpoint cannot be used to discover registered emails.
     *
     * @param request Email and password
     * @return TokenResponse with a freshly issued access_token
     */
    @PostMapping("/auth/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request) {
        String token = authService.login(request.getEmail(), request.getPassword());
        return ResponseEntity.ok(TokenResponse.bearer(token));
    }

    /**
     * Resolve a bearer token to the player's public profile.
     *
     * The token travels in the body rather than an Authorization header so
     * game clients without header control can call it.
     *
     * @param request Body carrying the token issued by register or login
     * @return ProfileResponse (id, email, nickname, avatar_url, roles), never the password hash
     */
    @PostMapping("/me")
    public ResponseEntity<ProfileResponse> me(@Valid @RequestBody TokenRequest request) {
        return ResponseEntity.ok(authService.resolveProfile(request.getToken()));
    }
}
