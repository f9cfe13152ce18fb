package com.voxell.auth.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Stable, caller-facing failure codes of the authentication service.
 *
 * INVALID_CREDENTIALS covers both an unknown email and a wrong password so
 * the response never reveals which accounts exist.
 */
@Getter
public enum AuthErrorCode {

    DUPLICATE_EMAIL(HttpStatus.BAD_REQUEST, "Email is already registered", false),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid login credentials", false),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid token", false),
    USER_NOT_FOUND(HttpStatus.NOT_FOUND, "User not found", false),
    REJECTED_RECORD(HttpStatus.UNPROCESSABLE_ENTITY, "Player data was rejected by the user store", false),
    STORE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "User store is temporarily unavailable", true);

    private final HttpStatus status;
    private final String detail;
    private final boolean retryable;

    AuthErrorCode(HttpStatus status, String detail, boolean retryable) {
        this.status = status;
        this.detail = detail;
        this.retryable = retryable;
    }
}
