package com.voxell.auth.exception;

import lombok.Getter;

/**
 * Failure raised by the authentication core and the user store.
 *
 * Always carries an {@link AuthErrorCode}; the message is the code's
 * caller-facing detail so it can be returned as-is.
 */
@Getter
public class AuthException extends RuntimeException {

    private final AuthErrorCode code;

    public AuthException(AuthErrorCode code) {
        super(code.getDetail());
        this.code = code;
    }

    public AuthException(AuthErrorCode code, Throwable cause) {
        super(code.getDetail(), cause);
        this.code = code;
    }

    public static AuthException duplicateEmail() {
        return new AuthException(AuthErrorCode.DUPLICATE_EMAIL);
    }

    public static AuthException invalidCredentials() {
        return new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
    }

    public static AuthException invalidToken() {
        return new AuthException(AuthErrorCode.INVALID_TOKEN);
    }

    public static AuthException userNotFound() {
        return new AuthException(AuthErrorCode.USER_NOT_FOUND);
    }

    public static AuthException rejectedRecord(Throwable cause) {
        return new AuthException(AuthErrorCode.REJECTED_RECORD, cause);
    }

    public static AuthException storeUnavailable(Throwable cause) {
        return new AuthException(AuthErrorCode.STORE_UNAVAILABLE, cause);
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }
}
