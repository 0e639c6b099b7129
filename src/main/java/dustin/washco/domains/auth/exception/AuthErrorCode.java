package dustin.washco.domains.auth.exception;

import org.springframework.http.HttpStatus;

/**
 * 인증 오류 코드
 * Authentication error codes
 *
 * 응답의 "error" 필드로 그대로 노출되는 안정적인 식별자
 */
public enum AuthErrorCode {
    ACCOUNT_EXISTS(HttpStatus.CONFLICT, "An account with this email or phone already exists."),
    INVALID_CREDENTIALS(HttpStatus.UNAUTHORIZED, "Invalid credentials."),
    NOT_CONFIGURED(HttpStatus.BAD_REQUEST, "Google Sign-In is not configured."),
    BAD_REQUEST(HttpStatus.BAD_REQUEST, "Bad request."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "Refresh token required."),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid refresh token."),
    TOKEN_REVOKED(HttpStatus.UNAUTHORIZED, "Refresh token has been revoked."),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Refresh token has expired."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "User not found."),
    INVALID_ACCESS_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid access token."),
    ACCESS_TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "Access token has expired."),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "Request validation failed."),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error.");

    private final HttpStatus status;
    private final String defaultMessage;

    AuthErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
