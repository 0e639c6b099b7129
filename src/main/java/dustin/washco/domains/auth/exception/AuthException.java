package dustin.washco.domains.auth.exception;

/**
 * 인증 관련 예외
 * Authentication-related exception
 */
public class AuthException extends RuntimeException {
    
    private final AuthErrorCode errorCode;
    
    public AuthException(AuthErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }
    
    public AuthException(AuthErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public AuthException(AuthErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public AuthErrorCode getErrorCode() {
        return errorCode;
    }
}
