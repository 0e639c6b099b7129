package dustin.washco.domains.auth.identity;

/**
 * ID 토큰 검증 실패
 * Identity assertion rejected
 */
public class InvalidAssertionException extends RuntimeException {

    public InvalidAssertionException(String message) {
        super(message);
    }

    public InvalidAssertionException(String message, Throwable cause) {
        super(message, cause);
    }
}
