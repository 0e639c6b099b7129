package dustin.washco.domains.auth.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

import jakarta.servlet.ServletException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 전역 예외 처리기
 * Global Exception Handler
 *
 * 응답 형식: {"error": "<코드>", "message": "<메시지>"}
 * 내부 예외 메시지 및 스택 트레이스는 응답에 포함하지 않음
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    @ExceptionHandler(AuthException.class)
    public ResponseEntity<Map<String, Object>> handleAuthException(AuthException e) {
        AuthErrorCode code = e.getErrorCode();
        if (code.getStatus().is5xxServerError()) {
            log.error("[GlobalExceptionHandler] 인증 처리 중 내부 오류: code={}", code, e);
        } else {
            log.debug("[GlobalExceptionHandler] 인증 실패: code={}, message={}", code, e.getMessage());
        }
        return ResponseEntity.status(code.getStatus()).body(body(code, e.getMessage()));
    }
    
    /**
     * 요청 본문 검증 실패
     * Request body validation failure
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        Map<String, String> details = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            details.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        
        Map<String, Object> error = body(AuthErrorCode.VALIDATION_FAILED, AuthErrorCode.VALIDATION_FAILED.getDefaultMessage());
        error.put("details", details);
        return ResponseEntity.badRequest().body(error);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(body(AuthErrorCode.BAD_REQUEST, "Malformed request body."));
    }
    
    /**
     * Spring MVC 요청 오류 (지원하지 않는 메서드/미디어 타입, 없는 경로 등)
     * Spring MVC request errors keep their own status
     *
     * 404는 NOT_FOUND, 그 외 4xx는 BAD_REQUEST
     */
    @ExceptionHandler({ServletException.class, ErrorResponseException.class})
    public ResponseEntity<Map<String, Object>> handleFrameworkError(Exception e) {
        if (!(e instanceof ErrorResponse)) {
            return handleUnexpected(e);
        }
        ErrorResponse errorResponse = (ErrorResponse) e;
        HttpStatusCode status = errorResponse.getStatusCode();
        if (!status.is4xxClientError()) {
            return handleUnexpected(e);
        }

        AuthErrorCode code = status.value() == HttpStatus.NOT_FOUND.value()
                ? AuthErrorCode.NOT_FOUND
                : AuthErrorCode.BAD_REQUEST;
        String detail = errorResponse.getBody().getDetail();
        log.debug("[GlobalExceptionHandler] 요청 오류: status={}, detail={}", status.value(), detail);

        return ResponseEntity.status(status)
                .headers(errorResponse.getHeaders())
                .body(body(code, detail != null ? detail : code.getDefaultMessage()));
    }
    
    /**
     * 예상하지 못한 예외 (DB 연결 오류 등)
     * Unexpected failures such as store connectivity errors
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("[GlobalExceptionHandler] 처리되지 않은 예외", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(AuthErrorCode.INTERNAL_ERROR, AuthErrorCode.INTERNAL_ERROR.getDefaultMessage()));
    }
    
    private Map<String, Object> body(AuthErrorCode code, String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", code.name());
        error.put("message", message);
        return error;
    }
}
