package dustin.clearing.shared.exception;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

/**
 * 전역 예외 처리기
 * Global Exception Handler
 *
 * ErrorKind → HTTP 상태 코드:
 * - CALLER_ERROR → 400
 * - NOT_FOUND → 404
 * - RETRYABLE → 503
 * - FATAL_CONSISTENCY → 500
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<Map<String, String>> handleSettlementException(SettlementException e) {
        ErrorKind kind = e.getKind();
        if (kind == ErrorKind.FATAL_CONSISTENCY) {
            log.error("[GlobalExceptionHandler] 정합성 오류: code={}, message={}", e.getErrorCode(), e.getMessage(), e);
        } else {
            log.warn("[GlobalExceptionHandler] 요청 실패: code={}, message={}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(kind.getHttpStatus())
                .body(body(e.getMessage(), e.getErrorCode().name(), kind));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(message, ErrorCode.INVALID_REQUEST.name(), ErrorKind.CALLER_ERROR));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadableBody(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof SettlementException) {
            return handleSettlementException((SettlementException) cause);
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("Malformed request body: " + cause.getMessage(), ErrorCode.MALFORMED_REQUEST.name(), ErrorKind.CALLER_ERROR));
    }

    /**
     * DB 제약 위반 (길이 초과, 유일성 등): 요청 값 문제로 보고 400
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, String>> handleDataIntegrityViolation(DataIntegrityViolationException e) {
        String detail = e.getMostSpecificCause().getMessage();
        log.warn("[GlobalExceptionHandler] 저장소 제약 위반: {}", detail);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("Stored value rejected by a database constraint: " + detail,
                        ErrorCode.CONSTRAINT_VIOLATION.name(), ErrorKind.CALLER_ERROR));
    }

    @ExceptionHandler(TransientDataAccessException.class)
    public ResponseEntity<Map<String, String>> handleTransientDataAccess(TransientDataAccessException e) {
        log.warn("[GlobalExceptionHandler] 일시적 저장소 오류: {}", e.getMessage());
        return ResponseEntity.status(ErrorKind.RETRYABLE.getHttpStatus())
                .body(body(e.getMessage(), ErrorCode.PERSISTENCE_UNAVAILABLE.name(), ErrorKind.RETRYABLE));
    }

    private Map<String, String> body(String message, String code, ErrorKind kind) {
        Map<String, String> error = new HashMap<>();
        error.put("error", message);
        error.put("code", code);
        error.put("kind", kind.name());
        return error;
    }
}
