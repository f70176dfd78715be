package dustin.clearing.shared.exception;

/**
 * 오류 코드
 * Error Code
 */
public enum ErrorCode {

    // 요청 형식
    INVALID_REQUEST(ErrorKind.CALLER_ERROR),
    MALFORMED_REQUEST(ErrorKind.CALLER_ERROR),
    CONSTRAINT_VIOLATION(ErrorKind.CALLER_ERROR),

    // 입력 디코딩
    UNKNOWN_EVENT_KIND(ErrorKind.CALLER_ERROR),
    UNKNOWN_ROLE(ErrorKind.CALLER_ERROR),
    UNKNOWN_UNIT(ErrorKind.CALLER_ERROR),
    INVALID_EVENT(ErrorKind.CALLER_ERROR),
    ROLE_CONFLICT(ErrorKind.CALLER_ERROR),
    RESERVED_PARTICIPANT_ID(ErrorKind.CALLER_ERROR),

    // 정책
    UNKNOWN_USE_CASE(ErrorKind.CALLER_ERROR),
    INVALID_POLICY(ErrorKind.CALLER_ERROR),

    // 정산 실행
    INVALID_WINDOW(ErrorKind.CALLER_ERROR),
    OVERLAPPING_WINDOW(ErrorKind.CALLER_ERROR),
    UNKNOWN_PARTICIPANT(ErrorKind.CALLER_ERROR),
    MISSING_COUNTERPARTY(ErrorKind.CALLER_ERROR),
    AMBIGUOUS_COUNTERPARTY(ErrorKind.CALLER_ERROR),
    UNCLASSIFIED_SOURCE(ErrorKind.CALLER_ERROR),

    // 조회
    BATCH_NOT_FOUND(ErrorKind.NOT_FOUND),

    // 저장소
    PERSISTENCE_UNAVAILABLE(ErrorKind.RETRYABLE),

    // 정합성
    CONSERVATION_VIOLATED(ErrorKind.FATAL_CONSISTENCY),
    HASH_FAILURE(ErrorKind.FATAL_CONSISTENCY);

    private final ErrorKind kind;

    ErrorCode(ErrorKind kind) {
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
