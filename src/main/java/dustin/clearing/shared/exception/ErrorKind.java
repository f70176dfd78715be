package dustin.clearing.shared.exception;

import org.springframework.http.HttpStatus;

/**
 * 오류 분류
 * Error Kind
 *
 * 호출자가 재시도할지, 요청을 고칠지, 운영자를 불러야 할지 구분합니다.
 */
public enum ErrorKind {

    /** 잘못된 요청/정책/이벤트. 같은 입력으로 재시도해도 실패 */
    CALLER_ERROR(HttpStatus.BAD_REQUEST),

    /** 조회 대상 없음 */
    NOT_FOUND(HttpStatus.NOT_FOUND),

    /** 일시적 저장소 오류. 재시도 가능 */
    RETRYABLE(HttpStatus.SERVICE_UNAVAILABLE),

    /** 가치 보존 위반 등 정합성 오류. 재시도 불가, 조사 필요 */
    FATAL_CONSISTENCY(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorKind(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
