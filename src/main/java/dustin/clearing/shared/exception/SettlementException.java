package dustin.clearing.shared.exception;

/**
 * 정산 관련 예외
 * Settlement-related exception
 *
 * 메시지에는 재현에 필요한 정보(참여자, 이벤트, 정책 키)를 담습니다.
 */
public class SettlementException extends RuntimeException {

    private final ErrorCode errorCode;

    public SettlementException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SettlementException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorKind getKind() {
        return errorCode.getKind();
    }
}
