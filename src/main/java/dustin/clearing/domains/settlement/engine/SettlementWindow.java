package dustin.clearing.domains.settlement.engine;

import java.time.LocalDateTime;

import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 정산 기간 [start, end)
 * Settlement Window (half-open)
 *
 * end 시각의 이벤트는 포함하지 않습니다 (다음 배치에 속함).
 */
@Getter
@EqualsAndHashCode
public class SettlementWindow {

    private final LocalDateTime start;
    private final LocalDateTime end;

    private SettlementWindow(LocalDateTime start, LocalDateTime end) {
        this.start = start;
        this.end = end;
    }

    /**
     * @throws SettlementException INVALID_WINDOW start/end 누락 또는 start >= end
     */
    public static SettlementWindow of(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new SettlementException(ErrorCode.INVALID_WINDOW, "Settlement window requires both start and end");
        }
        if (!start.isBefore(end)) {
            throw new SettlementException(ErrorCode.INVALID_WINDOW,
                    "Settlement window start " + start + " must be before end " + end);
        }
        return new SettlementWindow(start, end);
    }

    public boolean contains(LocalDateTime timestamp) {
        return timestamp != null && !timestamp.isBefore(start) && timestamp.isBefore(end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
