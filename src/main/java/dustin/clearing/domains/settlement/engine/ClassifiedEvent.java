package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.clearing.domains.event.model.EnergyUnit;
import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.SourceBucket;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 분류된 이벤트
 * Classified Event
 *
 * 참여자와 출처 분류가 확정된 기간 내 이벤트. 엔진은 JPA 엔티티 대신 이 값을 사용합니다.
 */
@Getter
@ToString
@AllArgsConstructor
public class ClassifiedEvent {

    private final Long eventId;
    private final ParticipantRef participant;
    private final EventKind kind;
    private final BigDecimal quantity;
    private final EnergyUnit unit;
    private final String source;
    private final SourceBucket bucket;
    private final BigDecimal pricePerUnit;
    private final LocalDateTime timestamp;

    /**
     * 이벤트가 직접 가진 유효 단가 (null 또는 0 이하이면 정책 단가 사용)
     */
    public boolean hasOwnPrice() {
        return pricePerUnit != null && pricePerUnit.signum() > 0;
    }
}
