package dustin.clearing.domains.policy.rule;

import java.math.BigDecimal;
import java.util.Set;

import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.SourceBucket;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.policy.model.PolicyParameter;
import dustin.clearing.domains.policy.model.SettlementPolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 포스팅 규칙
 * Posting Rule
 *
 * 하나의 규칙 = 하나의 복식부기 쌍 (채무자 차변 / 채권자 대변)
 *
 * 금액 계산:
 * - unit이 EUR이면 수량 자체가 기준 금액
 * - 그 외에는 수량 × 단가 (이벤트 단가 > 0 이면 이벤트 단가, 아니면 priceParameter 값)
 * - shareParameter가 있으면 기준 금액 × 비율 (shareComplement이면 1 − 비율)
 */
@Getter
@Builder
@ToString
public class PostingRule {

    private final String name;

    private final Set<EventKind> eventKinds;

    /**
     * 비어 있으면 모든 출처에 적용
     */
    @Builder.Default
    private final Set<SourceBucket> sources = Set.of();

    private final Set<ParticipantRole> roles;

    private final PolicyParameter priceParameter;

    private final PolicyParameter shareParameter;

    private final boolean shareComplement;

    private final Counterparty debtor;

    private final Counterparty creditor;

    public boolean matches(EventKind kind, SourceBucket bucket, ParticipantRole role) {
        return eventKinds.contains(kind)
                && (sources.isEmpty() || sources.contains(bucket))
                && roles.contains(role);
    }

    /**
     * 기준 금액에 곱할 비율 (share 파라미터가 없으면 1)
     */
    public BigDecimal shareFactor(SettlementPolicy policy) {
        if (shareParameter == null) {
            return BigDecimal.ONE;
        }
        BigDecimal share = policy.decimal(shareParameter);
        return shareComplement ? BigDecimal.ONE.subtract(share) : share;
    }
}
