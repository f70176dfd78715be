package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.policy.model.SettlementPolicy;
import lombok.Getter;

/**
 * 상계 파라미터
 * Netting Parameters
 *
 * 반올림 방식과 최소 지급 기준은 정책에서, 0 허용 오차는 애플리케이션 설정에서 가져옵니다.
 */
@Getter
public class NettingParameters {

    public static final int AMOUNT_SCALE = 2;

    private final RoundingMode roundingMode;
    private final BigDecimal zeroEpsilon;
    private final SettlementPolicy policy;

    public NettingParameters(SettlementPolicy policy, BigDecimal zeroEpsilon) {
        this.policy = policy;
        this.roundingMode = policy.getRoundingMode();
        this.zeroEpsilon = zeroEpsilon;
    }

    public BigDecimal minPayoutThreshold(ParticipantRole role) {
        return policy.minPayoutThreshold(role);
    }

    public BigDecimal round(BigDecimal value) {
        return value.setScale(AMOUNT_SCALE, roundingMode);
    }
}
