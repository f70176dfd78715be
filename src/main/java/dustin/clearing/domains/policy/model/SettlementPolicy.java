package dustin.clearing.domains.policy.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

import dustin.clearing.domains.participant.model.ParticipantRole;
import lombok.Getter;

/**
 * 검증 완료된 정산 정책 (불변)
 * Validated Settlement Policy
 *
 * 역할:
 * - PolicyLoader가 검증/기본값 적용을 끝낸 정책
 * - 정산 엔진은 이 객체만 사용하며 원본 요청 맵에 접근하지 않음
 *
 * 모든 숫자 파라미터는 유스케이스 기본값이 채워진 상태이므로
 * 적용 가능한 키에 대해 decimal()은 항상 값을 반환합니다.
 */
@Getter
public class SettlementPolicy {

    private final UseCase useCase;
    private final RoundingMode roundingMode;
    private final UnclassifiedSourceTreatment unclassifiedSourceTreatment;
    private final Map<PolicyParameter, BigDecimal> decimals;
    private final Map<ParticipantRole, BigDecimal> roleThresholds;

    public SettlementPolicy(UseCase useCase,
                            RoundingMode roundingMode,
                            UnclassifiedSourceTreatment unclassifiedSourceTreatment,
                            Map<PolicyParameter, BigDecimal> decimals,
                            Map<ParticipantRole, BigDecimal> roleThresholds) {
        this.useCase = useCase;
        this.roundingMode = roundingMode;
        this.unclassifiedSourceTreatment = unclassifiedSourceTreatment;
        this.decimals = Collections.unmodifiableMap(new EnumMap<>(decimals));
        this.roleThresholds = roleThresholds.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(roleThresholds));
    }

    /**
     * 숫자 파라미터 조회
     *
     * @throws IllegalArgumentException 이 유스케이스에 적용되지 않는 파라미터
     */
    public BigDecimal decimal(PolicyParameter parameter) {
        BigDecimal value = decimals.get(parameter);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Parameter '" + parameter.getKey() + "' is not defined for use case " + useCase.getValue());
        }
        return value;
    }

    /**
     * 역할별 최소 지급 기준
     * 역할별 값이 없으면 전역 min_payout_threshold
     */
    public BigDecimal minPayoutThreshold(ParticipantRole role) {
        BigDecimal specific = role != null ? roleThresholds.get(role) : null;
        return specific != null ? specific : decimal(PolicyParameter.MIN_PAYOUT_THRESHOLD);
    }

    /**
     * 정규화된 정책 맵 (키 정렬)
     * 정책 기록(settlement_policies) 저장과 응답 표시에 사용
     */
    public Map<String, Object> toCanonicalMap() {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("use_case", useCase.getValue());
        canonical.put(PolicyParameter.ROUNDING_MODE.getKey(), roundingMode.name());
        canonical.put(PolicyParameter.UNCLASSIFIED_SOURCE_TREATMENT.getKey(), unclassifiedSourceTreatment.name());
        decimals.forEach((parameter, value) -> canonical.put(parameter.getKey(), value.toPlainString()));
        roleThresholds.forEach((role, value) ->
                canonical.put(PolicyParameter.ROLE_THRESHOLD_PREFIX + role.getValue(), value.toPlainString()));
        return canonical;
    }
}
