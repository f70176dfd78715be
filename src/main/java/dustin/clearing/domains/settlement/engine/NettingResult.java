package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 상계 결과
 * Netting Result
 *
 * 모든 맵은 외부 ID 오름차순, 금액은 scale 2, 부호는 (차변 − 대변).
 * - finalPositions: 최소 지급 기준 적용 후 0이 아닌 최종 순액 (정산 라인 대상)
 * - suppressedPositions: 기준 미달로 0 처리된 순액 (버리지 않고 보고)
 * - unmatchedResiduals: 탐욕 매칭 후 남은 금액 (닫힌 참여자 집합 밖으로의 흐름)
 * - balances: 참여자별 대변/차변/순액 (기준 적용 전 전체 참여자)
 */
@Getter
@AllArgsConstructor
public class NettingResult {

    private final Map<String, ParticipantRef> participants;
    private final Map<String, BigDecimal> finalPositions;
    private final Map<String, BigDecimal> suppressedPositions;
    private final List<Transfer> transfers;
    private final Map<String, BigDecimal> unmatchedResiduals;
    private final NettingStats stats;
    private final Map<String, ParticipantBalance> balances;
}
