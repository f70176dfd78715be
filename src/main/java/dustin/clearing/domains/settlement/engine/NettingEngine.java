// =====================================================
// NettingEngine - 양자 상계 엔진
// =====================================================
// 역할: 참여자별 순액을 최소에 가까운 이체 목록으로 축약
//
// 핵심 알고리즘 (탐욕 근사):
// 1. 순액 = 차변 − 대변, scale 2로 한 번만 반올림
// 2. 채무자: 순액 > ε, 채권자: 순액 < −ε
// 3. 양쪽 모두 |순액| 내림차순, 동률이면 외부 ID 오름차순
// 4. 남은 금액이 가장 큰 채무자 ↔ 가장 큰 채권자 매칭
//    이체액 = min(양쪽 남은 금액), 0이 된 쪽은 제외
// 5. 한쪽이 소진되면 종료. 남은 금액은 unmatchedResiduals로 보고
// 6. 역할별 최소 지급 기준 미만 → 0 처리, suppressedPositions로 보고
//
// 한계:
// - 최소 이체 건수를 보장하지 않음 (최적해는 NP-hard, 탐욕 근사)
// - 이체 목록은 기준 적용 전 순액으로 계산됨
//
// 자료구조:
// - PriorityQueue: 남은 금액 기준 최대 힙 (O(log n) 재삽입)
// - TreeMap: 외부 ID 정렬 출력 (결과 재현성)
// =====================================================

package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.extern.slf4j.Slf4j;

/**
 * 상계 엔진
 * Netting Engine
 *
 * 상태 없음. 같은 잔액표와 파라미터에 대해 항상 같은 결과를 반환합니다.
 */
@Slf4j
@Component
public class NettingEngine {

    /**
     * 반올림 라인 1건당 허용 오차 (0.5 cent)
     */
    static final BigDecimal ROUNDING_TOLERANCE_PER_LINE = new BigDecimal("0.005");

    private static final int EFFICIENCY_SCALE = 4;

    private static final Comparator<OpenPosition> LARGEST_FIRST = Comparator
            .comparing(OpenPosition::getRemaining, Comparator.reverseOrder())
            .thenComparing(OpenPosition::getExternalId);

    /**
     * 상계 실행
     *
     * @param sheet 잔액표
     * @param parameters 반올림/기준/ε
     * @param unpricedEvents 통계용 미가격 이벤트 수
     * @throws SettlementException CONSERVATION_VIOLATED 보존 법칙 위반
     */
    public NettingResult net(BalanceSheet sheet, NettingParameters parameters, int unpricedEvents) {
        BigDecimal epsilon = parameters.getZeroEpsilon();

        // ━━━ 1. 순액 계산 (1회 반올림) ━━━
        Map<String, ParticipantRef> participants = new TreeMap<>();
        Map<String, BigDecimal> rounded = new TreeMap<>();
        Map<String, ParticipantBalance> balances = new TreeMap<>();
        for (BalanceSheet.Balance balance : sheet.getBalances()) {
            String externalId = balance.getParticipant().getExternalId();
            BigDecimal net = parameters.round(balance.net());
            participants.put(externalId, balance.getParticipant());
            rounded.put(externalId, net);
            balances.put(externalId, new ParticipantBalance(
                    parameters.round(balance.getCredit()), parameters.round(balance.getDebit()), net));
        }

        // ━━━ 2. 채무자/채권자 분류 ━━━
        PriorityQueue<OpenPosition> debtors = new PriorityQueue<>(LARGEST_FIRST);
        PriorityQueue<OpenPosition> creditors = new PriorityQueue<>(LARGEST_FIRST);
        rounded.forEach((externalId, net) -> {
            if (net.compareTo(epsilon) > 0) {
                debtors.add(new OpenPosition(externalId, net));
            } else if (net.compareTo(epsilon.negate()) < 0) {
                creditors.add(new OpenPosition(externalId, net.negate()));
            }
        });

        // ━━━ 3. 탐욕 매칭 ━━━
        List<Transfer> transfers = new ArrayList<>();
        while (!debtors.isEmpty() && !creditors.isEmpty()) {
            OpenPosition debtor = debtors.poll();
            OpenPosition creditor = creditors.poll();
            BigDecimal amount = debtor.getRemaining().min(creditor.getRemaining());

            transfers.add(new Transfer(debtor.getExternalId(), creditor.getExternalId(), amount));
            debtor.reduce(amount);
            creditor.reduce(amount);

            if (debtor.getRemaining().compareTo(epsilon) > 0) {
                debtors.add(debtor);
            }
            if (creditor.getRemaining().compareTo(epsilon) > 0) {
                creditors.add(creditor);
            }
        }

        Map<String, BigDecimal> residuals = new TreeMap<>();
        debtors.forEach(open -> residuals.put(open.getExternalId(), open.getRemaining()));
        creditors.forEach(open -> residuals.put(open.getExternalId(), open.getRemaining().negate()));
        if (!residuals.isEmpty()) {
            log.debug("[NettingEngine] 매칭되지 않은 잔여 금액: {}", residuals);
        }

        // ━━━ 4. 최소 지급 기준 적용 ━━━
        Map<String, BigDecimal> finalPositions = new TreeMap<>();
        Map<String, BigDecimal> suppressed = new TreeMap<>();
        rounded.forEach((externalId, net) -> {
            if (net.abs().compareTo(epsilon) <= 0) {
                return;
            }
            BigDecimal threshold = parameters.minPayoutThreshold(participants.get(externalId).getRole());
            if (net.abs().compareTo(threshold) < 0) {
                suppressed.put(externalId, net);
                log.warn("[NettingEngine] 최소 지급 기준 미달로 0 처리: participant={}, amount={}, threshold={}",
                        externalId, net.toPlainString(), threshold.toPlainString());
            } else {
                finalPositions.put(externalId, net);
            }
        });

        // ━━━ 5. 보존 법칙 검증 ━━━
        verifyConservation(sheet, finalPositions, suppressed);

        // ━━━ 6. 통계 ━━━
        BigDecimal gross = parameters.round(sheet.totalCredit().add(sheet.totalDebit()));
        BigDecimal netVolume = finalPositions.values().stream()
                .map(BigDecimal::abs)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(NettingParameters.AMOUNT_SCALE);
        BigDecimal efficiency = gross.signum() == 0
                ? BigDecimal.ZERO.setScale(EFFICIENCY_SCALE)
                : BigDecimal.ONE.subtract(netVolume.divide(gross, EFFICIENCY_SCALE, RoundingMode.HALF_UP));

        NettingStats stats = NettingStats.builder()
                .transferCount(transfers.size())
                .grossVolume(gross)
                .totalCredit(parameters.round(sheet.totalCredit()))
                .totalDebit(parameters.round(sheet.totalDebit()))
                .netVolume(netVolume)
                .efficiency(efficiency)
                .participantCount(sheet.size())
                .unpricedEvents(unpricedEvents)
                .build();

        log.info("[NettingEngine] 상계 완료: participants={}, transfers={}, gross={}, net={}, suppressed={}",
                stats.getParticipantCount(), stats.getTransferCount(), gross.toPlainString(),
                netVolume.toPlainString(), suppressed.size());

        return new NettingResult(
                Collections.unmodifiableMap(participants),
                Collections.unmodifiableMap(finalPositions),
                Collections.unmodifiableMap(suppressed),
                Collections.unmodifiableList(transfers),
                Collections.unmodifiableMap(residuals),
                stats,
                Collections.unmodifiableMap(balances));
    }

    /**
     * Σ 최종 순액 + Σ 기준 미달 순액 = Σ 차변 − Σ 대변 (허용 오차: 0.005 × 참여자 수)
     */
    void verifyConservation(BalanceSheet sheet,
                            Map<String, BigDecimal> finalPositions,
                            Map<String, BigDecimal> suppressed) {
        BigDecimal expected = sheet.totalDebit().subtract(sheet.totalCredit());
        BigDecimal actual = finalPositions.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add)
                .add(suppressed.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add));
        BigDecimal tolerance = ROUNDING_TOLERANCE_PER_LINE.multiply(BigDecimal.valueOf(Math.max(1, sheet.size())));
        BigDecimal drift = actual.subtract(expected).abs();

        if (drift.compareTo(tolerance) > 0) {
            throw new SettlementException(ErrorCode.CONSERVATION_VIOLATED, String.format(
                    "Conservation violated: lines+suppressed=%s, debit-credit=%s, drift=%s exceeds tolerance %s",
                    actual.toPlainString(), expected.toPlainString(), drift.toPlainString(), tolerance.toPlainString()));
        }
    }

    /**
     * 매칭 중인 포지션 (남은 금액은 항상 양수)
     */
    private static class OpenPosition {
        private final String externalId;
        private BigDecimal remaining;

        OpenPosition(String externalId, BigDecimal remaining) {
            this.externalId = externalId;
            this.remaining = remaining;
        }

        String getExternalId() {
            return externalId;
        }

        BigDecimal getRemaining() {
            return remaining;
        }

        void reduce(BigDecimal amount) {
            remaining = remaining.subtract(amount);
        }
    }
}
