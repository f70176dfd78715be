package dustin.clearing.domains.settlement.engine;

import static dustin.clearing.domains.settlement.engine.EngineFixtures.EPSILON;
import static dustin.clearing.domains.settlement.engine.EngineFixtures.policy;
import static dustin.clearing.domains.settlement.engine.EngineFixtures.posting;
import static dustin.clearing.domains.settlement.engine.EngineFixtures.ref;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 상계 엔진 테스트
 * NettingEngine 순액 / 탐욕 매칭 / 최소 지급 기준 / 보존 법칙
 *
 * 부호: 순액 = 차변 − 대변 (양수: 지불, 음수: 수취)
 */
class NettingEngineTest {

    private final NettingEngine nettingEngine = new NettingEngine();

    private final ParticipantRef tenantA = ref(1L, "tenant-a", ParticipantRole.TENANT);
    private final ParticipantRef tenantB = ref(2L, "tenant-b", ParticipantRole.TENANT);
    private final ParticipantRef landlord = ref(3L, "landlord", ParticipantRole.LANDLORD);

    private NettingParameters parameters(String... keyValues) {
        return new NettingParameters(policy("mieterstrom", "REJECT", keyValues), EPSILON);
    }

    private BalanceSheet sheet(List<Posting> postings) {
        BalanceSheet sheet = new BalanceSheet();
        postings.forEach(sheet::apply);
        return sheet;
    }

    @Test
    @DisplayName("세입자 2명 → 임대인: 이체 2건 (2.00, 0.80)")
    void twoTenantsPayLandlord() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "2.00"),
                posting(tenantB, landlord, "0.80")));

        NettingResult result = nettingEngine.net(sheet, parameters(), 0);

        assertThat(result.getFinalPositions())
                .containsEntry("tenant-a", new BigDecimal("2.00"))
                .containsEntry("tenant-b", new BigDecimal("0.80"))
                .containsEntry("landlord", new BigDecimal("-2.80"));
        assertThat(result.getTransfers()).hasSize(2);
        assertThat(result.getTransfers().get(0).getDebtor()).isEqualTo("tenant-a");
        assertThat(result.getTransfers().get(0).getCreditor()).isEqualTo("landlord");
        assertThat(result.getTransfers().get(0).getAmount()).isEqualByComparingTo("2.00");
        assertThat(result.getTransfers().get(1).getDebtor()).isEqualTo("tenant-b");
        assertThat(result.getTransfers().get(1).getAmount()).isEqualByComparingTo("0.80");
        assertThat(result.getUnmatchedResiduals()).isEmpty();
        assertThat(result.getSuppressedPositions()).isEmpty();

        NettingStats stats = result.getStats();
        assertThat(stats.getTransferCount()).isEqualTo(2);
        assertThat(stats.getParticipantCount()).isEqualTo(3);
        assertThat(stats.getGrossVolume()).isEqualByComparingTo("5.60");
        assertThat(stats.getNetVolume()).isEqualByComparingTo("5.60");
        assertThat(stats.getTotalCredit()).isEqualByComparingTo("2.80");
        assertThat(stats.getTotalDebit()).isEqualByComparingTo("2.80");
        assertThat(stats.getEfficiency()).isEqualByComparingTo("0");
    }

    @Test
    @DisplayName("참여자별 대변/차변/순액 내역은 기준 미달 참여자도 포함")
    void balanceBreakdownPerParticipant() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "2.004"),
                posting(landlord, tenantA, "0.50"),
                posting(tenantB, landlord, "0.80")));

        NettingResult result = nettingEngine.net(sheet, parameters("min_payout_threshold", "1.00"), 0);

        assertThat(result.getBalances()).containsOnlyKeys("landlord", "tenant-a", "tenant-b");
        assertThat(result.getBalances().get("tenant-a"))
                .isEqualTo(new ParticipantBalance(new BigDecimal("0.50"), new BigDecimal("2.00"), new BigDecimal("1.50")));
        assertThat(result.getBalances().get("landlord"))
                .isEqualTo(new ParticipantBalance(new BigDecimal("2.80"), new BigDecimal("0.50"), new BigDecimal("-2.30")));
        assertThat(result.getBalances().get("tenant-b").getNet()).isEqualByComparingTo("0.80");
        assertThat(result.getSuppressedPositions()).containsOnlyKeys("tenant-b");
    }

    @Test
    @DisplayName("서로 주고받는 채무는 상계: A→B 5.00, B→A 3.00 → 이체 1건 2.00")
    void offsettingObligationsReduceExposure() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, tenantB, "5.00"),
                posting(tenantB, tenantA, "3.00")));

        NettingResult result = nettingEngine.net(sheet, parameters(), 0);

        assertThat(result.getFinalPositions())
                .containsEntry("tenant-a", new BigDecimal("2.00"))
                .containsEntry("tenant-b", new BigDecimal("-2.00"));
        assertThat(result.getTransfers())
                .extracting(Transfer::getDebtor, Transfer::getCreditor, Transfer::getAmount)
                .containsExactly(tuple("tenant-a", "tenant-b", new BigDecimal("2.00")));

        // gross = Σ 대변 8.00 + Σ 차변 8.00, net = |2.00| + |−2.00|
        NettingStats stats = result.getStats();
        assertThat(stats.getGrossVolume()).isEqualByComparingTo("16.00");
        assertThat(stats.getNetVolume()).isEqualByComparingTo("4.00");
        assertThat(stats.getNetVolume()).isLessThan(stats.getGrossVolume());
        assertThat(stats.getEfficiency()).isEqualByComparingTo("0.7500");
    }

    @Test
    @DisplayName("반올림 방식: 0.125는 HALF_UP 0.13, HALF_EVEN 0.12 (둘 다 보존 법칙 통과)")
    void roundingModeChangesRoundedNet() {
        List<Posting> postings = List.of(
                posting(tenantA, landlord, "0.125"),
                posting(tenantB, landlord, "0.375"));

        NettingResult halfUp = nettingEngine.net(sheet(postings), parameters("rounding_mode", "HALF_UP"), 0);
        NettingResult halfEven = nettingEngine.net(sheet(postings), parameters("rounding_mode", "HALF_EVEN"), 0);

        assertThat(halfUp.getFinalPositions())
                .containsEntry("tenant-a", new BigDecimal("0.13"))
                .containsEntry("tenant-b", new BigDecimal("0.38"))
                .containsEntry("landlord", new BigDecimal("-0.50"));
        assertThat(halfEven.getFinalPositions())
                .containsEntry("tenant-a", new BigDecimal("0.12"))
                .containsEntry("tenant-b", new BigDecimal("0.38"))
                .containsEntry("landlord", new BigDecimal("-0.50"));

        // HALF_UP은 1센트가 남아 잔여 금액으로 보고, HALF_EVEN은 정확히 맞음
        assertThat(halfUp.getUnmatchedResiduals()).containsOnlyKeys("tenant-a");
        assertThat(halfUp.getUnmatchedResiduals().get("tenant-a")).isEqualByComparingTo("0.01");
        assertThat(halfEven.getUnmatchedResiduals()).isEmpty();
        assertThat(halfEven.getTransfers())
                .extracting(Transfer::getDebtor, Transfer::getAmount)
                .containsExactly(tuple("tenant-b", new BigDecimal("0.38")), tuple("tenant-a", new BigDecimal("0.12")));

        BigDecimal halfEvenSum = halfEven.getFinalPositions().values().stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(halfEvenSum).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("최종 순액 합 = 0 (보존)")
    void finalPositionsSumToZero() {
        ParticipantRef operator = ref(4L, "operator", ParticipantRole.OPERATOR);
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "1.80"),
                posting(landlord, operator, "0.27"),
                posting(tenantB, landlord, "0.72"),
                posting(landlord, operator, "0.108")));

        NettingResult result = nettingEngine.net(sheet, parameters(), 0);

        BigDecimal sum = result.getFinalPositions().values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertThat(sum.abs()).isLessThanOrEqualTo(new BigDecimal("0.02"));
    }

    @Test
    @DisplayName("포스팅 순서를 바꿔도 결과 동일")
    void orderIndependent() {
        ParticipantRef operator = ref(4L, "operator", ParticipantRole.OPERATOR);
        List<Posting> postings = new ArrayList<>(List.of(
                posting(tenantA, landlord, "1.333"),
                posting(tenantB, landlord, "2.667"),
                posting(landlord, operator, "0.6"),
                posting(operator, tenantA, "0.125"),
                posting(tenantB, operator, "0.005")));

        NettingResult expected = nettingEngine.net(sheet(postings), parameters(), 0);
        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(postings, random);
            NettingResult shuffled = nettingEngine.net(sheet(postings), parameters(), 0);

            assertThat(shuffled.getFinalPositions()).isEqualTo(expected.getFinalPositions());
            assertThat(shuffled.getTransfers())
                    .extracting(Transfer::getDebtor, Transfer::getCreditor, Transfer::getAmount)
                    .containsExactlyElementsOf(expected.getTransfers().stream()
                            .map(t -> tuple(t.getDebtor(), t.getCreditor(), t.getAmount()))
                            .toList());
        }
    }

    @Test
    @DisplayName("채무자별 이체 합계는 그 채무자의 순액을 넘지 않음")
    void transfersNeverExceedExposure() {
        ParticipantRef operator = ref(4L, "operator", ParticipantRole.OPERATOR);
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "3.10"),
                posting(tenantB, operator, "1.90"),
                posting(tenantB, landlord, "0.40"),
                posting(landlord, operator, "0.25")));

        NettingResult result = nettingEngine.net(sheet, parameters(), 0);

        result.getFinalPositions().forEach((externalId, net) -> {
            BigDecimal paid = result.getTransfers().stream()
                    .filter(t -> t.getDebtor().equals(externalId))
                    .map(Transfer::getAmount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            BigDecimal received = result.getTransfers().stream()
                    .filter(t -> t.getCreditor().equals(externalId))
                    .map(Transfer::getAmount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (net.signum() > 0) {
                assertThat(paid).isLessThanOrEqualTo(net);
                assertThat(received).isZero();
            } else {
                assertThat(received).isLessThanOrEqualTo(net.negate());
                assertThat(paid).isZero();
            }
        });
    }

    @Test
    @DisplayName("동률이면 외부 ID 오름차순으로 먼저 매칭")
    void tieBreakByExternalId() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantB, landlord, "1.00"),
                posting(tenantA, landlord, "1.00")));

        NettingResult result = nettingEngine.net(sheet, parameters(), 0);

        assertThat(result.getTransfers()).extracting(Transfer::getDebtor).containsExactly("tenant-a", "tenant-b");
    }

    @Test
    @DisplayName("반올림 차이로 매칭되지 않은 잔여 금액은 unmatchedResiduals로 보고")
    void unmatchedResiduals() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "0.3333"),
                posting(tenantB, landlord, "0.3333")));

        NettingResult result = nettingEngine.net(sheet, parameters(), 0);

        assertThat(result.getFinalPositions()).containsEntry("landlord", new BigDecimal("-0.67"));
        assertThat(result.getTransfers()).hasSize(2);
        assertThat(result.getUnmatchedResiduals()).containsOnlyKeys("landlord");
        assertThat(result.getUnmatchedResiduals().get("landlord")).isEqualByComparingTo("-0.01");
    }

    @Test
    @DisplayName("최소 지급 기준 경계: 기준 − 0.01은 0 처리, 기준 + 0.01은 라인 생성")
    void thresholdBoundary() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "4.99"),
                posting(tenantB, landlord, "5.01")));

        NettingResult result = nettingEngine.net(sheet, parameters("min_payout_threshold", "5.00"), 0);

        assertThat(result.getFinalPositions()).doesNotContainKey("tenant-a");
        assertThat(result.getSuppressedPositions()).containsEntry("tenant-a", new BigDecimal("4.99"));
        assertThat(result.getFinalPositions())
                .containsEntry("tenant-b", new BigDecimal("5.01"))
                .containsEntry("landlord", new BigDecimal("-10.00"));
    }

    @Test
    @DisplayName("역할별 기준은 해당 역할에만 적용")
    void roleSpecificThreshold() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "3.00")));

        NettingResult result = nettingEngine.net(sheet,
                parameters("min_payout_threshold.landlord", "10.00"), 0);

        assertThat(result.getFinalPositions()).containsOnlyKeys("tenant-a");
        assertThat(result.getSuppressedPositions()).containsEntry("landlord", new BigDecimal("-3.00"));
    }

    @Test
    @DisplayName("순액이 0인 참여자는 라인/이체 없음")
    void balancedParticipantHasNoLine() {
        BalanceSheet sheet = sheet(List.of(
                posting(tenantA, landlord, "1.00"),
                posting(landlord, tenantA, "1.00")));

        NettingResult result = nettingEngine.net(sheet, parameters(), 3);

        assertThat(result.getFinalPositions()).isEmpty();
        assertThat(result.getTransfers()).isEmpty();
        assertThat(result.getStats().getParticipantCount()).isEqualTo(2);
        assertThat(result.getStats().getUnpricedEvents()).isEqualTo(3);
    }

    @Test
    @DisplayName("보존 법칙 위반 → CONSERVATION_VIOLATED")
    void conservationViolation() {
        BalanceSheet sheet = sheet(List.of(posting(tenantA, landlord, "10.00")));

        assertThatThrownBy(() -> nettingEngine.verifyConservation(sheet,
                Map.of("tenant-a", new BigDecimal("10.00"), "landlord", new BigDecimal("-9.00")),
                Map.of()))
                .isInstanceOf(SettlementException.class)
                .hasMessageContaining("Conservation violated")
                .extracting(e -> ((SettlementException) e).getErrorCode())
                .isEqualTo(ErrorCode.CONSERVATION_VIOLATED);
    }

    @Test
    @DisplayName("허용 오차(0.005 × 참여자 수) 이내 차이는 통과")
    void conservationWithinTolerance() {
        BalanceSheet sheet = sheet(List.of(posting(tenantA, landlord, "10.00")));

        nettingEngine.verifyConservation(sheet,
                Map.of("tenant-a", new BigDecimal("10.00"), "landlord", new BigDecimal("-9.99")),
                Map.of());
    }
}
