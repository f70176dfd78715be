package dustin.clearing.domains.policy.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.policy.model.PolicyParameter;
import dustin.clearing.domains.policy.model.SettlementPolicy;
import dustin.clearing.domains.policy.model.UnclassifiedSourceTreatment;
import dustin.clearing.domains.policy.model.UseCase;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 정책 로더 테스트
 * PolicyLoader 검증/기본값 적용
 *
 * 목적:
 * - 알 수 없는 키, 누락된 필수 키, 범위 밖 값은 로드 시점에 INVALID_POLICY로 거부
 * - 유스케이스별 기본값이 채워지는지 확인
 */
class PolicyLoaderTest {

    private final PolicyLoader policyLoader = new PolicyLoader();

    private Map<String, Object> body(Object... keyValues) {
        Map<String, Object> body = new HashMap<>();
        body.put("unclassified_source_treatment", "EXTERNAL_MARKET");
        for (int i = 0; i < keyValues.length; i += 2) {
            body.put((String) keyValues[i], keyValues[i + 1]);
        }
        return body;
    }

    @Test
    @DisplayName("mieterstrom 기본값 적용")
    void mieterstromDefaults() {
        SettlementPolicy policy = policyLoader.load("mieterstrom", body());

        assertThat(policy.getUseCase()).isEqualTo(UseCase.MIETERSTROM);
        assertThat(policy.getRoundingMode()).isEqualTo(RoundingMode.HALF_UP);
        assertThat(policy.getUnclassifiedSourceTreatment()).isEqualTo(UnclassifiedSourceTreatment.EXTERNAL_MARKET);
        assertThat(policy.decimal(PolicyParameter.TENANT_PRICE_PER_KWH)).isEqualByComparingTo("0.18");
        assertThat(policy.decimal(PolicyParameter.LANDLORD_REVENUE_SHARE)).isEqualByComparingTo("0.60");
        assertThat(policy.decimal(PolicyParameter.BASE_FEE_PER_UNIT)).isEqualByComparingTo("5.00");
        assertThat(policy.decimal(PolicyParameter.MIN_PAYOUT_THRESHOLD)).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("요청 값이 기본값보다 우선")
    void overridesDefaults() {
        SettlementPolicy policy = policyLoader.load("energy_community",
                body("prosumer_sell_price", "0.21", "community_fee_rate", 0.05, "rounding_mode", "half_even"));

        assertThat(policy.decimal(PolicyParameter.PROSUMER_SELL_PRICE)).isEqualByComparingTo("0.21");
        assertThat(policy.decimal(PolicyParameter.COMMUNITY_FEE_RATE)).isEqualByComparingTo("0.05");
        assertThat(policy.getRoundingMode()).isEqualTo(RoundingMode.HALF_EVEN);
    }

    @Test
    @DisplayName("유스케이스 이름은 대소문자/구분자 무관")
    void useCaseNormalization() {
        assertThat(policyLoader.load("Energy-Community", body()).getUseCase()).isEqualTo(UseCase.ENERGY_COMMUNITY);
    }

    @Test
    @DisplayName("알 수 없는 유스케이스 → UNKNOWN_USE_CASE")
    void unknownUseCase() {
        assertThatThrownBy(() -> policyLoader.load("virtual_power_plant", body()))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNKNOWN_USE_CASE);
    }

    @Test
    @DisplayName("unclassified_source_treatment 누락 → INVALID_POLICY (키 이름 포함)")
    void missingRequiredKey() {
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", new HashMap<>()))
                .isInstanceOf(SettlementException.class)
                .hasMessageContaining("unclassified_source_treatment")
                .extracting(e -> ((SettlementException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_POLICY);
    }

    @Test
    @DisplayName("알 수 없는 키 → INVALID_POLICY")
    void unknownKey() {
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", body("tenant_price", "0.2")))
                .isInstanceOf(SettlementException.class)
                .hasMessageContaining("tenant_price");
    }

    @Test
    @DisplayName("다른 유스케이스 전용 키 → INVALID_POLICY")
    void keyOfOtherUseCase() {
        assertThatThrownBy(() -> policyLoader.load("energy_community", body("landlord_revenue_share", "0.5")))
                .isInstanceOf(SettlementException.class)
                .hasMessageContaining("landlord_revenue_share")
                .hasMessageContaining("not applicable");
    }

    @Test
    @DisplayName("음수 단가, 1 초과 비율, 숫자 아닌 값 거부")
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", body("grid_purchase_price", "-0.01")))
                .hasMessageContaining("must not be negative");
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", body("operator_fee_rate", "1.5")))
                .hasMessageContaining("within [0, 1]");
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", body("vpp_sale_price", "cheap")))
                .hasMessageContaining("must be a number");
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", body("rounding_mode", "CEILING")))
                .hasMessageContaining("HALF_UP or HALF_EVEN");
    }

    @Test
    @DisplayName("본문 use_case가 요청과 다르면 거부")
    void bodyUseCaseMismatch() {
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", body("use_case", "energy_community")))
                .isInstanceOf(SettlementException.class)
                .hasMessageContaining("use_case");
        assertThat(policyLoader.load("mieterstrom", body("use_case", "mieterstrom")).getUseCase())
                .isEqualTo(UseCase.MIETERSTROM);
    }

    @Test
    @DisplayName("역할별 최소 지급 기준은 전역 기준보다 우선")
    void roleThresholds() {
        SettlementPolicy policy = policyLoader.load("mieterstrom",
                body("min_payout_threshold", "1.00", "min_payout_threshold.tenant", "5.00"));

        assertThat(policy.minPayoutThreshold(ParticipantRole.TENANT)).isEqualByComparingTo("5.00");
        assertThat(policy.minPayoutThreshold(ParticipantRole.LANDLORD)).isEqualByComparingTo("1.00");
        assertThatThrownBy(() -> policyLoader.load("mieterstrom", body("min_payout_threshold.janitor", "1")))
                .hasMessageContaining("unknown role");
    }

    @Test
    @DisplayName("정규화 맵은 키 정렬 + 모든 유효 파라미터 포함")
    void canonicalMap() {
        Map<String, Object> canonical = policyLoader.load("mieterstrom", body()).toCanonicalMap();

        assertThat(new ArrayList<>(canonical.keySet())).isSorted();
        assertThat(canonical).containsEntry("use_case", "mieterstrom")
                .containsEntry("unclassified_source_treatment", "EXTERNAL_MARKET")
                .containsEntry("tenant_price_per_kwh", "0.18")
                .doesNotContainKey("prosumer_sell_price");
        assertThat(new BigDecimal((String) canonical.get("grid_compensation"))).isEqualByComparingTo("0.08");
    }
}
