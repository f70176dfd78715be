package dustin.clearing.domains.policy.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.policy.model.PolicyParameter;
import dustin.clearing.domains.policy.model.SettlementPolicy;
import dustin.clearing.domains.policy.model.UnclassifiedSourceTreatment;
import dustin.clearing.domains.policy.model.UseCase;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.extern.slf4j.Slf4j;

/**
 * 정책 로더
 * Policy Loader
 *
 * 역할:
 * - {use_case, parameters} 요청을 검증된 불변 SettlementPolicy로 변환
 * - 유스케이스 기본값 적용
 *
 * 거부 조건 (INVALID_POLICY, 메시지에 키 이름 포함):
 * - 알 수 없는 키 / 유스케이스에 적용되지 않는 키
 * - 필수 키 누락 (unclassified_source_treatment)
 * - 숫자가 아닌 값, 음수 단가/금액, [0, 1] 밖의 비율
 * - 본문의 use_case 값이 요청 use_case와 다른 경우
 */
@Slf4j
@Component
public class PolicyLoader {

    private static final String USE_CASE_KEY = "use_case";

    /**
     * 정책 로드
     *
     * @param useCaseValue 유스케이스 문자열
     * @param parameters 정책 파라미터 (null 허용, 빈 맵과 동일)
     * @return 검증된 정책
     * @throws SettlementException UNKNOWN_USE_CASE, INVALID_POLICY
     */
    public SettlementPolicy load(String useCaseValue, Map<String, Object> parameters) {
        UseCase useCase = UseCase.fromValue(useCaseValue);
        Map<String, Object> raw = parameters != null ? parameters : Collections.emptyMap();

        RoundingMode roundingMode = null;
        UnclassifiedSourceTreatment treatment = null;
        Map<PolicyParameter, BigDecimal> decimals = new EnumMap<>(PolicyParameter.class);
        Map<ParticipantRole, BigDecimal> roleThresholds = new EnumMap<>(ParticipantRole.class);

        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();

            if (USE_CASE_KEY.equals(key)) {
                if (value == null || !useCase.getValue().equals(value.toString().trim().toLowerCase(Locale.ROOT))) {
                    throw invalid(key, "does not match requested use case '" + useCase.getValue() + "'");
                }
                continue;
            }

            if (key.startsWith(PolicyParameter.ROLE_THRESHOLD_PREFIX)) {
                ParticipantRole role = parseRole(key);
                roleThresholds.put(role, parseDecimal(key, value, PolicyParameter.ParameterType.AMOUNT));
                continue;
            }

            PolicyParameter parameter = PolicyParameter.fromKey(key)
                    .orElseThrow(() -> invalid(key, "is not a recognized policy parameter"));
            if (!parameter.isApplicableTo(useCase)) {
                throw invalid(key, "is not applicable to use case '" + useCase.getValue() + "'");
            }

            switch (parameter.getType()) {
                case ROUNDING_MODE:
                    roundingMode = parseRoundingMode(key, value);
                    break;
                case SOURCE_TREATMENT:
                    treatment = parseTreatment(key, value);
                    break;
                default:
                    decimals.put(parameter, parseDecimal(key, value, parameter.getType()));
            }
        }

        // 기본값 적용 및 필수 키 확인
        for (PolicyParameter parameter : PolicyParameter.values()) {
            if (!parameter.isApplicableTo(useCase)) {
                continue;
            }
            boolean present = parameter.isNumeric()
                    ? decimals.containsKey(parameter)
                    : (parameter == PolicyParameter.ROUNDING_MODE ? roundingMode != null : treatment != null);
            if (present) {
                continue;
            }
            if (parameter.isRequired(useCase)) {
                throw invalid(parameter.getKey(), "is required for use case '" + useCase.getValue() + "'");
            }
            String defaultValue = parameter.defaultFor(useCase).orElseThrow();
            if (parameter == PolicyParameter.ROUNDING_MODE) {
                roundingMode = parseRoundingMode(parameter.getKey(), defaultValue);
            } else if (parameter.isNumeric()) {
                decimals.put(parameter, new BigDecimal(defaultValue));
            }
        }

        SettlementPolicy policy = new SettlementPolicy(useCase, roundingMode, treatment, decimals, roleThresholds);
        log.debug("[PolicyLoader] 정책 로드 완료: useCase={}, policy={}", useCase.getValue(), policy.toCanonicalMap());
        return policy;
    }

    private ParticipantRole parseRole(String key) {
        String roleValue = key.substring(PolicyParameter.ROLE_THRESHOLD_PREFIX.length());
        try {
            return ParticipantRole.fromValue(roleValue);
        } catch (SettlementException e) {
            throw new SettlementException(ErrorCode.INVALID_POLICY,
                    "Policy parameter '" + key + "' names unknown role '" + roleValue + "'", e);
        }
    }

    private BigDecimal parseDecimal(String key, Object value, PolicyParameter.ParameterType type) {
        if (!(value instanceof Number) && !(value instanceof String)) {
            throw invalid(key, "must be a number but was " + describe(value));
        }
        BigDecimal decimal;
        try {
            decimal = new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SettlementException(ErrorCode.INVALID_POLICY,
                    "Policy parameter '" + key + "' must be a number but was '" + value + "'", e);
        }
        if (decimal.signum() < 0) {
            throw invalid(key, "must not be negative but was " + decimal.toPlainString());
        }
        if (type == PolicyParameter.ParameterType.RATE && decimal.compareTo(BigDecimal.ONE) > 0) {
            throw invalid(key, "must be a rate within [0, 1] but was " + decimal.toPlainString());
        }
        return decimal;
    }

    private RoundingMode parseRoundingMode(String key, Object value) {
        String name = value != null ? value.toString().trim().toUpperCase(Locale.ROOT) : "";
        if ("HALF_UP".equals(name)) {
            return RoundingMode.HALF_UP;
        }
        if ("HALF_EVEN".equals(name)) {
            return RoundingMode.HALF_EVEN;
        }
        throw invalid(key, "must be HALF_UP or HALF_EVEN but was " + describe(value));
    }

    private UnclassifiedSourceTreatment parseTreatment(String key, Object value) {
        String name = value != null ? value.toString().trim().toUpperCase(Locale.ROOT) : "";
        for (UnclassifiedSourceTreatment treatment : UnclassifiedSourceTreatment.values()) {
            if (treatment.name().equals(name)) {
                return treatment;
            }
        }
        throw invalid(key, "must be one of EXTERNAL_MARKET, ZERO_PRICED, REJECT but was " + describe(value));
    }

    private String describe(Object value) {
        return value == null ? "null" : "'" + value + "'";
    }

    private SettlementException invalid(String key, String reason) {
        return new SettlementException(ErrorCode.INVALID_POLICY, "Policy parameter '" + key + "' " + reason);
    }
}
