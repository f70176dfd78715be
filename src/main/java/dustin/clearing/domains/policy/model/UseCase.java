package dustin.clearing.domains.policy.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 정산 유스케이스
 * Settlement Use Case
 *
 * - energy_community: 에너지 커뮤니티 (커뮤니티 풀이 지역 전력을 청산)
 * - mieterstrom: 세입자 전력 (임대인 PV 전력을 세입자에게 판매)
 */
public enum UseCase {
    ENERGY_COMMUNITY("energy_community", "Energy community"),
    MIETERSTROM("mieterstrom", "Tenant electricity");

    private final String value;
    private final String title;

    UseCase(String value, String title) {
        this.value = value;
        this.title = title;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getTitle() {
        return title;
    }

    public static UseCase fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (UseCase useCase : values()) {
                if (useCase.value.equals(normalized)) {
                    return useCase;
                }
            }
        }
        throw new SettlementException(ErrorCode.UNKNOWN_USE_CASE, "Unknown use case: '" + raw + "'");
    }
}
