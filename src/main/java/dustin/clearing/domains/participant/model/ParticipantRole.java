package dustin.clearing.domains.participant.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 참여자 역할 (닫힌 집합)
 * Participant Role
 *
 * 정산 기간 동안 변경되지 않습니다.
 */
public enum ParticipantRole {
    CONSUMER("consumer", "Consumer"),
    TENANT("tenant", "Tenant"),
    COMMERCIAL_TENANT("commercial_tenant", "Commercial tenant"),
    LANDLORD("landlord", "Landlord"),
    OPERATOR("operator", "Operator"),
    PROSUMER("prosumer", "Prosumer"),
    EXTERNAL_MARKET("external_market", "External market"),
    FEE_COLLECTOR("fee_collector", "Fee collector");

    private final String value;
    private final String label;

    ParticipantRole(String value, String label) {
        this.value = value;
        this.label = label;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 문자열 → 역할 변환 (대소문자, '-' 구분자 허용)
     *
     * @throws SettlementException UNKNOWN_ROLE
     */
    @JsonCreator
    public static ParticipantRole fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new SettlementException(ErrorCode.UNKNOWN_ROLE, "Participant role is missing");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        if ("commercial".equals(normalized)) {
            return COMMERCIAL_TENANT;
        }
        if ("community_fee_collector".equals(normalized)) {
            return FEE_COLLECTOR;
        }
        for (ParticipantRole role : values()) {
            if (role.value.equals(normalized)) {
                return role;
            }
        }
        throw new SettlementException(ErrorCode.UNKNOWN_ROLE, "Unknown participant role: '" + raw + "'");
    }
}
