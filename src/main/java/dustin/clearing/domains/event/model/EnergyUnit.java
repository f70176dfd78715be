package dustin.clearing.domains.event.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 수량 단위
 * Quantity Unit
 *
 * EUR이면 수량 자체가 금액, kWh이면 수량 × 단가
 */
public enum EnergyUnit {
    KWH("kWh"),
    EUR("EUR");

    private final String value;

    EnergyUnit(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isMonetary() {
        return this == EUR;
    }

    @JsonCreator
    public static EnergyUnit fromValue(String raw) {
        if (raw != null) {
            String trimmed = raw.trim();
            for (EnergyUnit unit : values()) {
                if (unit.value.equalsIgnoreCase(trimmed)) {
                    return unit;
                }
            }
        }
        throw new SettlementException(ErrorCode.UNKNOWN_UNIT, "Unknown unit: '" + raw + "' (expected kWh or EUR)");
    }
}
