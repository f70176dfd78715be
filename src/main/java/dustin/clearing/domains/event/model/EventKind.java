package dustin.clearing.domains.event.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 계량 이벤트 종류 (닫힌 집합)
 * Usage Event Kind
 */
public enum EventKind {
    GENERATION("generation"),
    CONSUMPTION("consumption"),
    GRID_FEED("grid_feed"),
    BASE_FEE("base_fee"),
    BATTERY_CHARGE("battery_charge"),
    BATTERY_DISCHARGE("battery_discharge"),
    PRODUCTION("production"),
    VPP_SALE("vpp_sale");

    private final String value;

    EventKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @throws SettlementException UNKNOWN_EVENT_KIND 닫힌 집합 밖의 값
     */
    @JsonCreator
    public static EventKind fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
            for (EventKind kind : values()) {
                if (kind.value.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new SettlementException(ErrorCode.UNKNOWN_EVENT_KIND, "Unknown event kind: '" + raw + "'");
    }
}
