package dustin.clearing.domains.event.model;

import java.util.Locale;

/**
 * 에너지 출처 분류
 * Source Bucket
 *
 * 이벤트의 source 태그를 정규화(소문자, '-'와 공백 → '_')한 뒤 분류합니다.
 * - LOCAL_PV: local_pv, pv, solar
 * - BATTERY: battery, local_battery
 * - GRID: grid, grid_import
 * - UNCLASSIFIED: 그 외 전부 (null/공백 포함)
 */
public enum SourceBucket {
    LOCAL_PV,
    BATTERY,
    GRID,
    UNCLASSIFIED;

    public boolean isLocal() {
        return this == LOCAL_PV || this == BATTERY;
    }

    public static String normalize(String source) {
        if (source == null) {
            return "";
        }
        return source.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }

    public static SourceBucket classify(String source) {
        switch (normalize(source)) {
            case "local_pv":
            case "pv":
            case "solar":
                return LOCAL_PV;
            case "battery":
            case "local_battery":
                return BATTERY;
            case "grid":
            case "grid_import":
                return GRID;
            default:
                return UNCLASSIFIED;
        }
    }
}
