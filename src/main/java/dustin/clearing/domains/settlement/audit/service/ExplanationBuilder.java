package dustin.clearing.domains.settlement.audit.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import dustin.clearing.domains.event.model.EnergyUnit;
import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.SourceBucket;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.settlement.engine.ParticipantTotals;

/**
 * 정산 라인 설명문 생성기
 * Explanation Builder
 *
 * 예: "Tenant A (Tenant): 10.0 kWh local energy, 2.0 kWh grid energy. Pays 2.60 EUR."
 */
@Component
public class ExplanationBuilder {

    public static final String UNKNOWN_PARTICIPANT = "Unknown participant";

    public String explain(String name, ParticipantRole role, ParticipantTotals totals, BigDecimal amount) {
        StringBuilder text = new StringBuilder(name != null ? name : UNKNOWN_PARTICIPANT);
        if (role != null) {
            text.append(" (").append(role.getLabel()).append(")");
        }
        text.append(": ");

        List<String> parts = totals != null ? activity(totals) : List.of();
        if (parts.isEmpty()) {
            text.append("No relevant activity. ");
        } else {
            text.append(String.join(", ", parts)).append(". ");
        }

        int sign = amount.signum();
        if (sign > 0) {
            text.append("Pays ").append(eur(amount)).append(" EUR.");
        } else if (sign < 0) {
            text.append("Receives ").append(eur(amount.abs())).append(" EUR.");
        } else {
            text.append("Balanced (0 EUR).");
        }
        return text.toString();
    }

    private List<String> activity(ParticipantTotals totals) {
        BigDecimal local = totals.quantity(EventKind.CONSUMPTION, SourceBucket.LOCAL_PV, EnergyUnit.KWH)
                .add(totals.quantity(EventKind.CONSUMPTION, SourceBucket.BATTERY, EnergyUnit.KWH));
        BigDecimal grid = totals.quantity(EventKind.CONSUMPTION, SourceBucket.GRID, EnergyUnit.KWH)
                .add(totals.quantity(EventKind.CONSUMPTION, SourceBucket.UNCLASSIFIED, EnergyUnit.KWH));
        BigDecimal generated = totals.quantity(EventKind.GENERATION, EnergyUnit.KWH)
                .add(totals.quantity(EventKind.PRODUCTION, EnergyUnit.KWH))
                .add(totals.quantity(EventKind.GRID_FEED, EnergyUnit.KWH));
        BigDecimal baseFee = totals.quantity(EventKind.BASE_FEE, EnergyUnit.EUR);

        List<String> parts = new ArrayList<>();
        if (local.signum() > 0) {
            parts.add(kwh(local) + " kWh local energy");
        }
        if (grid.signum() > 0) {
            parts.add(kwh(grid) + " kWh grid energy");
        }
        if (generated.signum() > 0) {
            parts.add(kwh(generated) + " kWh generated/fed in");
        }
        if (baseFee.signum() > 0) {
            parts.add(eur(baseFee) + " EUR base fee");
        }
        return parts;
    }

    private String kwh(BigDecimal value) {
        return value.setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    private String eur(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
