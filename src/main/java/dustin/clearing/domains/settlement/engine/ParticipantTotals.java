package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;
import java.util.Map;
import java.util.TreeMap;

import dustin.clearing.domains.event.model.EnergyUnit;
import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.SourceBucket;
import lombok.Getter;

/**
 * 참여자별 수량 합계
 * Participant Totals keyed by (kind, bucket, unit)
 */
@Getter
public class ParticipantTotals {

    private final ParticipantRef participant;
    private final Map<String, BigDecimal> quantities = new TreeMap<>();
    private int eventCount;

    public ParticipantTotals(ParticipantRef participant) {
        this.participant = participant;
    }

    void add(ClassifiedEvent event) {
        quantities.merge(key(event.getKind(), event.getBucket(), event.getUnit()), event.getQuantity(), BigDecimal::add);
        eventCount++;
    }

    public BigDecimal quantity(EventKind kind, SourceBucket bucket, EnergyUnit unit) {
        return quantities.getOrDefault(key(kind, bucket, unit), BigDecimal.ZERO);
    }

    /**
     * 출처와 무관한 종류/단위 합계
     */
    public BigDecimal quantity(EventKind kind, EnergyUnit unit) {
        BigDecimal sum = BigDecimal.ZERO;
        for (SourceBucket bucket : SourceBucket.values()) {
            sum = sum.add(quantity(kind, bucket, unit));
        }
        return sum;
    }

    private static String key(EventKind kind, SourceBucket bucket, EnergyUnit unit) {
        return kind.getValue() + "|" + bucket.name() + "|" + unit.getValue();
    }
}
