package dustin.clearing.domains.settlement.engine;

import java.util.List;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 집계 결과
 * Aggregation Result
 *
 * events: 고정 누적 순서 (timestamp, event id)
 * totals: 외부 ID 오름차순
 */
@Getter
@AllArgsConstructor
public class AggregationResult {

    private final SettlementWindow window;
    private final List<ClassifiedEvent> events;
    private final Map<String, ParticipantTotals> totals;

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
