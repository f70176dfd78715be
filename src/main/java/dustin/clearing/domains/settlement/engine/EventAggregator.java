package dustin.clearing.domains.settlement.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import dustin.clearing.domains.event.model.SourceBucket;
import dustin.clearing.domains.event.model.entity.UsageEvent;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.extern.slf4j.Slf4j;

/**
 * 이벤트 집계기
 * Event Aggregator
 *
 * 역할:
 * - 기간 [start, end) 밖 이벤트 제외
 * - 출처 분류 (SourceBucket)
 * - 누적 순서 고정: timestamp → event id (반올림 재현성)
 * - 참여자별 (종류, 출처, 단위) 수량 합계
 *
 * 상태 없음. 입력 순서가 달라도 결과는 같습니다.
 */
@Slf4j
@Component
public class EventAggregator {

    private static final Comparator<UsageEvent> ACCUMULATION_ORDER = Comparator
            .comparing(UsageEvent::getTimestamp)
            .thenComparing(UsageEvent::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    /**
     * 이벤트 집계
     *
     * @param events 이벤트 (순서 무관)
     * @param participantsById 내부 ID → 참여자
     * @param window 정산 기간
     * @throws SettlementException UNKNOWN_PARTICIPANT, INVALID_EVENT
     */
    public AggregationResult aggregate(Collection<UsageEvent> events,
                                       Map<Long, Participant> participantsById,
                                       SettlementWindow window) {
        List<UsageEvent> ordered = new ArrayList<>();
        for (UsageEvent event : events) {
            if (event.getTimestamp() == null) {
                throw new SettlementException(ErrorCode.INVALID_EVENT,
                        "Event " + event.getId() + " has no timestamp");
            }
            if (window.contains(event.getTimestamp())) {
                ordered.add(event);
            }
        }
        ordered.sort(ACCUMULATION_ORDER);

        List<ClassifiedEvent> classified = new ArrayList<>(ordered.size());
        Map<String, ParticipantTotals> totals = new TreeMap<>();
        for (UsageEvent event : ordered) {
            Participant participant = participantsById.get(event.getParticipantId());
            if (participant == null) {
                throw new SettlementException(ErrorCode.UNKNOWN_PARTICIPANT, String.format(
                        "Event %d references unknown participant id %d", event.getId(), event.getParticipantId()));
            }
            if (event.getEventKind() == null || event.getUnit() == null || event.getQuantity() == null) {
                throw new SettlementException(ErrorCode.INVALID_EVENT, String.format(
                        "Event %d of participant '%s' is missing kind, unit or quantity",
                        event.getId(), participant.getExternalId()));
            }

            ParticipantRef ref = ParticipantRef.of(participant);
            ClassifiedEvent item = new ClassifiedEvent(
                    event.getId(),
                    ref,
                    event.getEventKind(),
                    event.getQuantity(),
                    event.getUnit(),
                    event.getSource(),
                    SourceBucket.classify(event.getSource()),
                    event.getPricePerUnit(),
                    event.getTimestamp());
            classified.add(item);
            totals.computeIfAbsent(ref.getExternalId(), key -> new ParticipantTotals(ref)).add(item);
        }

        log.debug("[EventAggregator] 집계 완료: window={}, input={}, inWindow={}, participants={}",
                window, events.size(), classified.size(), totals.size());
        return new AggregationResult(window, Collections.unmodifiableList(classified), Collections.unmodifiableMap(totals));
    }
}
