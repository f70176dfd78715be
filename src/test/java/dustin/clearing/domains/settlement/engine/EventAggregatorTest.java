package dustin.clearing.domains.settlement.engine;

import static dustin.clearing.domains.settlement.engine.EngineFixtures.T0;
import static dustin.clearing.domains.settlement.engine.EngineFixtures.participant;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import dustin.clearing.domains.event.model.EnergyUnit;
import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.SourceBucket;
import dustin.clearing.domains.event.model.entity.UsageEvent;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 이벤트 집계기 테스트
 * EventAggregator 기간 필터 / 출처 분류 / 누적 순서
 */
class EventAggregatorTest {

    private final EventAggregator eventAggregator = new EventAggregator();

    private final SettlementWindow window = SettlementWindow.of(T0, T0.plusDays(1));
    private final Map<Long, Participant> participants = Map.of(
            1L, participant(1L, "tenant-a", ParticipantRole.TENANT),
            2L, participant(2L, "tenant-b", ParticipantRole.TENANT));

    private UsageEvent usage(long id, long participantId, EventKind kind, String quantity,
                             String source, LocalDateTime timestamp) {
        return UsageEvent.builder()
                .id(id)
                .participantId(participantId)
                .eventKind(kind)
                .quantity(new BigDecimal(quantity))
                .unit(EnergyUnit.KWH)
                .source(source)
                .timestamp(timestamp)
                .build();
    }

    @Test
    @DisplayName("기간 [start, end): start 포함, end 제외")
    void halfOpenWindow() {
        AggregationResult result = eventAggregator.aggregate(List.of(
                usage(1L, 1L, EventKind.CONSUMPTION, "1", "grid", T0),
                usage(2L, 1L, EventKind.CONSUMPTION, "2", "grid", T0.plusDays(1)),
                usage(3L, 1L, EventKind.CONSUMPTION, "4", "grid", T0.minusNanos(1000))), participants, window);

        assertThat(result.getEvents()).extracting(ClassifiedEvent::getEventId).containsExactly(1L);
        assertThat(result.getTotals().get("tenant-a").quantity(EventKind.CONSUMPTION, SourceBucket.GRID, EnergyUnit.KWH))
                .isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("누적 순서는 timestamp → event id (입력 순서 무관)")
    void deterministicOrder() {
        LocalDateTime noon = T0.plusHours(12);
        AggregationResult result = eventAggregator.aggregate(List.of(
                usage(7L, 2L, EventKind.CONSUMPTION, "1", "grid", noon),
                usage(5L, 1L, EventKind.CONSUMPTION, "1", "grid", noon),
                usage(9L, 1L, EventKind.CONSUMPTION, "1", "grid", T0.plusHours(1))), participants, window);

        assertThat(result.getEvents()).extracting(ClassifiedEvent::getEventId).containsExactly(9L, 5L, 7L);
    }

    @Test
    @DisplayName("출처 분류 및 참여자별 합계")
    void classifiesSources() {
        AggregationResult result = eventAggregator.aggregate(List.of(
                usage(1L, 1L, EventKind.CONSUMPTION, "3", "Local-PV", T0.plusHours(1)),
                usage(2L, 1L, EventKind.CONSUMPTION, "2", "solar", T0.plusHours(2)),
                usage(3L, 1L, EventKind.CONSUMPTION, "1.5", "local_battery", T0.plusHours(3)),
                usage(4L, 1L, EventKind.CONSUMPTION, "0.5", "windmill", T0.plusHours(4)),
                usage(5L, 2L, EventKind.GRID_FEED, "8", null, T0.plusHours(5))), participants, window);

        ParticipantTotals tenantA = result.getTotals().get("tenant-a");
        assertThat(tenantA.getEventCount()).isEqualTo(4);
        assertThat(tenantA.quantity(EventKind.CONSUMPTION, SourceBucket.LOCAL_PV, EnergyUnit.KWH)).isEqualByComparingTo("5");
        assertThat(tenantA.quantity(EventKind.CONSUMPTION, SourceBucket.BATTERY, EnergyUnit.KWH)).isEqualByComparingTo("1.5");
        assertThat(tenantA.quantity(EventKind.CONSUMPTION, SourceBucket.UNCLASSIFIED, EnergyUnit.KWH)).isEqualByComparingTo("0.5");
        assertThat(tenantA.quantity(EventKind.CONSUMPTION, EnergyUnit.KWH)).isEqualByComparingTo("7");
        assertThat(result.getTotals().get("tenant-b").quantity(EventKind.GRID_FEED, EnergyUnit.KWH)).isEqualByComparingTo("8");
        assertThat(result.getTotals().keySet()).containsExactly("tenant-a", "tenant-b");
    }

    @Test
    @DisplayName("등록되지 않은 참여자 → UNKNOWN_PARTICIPANT")
    void unknownParticipant() {
        assertThatThrownBy(() -> eventAggregator.aggregate(List.of(
                usage(1L, 99L, EventKind.CONSUMPTION, "1", "grid", T0.plusHours(1))), participants, window))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getErrorCode())
                .isEqualTo(ErrorCode.UNKNOWN_PARTICIPANT);
    }

    @Test
    @DisplayName("이벤트가 없으면 빈 결과")
    void emptyInput() {
        AggregationResult result = eventAggregator.aggregate(List.of(), participants, window);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.getTotals()).isEmpty();
    }

    @Test
    @DisplayName("잘못된 기간 → INVALID_WINDOW")
    void invalidWindow() {
        assertThatThrownBy(() -> SettlementWindow.of(T0, T0))
                .isInstanceOf(SettlementException.class)
                .extracting(e -> ((SettlementException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_WINDOW);
        assertThat(window.toString()).isEqualTo("[2026-01-28T00:00, 2026-01-29T00:00)");
    }
}
