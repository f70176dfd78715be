package dustin.clearing.domains.event.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import dustin.clearing.domains.event.model.EnergyUnit;
import dustin.clearing.domains.event.model.EventKind;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Converter;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 계량 이벤트 엔티티
 * Usage Event Entity
 *
 * 역할:
 * - 참여자의 발전/소비/계통송전/기본료 등 계량 이벤트 한 건
 * - 기록 후 변경 불가 (정산 재현성)
 *
 * 데이터 구조:
 * ===========
 * - participant_id: 참여자 내부 ID
 * - event_kind: 이벤트 종류
 * - quantity + unit: kWh 또는 EUR
 * - source: 원본 출처 태그 (예: local_pv, battery, grid). 분류는 정산 시점에 수행
 * - price_per_unit: 이벤트가 직접 가진 단가 (선택)
 * - event_timestamp: 계량 시각 (UTC). 정산 기간 [start, end) 판정 기준
 */
@Entity
@Table(name = "usage_events",
       indexes = {
           @Index(name = "idx_usage_events_timestamp", columnList = "event_timestamp"),
           @Index(name = "idx_usage_events_participant", columnList = "participant_id")
       })
@Getter
@ToString
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class UsageEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Convert(converter = EventKindConverter.class)
    @Column(name = "event_kind", nullable = false, length = 32)
    private EventKind eventKind;

    @Column(name = "quantity", nullable = false, precision = 30, scale = 9)
    private BigDecimal quantity;

    @Convert(converter = EnergyUnitConverter.class)
    @Column(name = "unit", nullable = false, length = 8)
    private EnergyUnit unit;

    @Column(name = "source", length = 64)
    private String source;

    @Column(name = "price_per_unit", precision = 19, scale = 6)
    private BigDecimal pricePerUnit;

    @Column(name = "event_timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    @PreUpdate
    protected void onUpdate() {
        throw new UnsupportedOperationException("Usage events are immutable once recorded: id=" + id);
    }

    @Converter
    public static class EventKindConverter implements AttributeConverter<EventKind, String> {
        @Override
        public String convertToDatabaseColumn(EventKind kind) {
            return kind != null ? kind.getValue() : null;
        }

        @Override
        public EventKind convertToEntityAttribute(String value) {
            return value != null ? EventKind.fromValue(value) : null;
        }
    }

    @Converter
    public static class EnergyUnitConverter implements AttributeConverter<EnergyUnit, String> {
        @Override
        public String convertToDatabaseColumn(EnergyUnit unit) {
            return unit != null ? unit.getValue() : null;
        }

        @Override
        public EnergyUnit convertToEntityAttribute(String value) {
            return value != null ? EnergyUnit.fromValue(value) : null;
        }
    }
}
