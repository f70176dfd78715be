package dustin.clearing.domains.settlement.ledger.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import dustin.clearing.domains.policy.model.entity.PolicyRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 정산 배치 엔티티
 * Settlement Batch Entity
 *
 * 역할:
 * - 정산 실행 한 건의 헤더 (유스케이스, 기간, 정책, 코드 버전, 통계)
 * - 추가 전용: 저장 후 수정 불가. 보정은 같은 기간의 새 배치로 발행
 *
 * 기간: [window_start, window_end) (UTC)
 */
@Entity
@Table(name = "settlement_batches",
       indexes = {
           @Index(name = "idx_settlement_batches_use_case_window", columnList = "use_case, window_start, window_end")
       })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SettlementBatch {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "use_case", nullable = false, length = 32)
    private String useCase;

    @Column(name = "window_start", nullable = false)
    private LocalDateTime windowStart;

    @Column(name = "window_end", nullable = false)
    private LocalDateTime windowEnd;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "policy_id", nullable = false)
    private PolicyRecord policy;

    @Column(name = "code_version", nullable = false, length = 64)
    private String codeVersion;

    @Column(name = "participant_count", nullable = false)
    private Integer participantCount;

    @Column(name = "transfer_count", nullable = false)
    private Integer transferCount;

    @Column(name = "gross_volume", nullable = false, precision = 19, scale = 2)
    private BigDecimal grossVolume;

    @Column(name = "net_volume", nullable = false, precision = 19, scale = 2)
    private BigDecimal netVolume;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }

    @PreUpdate
    protected void onUpdate() {
        throw new UnsupportedOperationException("Settlement batches are append-only: id=" + id);
    }
}
