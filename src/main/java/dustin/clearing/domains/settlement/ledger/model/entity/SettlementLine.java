package dustin.clearing.domains.settlement.ledger.model.entity;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

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
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 정산 라인 엔티티
 * Settlement Line Entity
 *
 * 역할:
 * - 배치 내 참여자 1명의 최종 순액
 * - proof_hash = SHA-256(canonical {amount, batch_id, description, participant_id})
 *
 * 부호: 양수 = 참여자가 지불, 음수 = 참여자가 수취
 *
 * 배치와 같은 트랜잭션에서 한 번만 기록되며 수정 불가
 */
@Entity
@Table(name = "settlement_lines",
       indexes = {
           @Index(name = "idx_settlement_lines_batch", columnList = "batch_id")
       },
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_settlement_lines_batch_participant", columnNames = {"batch_id", "participant_id"})
       })
@Getter
@ToString(exclude = "batch")
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class SettlementLine {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_id", nullable = false)
    private SettlementBatch batch;

    @Column(name = "participant_id", nullable = false)
    private Long participantId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "description", nullable = false, length = 255)
    private String description;

    @Column(name = "proof_hash", nullable = false, length = 64)
    private String proofHash;

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
        throw new UnsupportedOperationException("Settlement lines are append-only: id=" + id);
    }
}
