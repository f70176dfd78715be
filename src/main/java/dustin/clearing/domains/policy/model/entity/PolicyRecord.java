package dustin.clearing.domains.policy.model.entity;

import java.time.LocalDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 정산 정책 기록 엔티티
 * Settlement Policy Record Entity
 *
 * 역할:
 * - 정산 실행 한 건에 적용된 정규화 정책(기본값 포함) 보존
 * - 배치가 이 기록을 참조하므로 어떤 단가/비율로 계산했는지 사후 재현 가능
 *
 * 불변: 저장 후 수정 불가
 */
@Entity
@Table(name = "settlement_policies")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PolicyRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "use_case", nullable = false, length = 32)
    private String useCase;

    /**
     * 정규화 정책 JSON (키 정렬)
     */
    @Column(name = "parameters_json", nullable = false, columnDefinition = "TEXT")
    private String parametersJson;

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
        throw new UnsupportedOperationException("Policy records are immutable: id=" + id);
    }
}
