package dustin.clearing.domains.participant.model.entity;

import java.time.LocalDateTime;

import dustin.clearing.domains.participant.model.ParticipantRole;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 참여자 엔티티
 * Participant Entity
 *
 * 역할:
 * - 이벤트를 발생시키거나 정산 상대방이 되는 경제 주체
 * - 외부 ID(external_id) 기준으로 최초 참조 시 한 번만 생성 (멱등)
 *
 * 데이터 구조:
 * ===========
 * - external_id: 외부 시스템의 안정적인 참여자 식별자 (정산 엔진 내부 키)
 * - name: 표시 이름 (해시에 포함되지 않으므로 변경되어도 증명에 영향 없음)
 * - role: 역할 (한 번 지정되면 변경 불가)
 */
@Entity
@Table(name = "participants",
       indexes = {
           @Index(name = "idx_participants_role", columnList = "role")
       },
       uniqueConstraints = {
           @jakarta.persistence.UniqueConstraint(
               name = "uk_participants_external_id",
               columnNames = {"external_id"}
           )
       })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Participant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false, length = 255, updatable = false)
    private String externalId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * 역할 (updatable = false: 정산 기간 중 역할 변경 방지)
     */
    @Convert(converter = ParticipantRoleConverter.class)
    @Column(name = "role", nullable = false, length = 32, updatable = false)
    private ParticipantRole role;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
