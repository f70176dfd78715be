package dustin.clearing.domains.settlement.audit.model.dto;

import java.time.LocalDateTime;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 감사 응답 DTO
 * Audit Payload
 *
 * all_verified: 모든 라인의 재계산 해시가 저장된 해시와 같으면 true (라인이 없어도 true)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "정산 배치 감사 결과")
public class AuditPayload {

    @Schema(description = "배치 ID", example = "1")
    private Long batchId;

    @Schema(description = "유스케이스", example = "mieterstrom")
    private String useCase;

    @Schema(description = "배치 생성 시각 (UTC)")
    private LocalDateTime createdAt;

    @Schema(description = "정산 기간 시작 (포함)")
    private LocalDateTime start;

    @Schema(description = "정산 기간 끝 (제외)")
    private LocalDateTime end;

    @Schema(description = "배치를 만든 코드 버전", example = "1.0.0")
    private String codeVersion;

    @Schema(description = "적용된 정책 기록 ID", example = "1")
    private Long policyId;

    @Schema(description = "모든 라인 검증 여부")
    private boolean allVerified;

    private List<AuditLineView> lines;
}
