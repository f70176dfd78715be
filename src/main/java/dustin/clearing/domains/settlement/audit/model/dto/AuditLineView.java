package dustin.clearing.domains.settlement.audit.model.dto;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 감사 라인 DTO
 * Audit Line View
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "감사 대상 정산 라인")
public class AuditLineView {

    private Long lineId;

    @Schema(description = "참여자 내부 ID", example = "1")
    private Long participantId;

    @Schema(description = "참여자 외부 ID (참여자를 찾을 수 없으면 null)", example = "tenant-a")
    private String participantExternalId;

    @Schema(description = "참여자 이름 (찾을 수 없으면 'Unknown participant')", example = "Tenant A")
    private String participantName;

    @Schema(description = "참여자 역할", example = "tenant")
    private String participantRole;

    @Schema(description = "금액 (양수: 지불, 음수: 수취)", example = "2.00")
    private BigDecimal amount;

    private String description;

    @Schema(description = "저장된 증명 해시")
    private String proofHash;

    @Schema(description = "재계산 해시 일치 여부")
    @JsonProperty("is_verified")
    private boolean verified;

    @Schema(description = "설명문 (explain=true일 때만)")
    private String explanation;
}
