package dustin.clearing.domains.settlement.ledger.model.dto;

import java.time.LocalDateTime;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAlias;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 정산 실행 / 상계 미리보기 요청 DTO
 * Settle Request DTO
 *
 * 기간이 없으면 [now − settlement.default-lookback, now) (UTC)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "정산 실행 요청")
public class SettleRequest {

    @NotBlank(message = "use_case는 필수입니다")
    @Schema(description = "유스케이스", example = "mieterstrom", requiredMode = Schema.RequiredMode.REQUIRED)
    private String useCase;

    /**
     * 정책 파라미터 (기본값은 GET /api/v1/use-cases 참고)
     */
    @JsonAlias("policy_body")
    @Schema(description = "정책 파라미터", example = "{\"unclassified_source_treatment\": \"EXTERNAL_MARKET\", \"operator_fee_rate\": 0.15}")
    private Map<String, Object> parameters;

    @Schema(description = "정산 기간 시작 (포함, UTC)", example = "2026-01-28T00:00:00")
    private LocalDateTime startTime;

    @Schema(description = "정산 기간 끝 (제외, UTC)", example = "2026-01-29T00:00:00")
    private LocalDateTime endTime;
}
