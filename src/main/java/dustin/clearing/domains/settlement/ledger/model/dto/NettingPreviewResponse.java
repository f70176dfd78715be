package dustin.clearing.domains.settlement.ledger.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import dustin.clearing.domains.settlement.engine.NettingStats;
import dustin.clearing.domains.settlement.engine.ParticipantBalance;
import dustin.clearing.domains.settlement.engine.Transfer;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 상계 미리보기 응답 DTO
 * Netting Preview Response DTO
 *
 * 아무것도 저장하지 않은 계산 결과
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "상계 미리보기 결과")
public class NettingPreviewResponse {

    @Schema(description = "메시지 (이벤트가 없을 때만)", example = "No events found in the specified timeframe.")
    private String message;

    @Schema(description = "유스케이스", example = "energy_community")
    private String useCase;

    private LocalDateTime start;

    private LocalDateTime end;

    @Schema(description = "상계 통계")
    private NettingStats stats;

    @Schema(description = "이체 목록")
    private List<Transfer> transfers;

    @Schema(description = "최종 순액 (외부 ID → 금액)")
    private Map<String, BigDecimal> finalBalances;

    @Schema(description = "참여자별 대변/차변/순액 (기준 적용 전)")
    private Map<String, ParticipantBalance> balances;

    @Schema(description = "최소 지급 기준 미달로 0 처리된 순액")
    private Map<String, BigDecimal> suppressedPositions;

    @Schema(description = "매칭되지 않은 잔여 금액")
    private Map<String, BigDecimal> unmatchedResiduals;
}
