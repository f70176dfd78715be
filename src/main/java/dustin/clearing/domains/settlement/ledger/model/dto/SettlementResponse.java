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
 * 정산 실행 응답 DTO
 * Settlement Execution Response DTO
 *
 * 기간 내 이벤트가 없으면 status=empty, batch_id 없이 message만 반환
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "정산 실행 결과")
public class SettlementResponse {

    @Schema(description = "처리 상태 (success | empty)", example = "success")
    private String status;

    @Schema(description = "생성된 배치 ID", example = "1")
    private Long batchId;

    @Schema(description = "메시지", example = "Settlement executed and proofs generated.")
    private String message;

    @Schema(description = "유스케이스", example = "mieterstrom")
    private String useCase;

    @Schema(description = "정산 기간 시작 (포함)")
    private LocalDateTime start;

    @Schema(description = "정산 기간 끝 (제외)")
    private LocalDateTime end;

    @Schema(description = "저장된 정산 라인 수", example = "3")
    private Integer linesWritten;

    /**
     * 외부 ID → 최종 순액 (양수: 지불, 음수: 수취)
     */
    @Schema(description = "최종 순액")
    private Map<String, BigDecimal> finalNetBalances;

    @Schema(description = "참여자별 대변/차변/순액 (기준 적용 전)")
    private Map<String, ParticipantBalance> balances;

    @Schema(description = "최소 지급 기준 미달로 0 처리된 순액")
    private Map<String, BigDecimal> suppressedPositions;

    @Schema(description = "매칭되지 않은 잔여 금액")
    private Map<String, BigDecimal> unmatchedResiduals;

    @Schema(description = "상계 후 이체 목록")
    private List<Transfer> transfers;

    @Schema(description = "상계 통계")
    private NettingStats stats;
}
