package dustin.clearing.domains.settlement.ledger.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.clearing.domains.settlement.ledger.model.dto.NettingPreviewResponse;
import dustin.clearing.domains.settlement.ledger.model.dto.SettleRequest;
import dustin.clearing.domains.settlement.ledger.model.dto.SettlementResponse;
import dustin.clearing.domains.settlement.ledger.service.SettlementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 정산 컨트롤러
 * Settlement Controller
 *
 * API 엔드포인트:
 * - POST /api/v1/settlements - 정산 실행 (배치 + 라인 + 증명 해시 저장)
 * - POST /api/v1/netting/preview - 상계 미리보기 (저장 없음)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Tag(name = "Settlement", description = "정산 실행 및 상계 미리보기 API")
public class SettlementController {

    private final SettlementService settlementService;

    @Operation(
            summary = "정산 실행",
            description = "기간 [start_time, end_time) 의 이벤트를 정책에 따라 평가하고 상계한 뒤 배치와 정산 라인을 저장합니다.\n\n" +
                         "**요청 예시:**\n" +
                         "```json\n" +
                         "{\n" +
                         "  \"use_case\": \"mieterstrom\",\n" +
                         "  \"parameters\": {\"unclassified_source_treatment\": \"EXTERNAL_MARKET\"},\n" +
                         "  \"start_time\": \"2026-01-28T00:00:00\",\n" +
                         "  \"end_time\": \"2026-01-29T00:00:00\"\n" +
                         "}\n" +
                         "```\n\n" +
                         "기간 내 이벤트가 없으면 배치를 만들지 않고 200과 메시지를 반환합니다."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "배치 생성"),
            @ApiResponse(responseCode = "200", description = "정산 대상 이벤트 없음"),
            @ApiResponse(responseCode = "400", description = "잘못된 정책/기간/이벤트", content = @Content),
            @ApiResponse(responseCode = "500", description = "보존 법칙 위반", content = @Content)
    })
    @PostMapping("/settlements")
    public ResponseEntity<SettlementResponse> executeSettlement(@Valid @RequestBody SettleRequest request) {
        log.info("[SettlementController] 정산 실행 요청: useCase={}, start={}, end={}",
                request.getUseCase(), request.getStartTime(), request.getEndTime());
        SettlementResponse response = settlementService.executeSettlement(request);
        HttpStatus status = response.getBatchId() != null ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @Operation(summary = "상계 미리보기", description = "정산 실행과 같은 계산을 수행하지만 아무것도 저장하지 않습니다.")
    @PostMapping("/netting/preview")
    public ResponseEntity<NettingPreviewResponse> previewNetting(@Valid @RequestBody SettleRequest request) {
        log.info("[SettlementController] 상계 미리보기 요청: useCase={}", request.getUseCase());
        return ResponseEntity.ok(settlementService.previewNetting(request));
    }
}
