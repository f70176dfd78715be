package dustin.clearing.domains.settlement.audit.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import dustin.clearing.domains.settlement.audit.model.dto.AuditPayload;
import dustin.clearing.domains.settlement.audit.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 감사 컨트롤러
 * Audit Controller
 *
 * API 엔드포인트:
 * - GET /api/v1/settlements/{batchId}/audit?explain=true - 증명 해시 검증 (+ 설명문)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/settlements")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "정산 배치 감사 API")
public class AuditController {

    private final AuditService auditService;

    @Operation(
            summary = "정산 배치 감사",
            description = "저장된 라인마다 증명 해시를 재계산해 저장값과 비교합니다. " +
                         "explain=true면 라인별 설명문을 함께 반환합니다."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "감사 결과"),
            @ApiResponse(responseCode = "404", description = "배치 없음", content = @Content)
    })
    @GetMapping("/{batchId}/audit")
    public ResponseEntity<AuditPayload> getAudit(
            @Parameter(description = "배치 ID", example = "1") @PathVariable Long batchId,
            @Parameter(description = "설명문 포함 여부") @RequestParam(defaultValue = "false") boolean explain) {
        log.info("[AuditController] 감사 요청: batchId={}, explain={}", batchId, explain);
        return ResponseEntity.ok(auditService.getAuditPayload(batchId, explain));
    }
}
