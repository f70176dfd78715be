package dustin.clearing.domains.event.controller;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.clearing.domains.event.model.dto.EnergyEventRequest;
import dustin.clearing.domains.event.model.dto.IngestionResponse;
import dustin.clearing.domains.event.service.UsageEventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 계량 이벤트 수집 컨트롤러
 * Energy Event Ingestion Controller
 *
 * API 엔드포인트:
 * - POST /api/v1/energy-events - 이벤트 목록 수집
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/energy-events")
@RequiredArgsConstructor
@Tag(name = "Energy Events", description = "계량 이벤트 수집 API")
public class UsageEventController {

    private final UsageEventService usageEventService;

    @Operation(
            summary = "계량 이벤트 수집",
            description = "계량 이벤트 목록을 한 트랜잭션으로 저장합니다. 처음 보는 participant_id는 참여자로 자동 등록됩니다.\n\n" +
                         "**요청 예시:**\n" +
                         "```json\n" +
                         "[\n" +
                         "  {\"participant_id\": \"tenant-a\", \"role\": \"tenant\", \"event_kind\": \"consumption\",\n" +
                         "   \"quantity\": 10, \"unit\": \"kWh\", \"timestamp\": \"2026-01-28T10:00:00\", \"source\": \"local_pv\"}\n" +
                         "]\n" +
                         "```"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "수집 성공"),
            @ApiResponse(responseCode = "400", description = "잘못된 이벤트 (전체 거부)", content = @Content)
    })
    @PostMapping
    public ResponseEntity<IngestionResponse> ingest(@RequestBody List<EnergyEventRequest> events) {
        log.info("[UsageEventController] 이벤트 수집 요청: count={}", events != null ? events.size() : 0);
        return ResponseEntity.status(HttpStatus.CREATED).body(usageEventService.ingest(events));
    }
}
