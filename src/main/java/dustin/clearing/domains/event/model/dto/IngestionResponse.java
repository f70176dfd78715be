package dustin.clearing.domains.event.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 이벤트 수집 결과 DTO
 * Ingestion Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "이벤트 수집 결과")
public class IngestionResponse {

    @Schema(description = "처리 상태", example = "success")
    private String status;

    @Schema(description = "저장된 이벤트 수", example = "3")
    private int ingested;

    @Schema(description = "이번 요청으로 새로 생성된 참여자 수", example = "1")
    private int participantsCreated;

    @Schema(description = "메시지", example = "Ingested 3 events.")
    private String message;
}
