package dustin.clearing.domains.event.model.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 계량 이벤트 수집 요청 DTO
 * Energy Event Ingestion Request DTO
 *
 * 역할:
 * - 외부 계량 시스템이 보내는 이벤트 한 건
 * - participant_id는 외부 ID. 처음 보는 ID면 참여자를 생성
 *
 * 예시:
 * - 세입자 PV 소비: participant_id='tenant-a', event_kind='consumption', quantity=10, unit='kWh', source='local_pv'
 * - 기본료: participant_id='tenant-a', event_kind='base_fee', quantity=1, unit='kWh' (단위 개수 × base_fee_per_unit)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "계량 이벤트")
public class EnergyEventRequest {

    @NotBlank(message = "participant_id는 필수입니다")
    @Size(max = 255, message = "participant_id는 255자 이하여야 합니다")
    @Schema(description = "참여자 외부 ID", example = "tenant-a", requiredMode = Schema.RequiredMode.REQUIRED)
    private String participantId;

    @Size(max = 255, message = "participant_name은 255자 이하여야 합니다")
    @Schema(description = "참여자 표시 이름 (최초 생성 시에만 사용)", example = "Tenant A")
    private String participantName;

    /**
     * 역할 (선택)
     *
     * 미지정 시 신규 참여자는 prosumer, 기존 참여자는 기존 역할 유지
     */
    @Schema(description = "참여자 역할", example = "tenant",
            allowableValues = {"consumer", "tenant", "commercial_tenant", "landlord", "operator", "prosumer", "external_market", "fee_collector"})
    private String role;

    @NotBlank(message = "event_kind는 필수입니다")
    @Schema(description = "이벤트 종류", example = "consumption", requiredMode = Schema.RequiredMode.REQUIRED)
    private String eventKind;

    @NotNull(message = "quantity는 필수입니다")
    @PositiveOrZero(message = "quantity는 0 이상이어야 합니다")
    @Schema(description = "수량", example = "10.0", requiredMode = Schema.RequiredMode.REQUIRED)
    private BigDecimal quantity;

    @NotBlank(message = "unit은 필수입니다")
    @Schema(description = "단위 (kWh 또는 EUR)", example = "kWh", requiredMode = Schema.RequiredMode.REQUIRED)
    private String unit;

    @NotNull(message = "timestamp는 필수입니다")
    @Schema(description = "계량 시각 (UTC)", example = "2026-01-28T10:00:00", requiredMode = Schema.RequiredMode.REQUIRED)
    private LocalDateTime timestamp;

    @Size(max = 64, message = "source는 64자 이하여야 합니다")
    @Schema(description = "출처 태그 (local_pv, battery, grid 등)", example = "local_pv")
    private String source;

    @PositiveOrZero(message = "price_per_unit는 0 이상이어야 합니다")
    @Schema(description = "이벤트 단가 (EUR/kWh, 선택)", example = "0.20")
    private BigDecimal pricePerUnit;
}
