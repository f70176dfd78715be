package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * 상계 통계
 * Netting Statistics
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
@Schema(description = "상계 통계")
public class NettingStats {

    @Schema(description = "이체 건수", example = "2")
    private final int transferCount;

    @Schema(description = "총 거래액 (Σ 대변 + Σ 차변)", example = "5.60")
    private final BigDecimal grossVolume;

    @Schema(description = "순 거래액 (Σ |최종 순액|)", example = "5.60")
    private final BigDecimal netVolume;

    @Schema(description = "대변 합계", example = "2.80")
    private final BigDecimal totalCredit;

    @Schema(description = "차변 합계", example = "2.80")
    private final BigDecimal totalDebit;

    @Schema(description = "상계 효율 (1 − 순/총, 총 거래액 0이면 0)", example = "0.0000")
    private final BigDecimal efficiency;

    @Schema(description = "참여자 수", example = "3")
    private final int participantCount;

    @Schema(description = "포스팅이 없는 이벤트 수", example = "0")
    private final int unpricedEvents;
}
