package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 참여자별 대변/차변/순액 내역 (최소 지급 기준 적용 전)
 * Participant Balance Breakdown
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Schema(description = "참여자별 대변/차변/순액")
public class ParticipantBalance {

    @Schema(description = "받을 금액 합계 (EUR)", example = "2.80")
    private final BigDecimal credit;

    @Schema(description = "지불할 금액 합계 (EUR)", example = "0.00")
    private final BigDecimal debit;

    @Schema(description = "순액 = 차변 − 대변", example = "-2.80")
    private final BigDecimal net;
}
