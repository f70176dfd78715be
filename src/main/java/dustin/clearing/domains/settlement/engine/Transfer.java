package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 양자 간 이체 (저장하지 않는 파생 값)
 * Bilateral Transfer
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
@Schema(description = "상계 후 이체")
public class Transfer {

    @Schema(description = "지불자 외부 ID", example = "tenant-a")
    private final String debtor;

    @Schema(description = "수취자 외부 ID", example = "landlord")
    private final String creditor;

    @Schema(description = "금액 (EUR)", example = "2.00")
    private final BigDecimal amount;
}
