package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 복식부기 포스팅 한 쌍
 * Double-entry Posting
 *
 * debtor 차변 += amount, creditor 대변 += amount
 */
@Getter
@ToString
@AllArgsConstructor
public class Posting {

    private final Long eventId;
    private final String ruleName;
    private final ParticipantRef debtor;
    private final ParticipantRef creditor;
    private final BigDecimal amount;
}
