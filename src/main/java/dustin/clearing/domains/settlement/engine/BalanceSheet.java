package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import lombok.Getter;

/**
 * 참여자별 대변/차변 잔액표
 * Balance Sheet
 *
 * 외부 ID 오름차순으로 보관합니다. 금액은 반올림하지 않은 BigDecimal 그대로 누적합니다.
 */
public class BalanceSheet {

    private final Map<String, Balance> balances = new TreeMap<>();

    /**
     * 포스팅이 없어도 참여자를 잔액표에 올림 (참여자 수 통계용)
     */
    public Balance register(ParticipantRef participant) {
        return balances.computeIfAbsent(participant.getExternalId(), key -> new Balance(participant));
    }

    public void apply(Posting posting) {
        Balance debtor = register(posting.getDebtor());
        debtor.debit = debtor.debit.add(posting.getAmount());
        Balance creditor = register(posting.getCreditor());
        creditor.credit = creditor.credit.add(posting.getAmount());
    }

    public Collection<Balance> getBalances() {
        return Collections.unmodifiableCollection(balances.values());
    }

    public Balance get(String externalId) {
        return balances.get(externalId);
    }

    public int size() {
        return balances.size();
    }

    public BigDecimal totalCredit() {
        return balances.values().stream().map(Balance::getCredit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalDebit() {
        return balances.values().stream().map(Balance::getDebit).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Getter
    public static class Balance {
        private final ParticipantRef participant;
        private BigDecimal credit = BigDecimal.ZERO;
        private BigDecimal debit = BigDecimal.ZERO;

        Balance(ParticipantRef participant) {
            this.participant = participant;
        }

        /**
         * 순액 = 차변 − 대변 (양수: 지불할 금액, 음수: 받을 금액)
         */
        public BigDecimal net() {
            return debit.subtract(credit);
        }
    }
}
