package dustin.clearing.domains.settlement.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import dustin.clearing.domains.policy.model.SettlementPolicy;
import dustin.clearing.domains.policy.rule.PostingRuleTable;
import lombok.Getter;

/**
 * 정산 실행 한 건의 평가 컨텍스트
 * Evaluation Context
 *
 * 실행 상태(미가격 이벤트 수 등)는 전부 여기에 두고 평가기 자체는 상태를 갖지 않습니다.
 */
@Getter
public class EvaluationContext {

    private final SettlementPolicy policy;
    private final PostingRuleTable ruleTable;
    private final CounterpartyDirectory directory;

    private int unpricedEvents;
    private int zeroPricedUnclassified;
    private final List<Posting> postings = new ArrayList<>();

    public EvaluationContext(SettlementPolicy policy, PostingRuleTable ruleTable, CounterpartyDirectory directory) {
        if (policy.getUseCase() != ruleTable.getUseCase()) {
            throw new IllegalArgumentException("Rule table " + ruleTable.getUseCase()
                    + " does not match policy use case " + policy.getUseCase());
        }
        this.policy = policy;
        this.ruleTable = ruleTable;
        this.directory = directory;
    }

    void markUnpriced() {
        unpricedEvents++;
    }

    void markZeroPricedUnclassified() {
        zeroPricedUnclassified++;
        unpricedEvents++;
    }

    void record(Posting posting) {
        postings.add(posting);
    }

    public List<Posting> getPostings() {
        return Collections.unmodifiableList(postings);
    }
}
