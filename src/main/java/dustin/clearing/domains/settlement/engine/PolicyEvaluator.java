package dustin.clearing.domains.settlement.engine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import dustin.clearing.domains.event.model.SourceBucket;
import dustin.clearing.domains.policy.model.SettlementPolicy;
import dustin.clearing.domains.policy.model.UseCase;
import dustin.clearing.domains.policy.rule.Counterparty;
import dustin.clearing.domains.policy.rule.PostingRule;
import dustin.clearing.domains.policy.rule.PostingRuleTable;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.extern.slf4j.Slf4j;

/**
 * 정책 평가기
 * Policy Evaluator
 *
 * 역할:
 * - 분류된 이벤트 + 정책 → 복식부기 포스팅 (이벤트당 0~2건)
 * - 포스팅을 고정 순서로 잔액표에 누적
 *
 * 처리 흐름 (이벤트 1건):
 * 1. 출처 민감 종류(consumption)의 미분류 출처 → unclassified_source_treatment 적용
 * 2. (종류, 출처, 역할)로 규칙 매칭. 매칭 없음 → 미가격 이벤트
 * 3. 규칙마다 금액 계산 후 당사자 해석 (SELF 또는 상대방 디렉터리)
 * 4. 자기 자신에게 가는 포스팅, 0원 포스팅은 생략
 */
@Slf4j
@Component
public class PolicyEvaluator {

    private final Map<UseCase, PostingRuleTable> ruleTables = new EnumMap<>(UseCase.class);

    public PolicyEvaluator(List<PostingRuleTable> tables) {
        for (PostingRuleTable table : tables) {
            ruleTables.put(table.getUseCase(), table);
        }
    }

    public PostingRuleTable ruleTableFor(UseCase useCase) {
        PostingRuleTable table = ruleTables.get(useCase);
        if (table == null) {
            throw new SettlementException(ErrorCode.UNKNOWN_USE_CASE,
                    "No posting rules registered for use case '" + useCase.getValue() + "'");
        }
        return table;
    }

    /**
     * 전체 이벤트 평가 → 잔액표
     *
     * @throws SettlementException UNCLASSIFIED_SOURCE, MISSING_COUNTERPARTY, AMBIGUOUS_COUNTERPARTY
     */
    public BalanceSheet evaluate(AggregationResult aggregation, EvaluationContext context) {
        BalanceSheet sheet = new BalanceSheet();
        aggregation.getTotals().values().forEach(totals -> sheet.register(totals.getParticipant()));

        for (ClassifiedEvent event : aggregation.getEvents()) {
            for (Posting posting : evaluateEvent(event, context)) {
                sheet.apply(posting);
                context.record(posting);
            }
        }

        if (context.getUnpricedEvents() > 0) {
            log.warn("[PolicyEvaluator] 미가격 이벤트: useCase={}, unpriced={}, zeroPricedUnclassified={}",
                    context.getPolicy().getUseCase().getValue(),
                    context.getUnpricedEvents(), context.getZeroPricedUnclassified());
        }
        log.info("[PolicyEvaluator] 평가 완료: events={}, postings={}, participants={}",
                aggregation.getEvents().size(), context.getPostings().size(), sheet.size());
        return sheet;
    }

    /**
     * 이벤트 1건 평가
     */
    public List<Posting> evaluateEvent(ClassifiedEvent event, EvaluationContext context) {
        PostingRuleTable table = context.getRuleTable();
        SettlementPolicy policy = context.getPolicy();
        SourceBucket bucket = event.getBucket();

        // ━━━ 1. 미분류 출처 처리 ━━━
        if (bucket == SourceBucket.UNCLASSIFIED && table.isSourceSensitive(event.getKind())) {
            switch (policy.getUnclassifiedSourceTreatment()) {
                case EXTERNAL_MARKET:
                    bucket = SourceBucket.GRID;
                    break;
                case ZERO_PRICED:
                    log.warn("[PolicyEvaluator] 미분류 출처 0원 처리: eventId={}, participant={}, source='{}'",
                            event.getEventId(), event.getParticipant().getExternalId(), event.getSource());
                    context.markZeroPricedUnclassified();
                    return List.of();
                case REJECT:
                default:
                    throw new SettlementException(ErrorCode.UNCLASSIFIED_SOURCE, String.format(
                            "Event %d of participant '%s' has unclassified source '%s'",
                            event.getEventId(), event.getParticipant().getExternalId(), event.getSource()));
            }
        }

        // ━━━ 2. 규칙 매칭 ━━━
        List<PostingRule> rules = table.rulesFor(event.getKind(), bucket, event.getParticipant().getRole());
        if (rules.isEmpty()) {
            log.debug("[PolicyEvaluator] 계량 전용 이벤트: eventId={}, kind={}, role={}",
                    event.getEventId(), event.getKind().getValue(), event.getParticipant().getRole().getValue());
            context.markUnpriced();
            return List.of();
        }

        // ━━━ 3. 금액 계산 및 당사자 해석 ━━━
        List<Posting> postings = new ArrayList<>(rules.size());
        for (PostingRule rule : rules) {
            BigDecimal amount = baseAmount(event, rule, policy).multiply(rule.shareFactor(policy));
            if (amount.signum() == 0) {
                continue;
            }
            ParticipantRef debtor = resolve(rule.getDebtor(), event, context);
            ParticipantRef creditor = resolve(rule.getCreditor(), event, context);
            if (debtor.equals(creditor)) {
                log.debug("[PolicyEvaluator] 자기 포스팅 생략: eventId={}, rule={}, participant={}",
                        event.getEventId(), rule.getName(), debtor.getExternalId());
                continue;
            }
            postings.add(new Posting(event.getEventId(), rule.getName(), debtor, creditor, amount));
        }
        return postings;
    }

    /**
     * 기준 금액
     * - EUR: 수량 그대로
     * - 그 외: 수량 × (이벤트 단가 > 0 ? 이벤트 단가 : 정책 단가)
     */
    private BigDecimal baseAmount(ClassifiedEvent event, PostingRule rule, SettlementPolicy policy) {
        if (event.getUnit().isMonetary()) {
            return event.getQuantity();
        }
        BigDecimal price = event.hasOwnPrice() ? event.getPricePerUnit() : policy.decimal(rule.getPriceParameter());
        return event.getQuantity().multiply(price);
    }

    private ParticipantRef resolve(Counterparty party, ClassifiedEvent event, EvaluationContext context) {
        return party == Counterparty.SELF ? event.getParticipant() : context.getDirectory().resolve(party);
    }
}
