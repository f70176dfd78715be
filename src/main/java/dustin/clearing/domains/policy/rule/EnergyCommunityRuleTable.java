package dustin.clearing.domains.policy.rule;

import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.SourceBucket;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.policy.model.PolicyParameter;
import dustin.clearing.domains.policy.model.UseCase;

/**
 * 에너지 커뮤니티 규칙표
 * Energy Community Rule Table
 *
 * 커뮤니티 풀(fee_collector)이 지역 전력을 청산합니다.
 *
 * 규칙:
 * =====
 * 1. 로컬 소비 → 소비자가 풀에 consumer_buy_price 지불
 * 2. 계통 소비 → 소비자가 외부 시장에 grid_purchase_price 지불
 * 3. 발전/생산 → 풀이 생산자에게 prosumer_sell_price 지불
 * 4. 위 금액의 community_fee_rate → 생산자가 풀에 지불
 * 5. 계통 송전 → 외부 시장이 생산자에게 grid_feed_price 지불
 * 6. 기본료 → 참여자가 풀에 지불
 * 7. VPP 판매 → 외부 시장이 판매자에게 vpp_sale_price 지불
 *
 * battery_charge / battery_discharge는 계량 전용
 */
@Component
public class EnergyCommunityRuleTable implements PostingRuleTable {

    private static final Set<ParticipantRole> CONSUMERS = Set.of(
            ParticipantRole.CONSUMER, ParticipantRole.PROSUMER,
            ParticipantRole.TENANT, ParticipantRole.COMMERCIAL_TENANT);

    private static final Set<ParticipantRole> PRODUCERS = Set.of(ParticipantRole.PROSUMER, ParticipantRole.OPERATOR);

    private static final Set<ParticipantRole> MEMBERS = Set.of(
            ParticipantRole.CONSUMER, ParticipantRole.PROSUMER,
            ParticipantRole.TENANT, ParticipantRole.COMMERCIAL_TENANT,
            ParticipantRole.LANDLORD, ParticipantRole.OPERATOR);

    private final List<PostingRule> rules = List.of(
            PostingRule.builder()
                    .name("local_consumption")
                    .eventKinds(Set.of(EventKind.CONSUMPTION))
                    .sources(Set.of(SourceBucket.LOCAL_PV, SourceBucket.BATTERY))
                    .roles(CONSUMERS)
                    .priceParameter(PolicyParameter.CONSUMER_BUY_PRICE)
                    .debtor(Counterparty.SELF)
                    .creditor(Counterparty.FEE_COLLECTOR)
                    .build(),
            PostingRule.builder()
                    .name("grid_consumption")
                    .eventKinds(Set.of(EventKind.CONSUMPTION))
                    .sources(Set.of(SourceBucket.GRID))
                    .roles(MEMBERS)
                    .priceParameter(PolicyParameter.GRID_PURCHASE_PRICE)
                    .debtor(Counterparty.SELF)
                    .creditor(Counterparty.EXTERNAL_MARKET)
                    .build(),
            PostingRule.builder()
                    .name("generation")
                    .eventKinds(Set.of(EventKind.GENERATION, EventKind.PRODUCTION))
                    .roles(PRODUCERS)
                    .priceParameter(PolicyParameter.PROSUMER_SELL_PRICE)
                    .debtor(Counterparty.FEE_COLLECTOR)
                    .creditor(Counterparty.SELF)
                    .build(),
            PostingRule.builder()
                    .name("community_fee")
                    .eventKinds(Set.of(EventKind.GENERATION, EventKind.PRODUCTION))
                    .roles(PRODUCERS)
                    .priceParameter(PolicyParameter.PROSUMER_SELL_PRICE)
                    .shareParameter(PolicyParameter.COMMUNITY_FEE_RATE)
                    .debtor(Counterparty.SELF)
                    .creditor(Counterparty.FEE_COLLECTOR)
                    .build(),
            PostingRule.builder()
                    .name("grid_feed")
                    .eventKinds(Set.of(EventKind.GRID_FEED))
                    .roles(PRODUCERS)
                    .priceParameter(PolicyParameter.GRID_FEED_PRICE)
                    .debtor(Counterparty.EXTERNAL_MARKET)
                    .creditor(Counterparty.SELF)
                    .build(),
            PostingRule.builder()
                    .name("base_fee")
                    .eventKinds(Set.of(EventKind.BASE_FEE))
                    .roles(MEMBERS)
                    .priceParameter(PolicyParameter.BASE_FEE_PER_UNIT)
                    .debtor(Counterparty.SELF)
                    .creditor(Counterparty.FEE_COLLECTOR)
                    .build(),
            PostingRule.builder()
                    .name("vpp_sale")
                    .eventKinds(Set.of(EventKind.VPP_SALE))
                    .roles(MEMBERS)
                    .priceParameter(PolicyParameter.VPP_SALE_PRICE)
                    .debtor(Counterparty.EXTERNAL_MARKET)
                    .creditor(Counterparty.SELF)
                    .build());

    @Override
    public UseCase getUseCase() {
        return UseCase.ENERGY_COMMUNITY;
    }

    @Override
    public List<PostingRule> getRules() {
        return rules;
    }
}
