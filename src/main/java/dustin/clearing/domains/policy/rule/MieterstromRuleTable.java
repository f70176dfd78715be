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
 * 세입자 전력(Mieterstrom) 규칙표
 * Tenant Electricity Rule Table
 *
 * 규칙:
 * =====
 * 1. 세입자 로컬(PV/배터리) 소비 → 세입자가 임대인에게 tenant_price_per_kwh 지불
 * 2. 위 금액의 operator_fee_rate → 임대인이 운영자에게 지불
 * 3. 계통 소비 → 소비자가 외부 시장에 grid_purchase_price 지불
 * 4. 기본료 → 세입자가 임대인에게 지불 (EUR가 아니면 수량 × base_fee_per_unit)
 * 5. 계통 송전 → 외부 시장이 임대인에게 landlord_revenue_share,
 *    운영자에게 나머지(1 − share)를 grid_compensation 단가로 지불
 * 6. VPP 판매 → 외부 시장이 판매자에게 vpp_sale_price 지불
 *
 * generation / production / battery_charge / battery_discharge는 계량 전용 (포스팅 없음)
 */
@Component
public class MieterstromRuleTable implements PostingRuleTable {

    private static final Set<ParticipantRole> TENANTS =
            Set.of(ParticipantRole.TENANT, ParticipantRole.COMMERCIAL_TENANT, ParticipantRole.CONSUMER);

    private static final Set<ParticipantRole> MEMBERS = Set.of(
            ParticipantRole.TENANT, ParticipantRole.COMMERCIAL_TENANT, ParticipantRole.CONSUMER,
            ParticipantRole.LANDLORD, ParticipantRole.OPERATOR, ParticipantRole.PROSUMER);

    private static final Set<ParticipantRole> FEEDERS =
            Set.of(ParticipantRole.LANDLORD, ParticipantRole.OPERATOR, ParticipantRole.PROSUMER);

    private static final Set<SourceBucket> LOCAL = Set.of(SourceBucket.LOCAL_PV, SourceBucket.BATTERY);

    private final List<PostingRule> rules = List.of(
            PostingRule.builder()
                    .name("local_consumption")
                    .eventKinds(Set.of(EventKind.CONSUMPTION))
                    .sources(LOCAL)
                    .roles(TENANTS)
                    .priceParameter(PolicyParameter.TENANT_PRICE_PER_KWH)
                    .debtor(Counterparty.SELF)
                    .creditor(Counterparty.LANDLORD)
                    .build(),
            PostingRule.builder()
                    .name("operator_fee")
                    .eventKinds(Set.of(EventKind.CONSUMPTION))
                    .sources(LOCAL)
                    .roles(TENANTS)
                    .priceParameter(PolicyParameter.TENANT_PRICE_PER_KWH)
                    .shareParameter(PolicyParameter.OPERATOR_FEE_RATE)
                    .debtor(Counterparty.LANDLORD)
                    .creditor(Counterparty.OPERATOR)
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
                    .name("base_fee")
                    .eventKinds(Set.of(EventKind.BASE_FEE))
                    .roles(TENANTS)
                    .priceParameter(PolicyParameter.BASE_FEE_PER_UNIT)
                    .debtor(Counterparty.SELF)
                    .creditor(Counterparty.LANDLORD)
                    .build(),
            PostingRule.builder()
                    .name("grid_feed_landlord_share")
                    .eventKinds(Set.of(EventKind.GRID_FEED))
                    .roles(FEEDERS)
                    .priceParameter(PolicyParameter.GRID_COMPENSATION)
                    .shareParameter(PolicyParameter.LANDLORD_REVENUE_SHARE)
                    .debtor(Counterparty.EXTERNAL_MARKET)
                    .creditor(Counterparty.LANDLORD)
                    .build(),
            PostingRule.builder()
                    .name("grid_feed_operator_share")
                    .eventKinds(Set.of(EventKind.GRID_FEED))
                    .roles(FEEDERS)
                    .priceParameter(PolicyParameter.GRID_COMPENSATION)
                    .shareParameter(PolicyParameter.LANDLORD_REVENUE_SHARE)
                    .shareComplement(true)
                    .debtor(Counterparty.EXTERNAL_MARKET)
                    .creditor(Counterparty.OPERATOR)
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
        return UseCase.MIETERSTROM;
    }

    @Override
    public List<PostingRule> getRules() {
        return rules;
    }
}
