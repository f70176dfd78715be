package dustin.clearing.domains.policy.rule;

import dustin.clearing.domains.participant.model.ParticipantRole;

/**
 * 포스팅 당사자 지정
 * Posting Party
 *
 * SELF는 이벤트를 발생시킨 참여자, 나머지는 역할로 찾는 상대방입니다.
 * EXTERNAL_MARKET / FEE_COLLECTOR는 등록된 참여자가 없으면 합성 참여자로 대체됩니다.
 */
public enum Counterparty {
    SELF(null, null),
    LANDLORD(ParticipantRole.LANDLORD, null),
    OPERATOR(ParticipantRole.OPERATOR, null),
    EXTERNAL_MARKET(ParticipantRole.EXTERNAL_MARKET, "external-market"),
    FEE_COLLECTOR(ParticipantRole.FEE_COLLECTOR, "fee-collector");

    private final ParticipantRole role;
    private final String syntheticExternalId;

    Counterparty(ParticipantRole role, String syntheticExternalId) {
        this.role = role;
        this.syntheticExternalId = syntheticExternalId;
    }

    public ParticipantRole getRole() {
        return role;
    }

    /**
     * 합성 참여자 외부 ID (null이면 반드시 등록된 참여자로 해석되어야 함)
     */
    public String getSyntheticExternalId() {
        return syntheticExternalId;
    }

    public boolean allowsSynthetic() {
        return syntheticExternalId != null;
    }

    /**
     * 합성 참여자용으로 예약된 외부 ID의 역할
     *
     * @return 예약 ID면 해당 역할, 아니면 null
     */
    public static ParticipantRole reservedRoleFor(String externalId) {
        for (Counterparty counterparty : values()) {
            if (counterparty.allowsSynthetic() && counterparty.syntheticExternalId.equals(externalId)) {
                return counterparty.role;
            }
        }
        return null;
    }
}
