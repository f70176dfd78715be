package dustin.clearing.domains.settlement.engine;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.domains.policy.rule.Counterparty;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 엔진 내부 참여자 참조
 * Participant Reference
 *
 * 엔진은 외부 ID를 키로 잔액을 관리합니다.
 * 합성 상대방(external-market, fee-collector)은 아직 저장되지 않았을 수 있으므로 id가 null입니다.
 */
@Getter
@ToString
@AllArgsConstructor
@EqualsAndHashCode(of = "externalId")
public class ParticipantRef {

    private final Long id;
    private final String externalId;
    private final String name;
    private final ParticipantRole role;

    public static ParticipantRef of(Participant participant) {
        return new ParticipantRef(participant.getId(), participant.getExternalId(),
                participant.getName(), participant.getRole());
    }

    public static ParticipantRef synthetic(Counterparty counterparty) {
        return new ParticipantRef(null, counterparty.getSyntheticExternalId(),
                counterparty.getRole().getLabel(), counterparty.getRole());
    }

    public boolean isSynthetic() {
        return id == null;
    }
}
