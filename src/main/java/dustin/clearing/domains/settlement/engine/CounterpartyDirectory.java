package dustin.clearing.domains.settlement.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.domains.policy.rule.Counterparty;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 상대방 디렉터리
 * Counterparty Directory
 *
 * 규칙의 LANDLORD / OPERATOR / EXTERNAL_MARKET / FEE_COLLECTOR를 실제 참여자로 해석합니다.
 *
 * 해석 규칙:
 * - 등록된 참여자가 정확히 1명 → 그 참여자
 * - 2명 이상 → AMBIGUOUS_COUNTERPARTY
 * - 0명 → 합성 허용 상대방이면 합성 참여자, 아니면 MISSING_COUNTERPARTY
 *
 * 오류는 실제로 해당 상대방이 필요한 규칙이 매칭될 때만 발생합니다.
 */
public class CounterpartyDirectory {

    private final Map<ParticipantRole, List<ParticipantRef>> byRole = new EnumMap<>(ParticipantRole.class);

    public CounterpartyDirectory(Collection<Participant> registered) {
        for (Participant participant : registered) {
            byRole.computeIfAbsent(participant.getRole(), role -> new ArrayList<>()).add(ParticipantRef.of(participant));
        }
    }

    /**
     * @param counterparty SELF가 아닌 상대방
     * @throws SettlementException MISSING_COUNTERPARTY, AMBIGUOUS_COUNTERPARTY
     */
    public ParticipantRef resolve(Counterparty counterparty) {
        if (counterparty == Counterparty.SELF) {
            throw new IllegalArgumentException("SELF is resolved from the event, not the directory");
        }
        List<ParticipantRef> candidates = byRole.getOrDefault(counterparty.getRole(), List.of());
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        if (candidates.size() > 1) {
            throw new SettlementException(ErrorCode.AMBIGUOUS_COUNTERPARTY, String.format(
                    "Counterparty role '%s' resolves to %d participants: %s",
                    counterparty.getRole().getValue(), candidates.size(),
                    candidates.stream().map(ParticipantRef::getExternalId).sorted().collect(Collectors.joining(", "))));
        }
        if (counterparty.allowsSynthetic()) {
            return ParticipantRef.synthetic(counterparty);
        }
        throw new SettlementException(ErrorCode.MISSING_COUNTERPARTY, String.format(
                "No participant with role '%s' is registered", counterparty.getRole().getValue()));
    }
}
