package dustin.clearing.domains.participant.service;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.domains.participant.repository.ParticipantRepository;
import dustin.clearing.domains.policy.rule.Counterparty;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 참여자 서비스
 * Participant Service
 *
 * 역할:
 * - 외부 ID 기준 멱등 생성 (최초 참조 시 생성, 이후 재사용)
 * - 역할 불변 검증: 같은 외부 ID를 다른 역할로 참조하면 거부
 * - 합성 상대방 외부 ID(external-market, fee-collector)는 해당 역할로만 등록
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ParticipantService {

    /**
     * 역할 미지정 시 기본 역할 (이벤트 수집 API의 기존 동작)
     */
    public static final ParticipantRole DEFAULT_ROLE = ParticipantRole.PROSUMER;

    private final ParticipantRepository participantRepository;

    /**
     * 참여자 조회 또는 생성
     * Find or create participant by external id
     *
     * @param externalId 외부 ID
     * @param name 표시 이름 (null이면 "Participant {externalId}")
     * @param role 역할 (null이면 기존 역할 유지, 신규는 DEFAULT_ROLE, 예약 ID는 예약 역할)
     * @return 저장된 참여자
     * @throws SettlementException ROLE_CONFLICT 기존 역할과 다른 역할로 참조한 경우,
     *                             RESERVED_PARTICIPANT_ID 예약 ID를 다른 역할로 참조한 경우
     */
    @Transactional
    public Participant ensureParticipant(String externalId, String name, ParticipantRole role) {
        if (externalId == null || externalId.isBlank()) {
            throw new SettlementException(ErrorCode.INVALID_EVENT, "Participant external id is missing");
        }
        String key = externalId.trim();
        ParticipantRole reserved = Counterparty.reservedRoleFor(key);
        if (reserved != null) {
            if (role != null && role != reserved) {
                throw new SettlementException(ErrorCode.RESERVED_PARTICIPANT_ID, String.format(
                        "Participant id '%s' is reserved for role '%s', cannot be used as '%s'",
                        key, reserved.getValue(), role.getValue()));
            }
        }
        ParticipantRole requested = reserved != null ? reserved : role;
        return participantRepository.findByExternalId(key)
                .map(existing -> checkRole(existing, requested))
                .orElseGet(() -> {
                    Participant created = participantRepository.save(Participant.builder()
                            .externalId(key)
                            .name(name != null && !name.isBlank() ? name.trim() : "Participant " + key)
                            .role(requested != null ? requested : DEFAULT_ROLE)
                            .build());
                    log.info("[ParticipantService] 참여자 생성: externalId={}, role={}, id={}",
                            key, created.getRole().getValue(), created.getId());
                    return created;
                });
    }

    /**
     * 내부 ID 목록으로 참여자 맵 조회
     */
    @Transactional(readOnly = true)
    public Map<Long, Participant> findAllById(Collection<Long> ids) {
        return participantRepository.findAllById(ids).stream()
                .collect(Collectors.toMap(Participant::getId, Function.identity()));
    }

    /**
     * 이미 등록된 외부 ID 집합 조회
     */
    @Transactional(readOnly = true)
    public Set<String> findExistingExternalIds(Collection<String> externalIds) {
        return participantRepository.findByExternalIdIn(externalIds).stream()
                .map(Participant::getExternalId)
                .collect(Collectors.toSet());
    }

    /**
     * 역할별 참여자 조회 (상대방 디렉터리 구성용)
     */
    @Transactional(readOnly = true)
    public List<Participant> findByRoles(Collection<ParticipantRole> roles) {
        return participantRepository.findByRoleIn(roles);
    }

    private Participant checkRole(Participant existing, ParticipantRole requested) {
        if (requested != null && requested != existing.getRole()) {
            throw new SettlementException(ErrorCode.ROLE_CONFLICT, String.format(
                    "Participant '%s' already has role '%s', cannot be referenced as '%s'",
                    existing.getExternalId(), existing.getRole().getValue(), requested.getValue()));
        }
        return existing;
    }
}
