package dustin.clearing.domains.event.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.clearing.domains.event.model.EnergyUnit;
import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.dto.EnergyEventRequest;
import dustin.clearing.domains.event.model.dto.IngestionResponse;
import dustin.clearing.domains.event.model.entity.UsageEvent;
import dustin.clearing.domains.event.repository.UsageEventRepository;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.domains.participant.service.ParticipantService;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 계량 이벤트 수집 서비스
 * Usage Event Ingestion Service
 *
 * 역할:
 * - 이벤트 목록을 검증/디코딩 후 한 트랜잭션으로 저장
 * - 처음 보는 참여자 외부 ID는 자동 생성 (멱등)
 *
 * 처리 흐름:
 * 1. 전체 이벤트 검증 (하나라도 실패하면 아무것도 저장하지 않음)
 * 2. 참여자 조회 또는 생성
 * 3. 이벤트 저장
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageEventService {

    private final UsageEventRepository usageEventRepository;
    private final ParticipantService participantService;
    private final Validator validator;

    /**
     * 이벤트 일괄 수집
     * Ingest a list of events
     *
     * @param requests 이벤트 목록
     * @return 수집 결과
     * @throws SettlementException INVALID_EVENT, UNKNOWN_EVENT_KIND, UNKNOWN_UNIT, UNKNOWN_ROLE, ROLE_CONFLICT
     */
    @Transactional
    public IngestionResponse ingest(List<EnergyEventRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new SettlementException(ErrorCode.INVALID_EVENT, "Event list is empty");
        }

        // ━━━ 1. 검증 및 디코딩 ━━━
        List<DecodedEvent> decoded = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            decoded.add(decode(i, requests.get(i)));
        }

        // ━━━ 2. 참여자 조회 또는 생성 ━━━
        Set<String> externalIds = decoded.stream()
                .map(event -> event.getRequest().getParticipantId().trim())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> existing = participantService.findExistingExternalIds(externalIds);

        // ━━━ 3. 이벤트 저장 ━━━
        List<UsageEvent> rows = new ArrayList<>(decoded.size());
        for (DecodedEvent event : decoded) {
            EnergyEventRequest request = event.getRequest();
            Participant participant = participantService.ensureParticipant(
                    request.getParticipantId(), request.getParticipantName(), event.getRole());
            rows.add(UsageEvent.builder()
                    .participantId(participant.getId())
                    .eventKind(event.getKind())
                    .quantity(request.getQuantity())
                    .unit(event.getUnit())
                    .timestamp(request.getTimestamp())
                    .source(request.getSource())
                    .pricePerUnit(request.getPricePerUnit())
                    .build());
        }
        usageEventRepository.saveAll(rows);

        int created = (int) externalIds.stream().filter(id -> !existing.contains(id)).count();
        log.info("[UsageEventService] 이벤트 수집 완료: ingested={}, participantsCreated={}", rows.size(), created);

        return IngestionResponse.builder()
                .status("success")
                .ingested(rows.size())
                .participantsCreated(created)
                .message("Ingested " + rows.size() + " events.")
                .build();
    }

    private DecodedEvent decode(int index, EnergyEventRequest request) {
        if (request == null) {
            throw new SettlementException(ErrorCode.INVALID_EVENT, "Event #" + index + " is null");
        }
        Set<ConstraintViolation<EnergyEventRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            throw new SettlementException(ErrorCode.INVALID_EVENT,
                    "Event #" + index + " (participant '" + request.getParticipantId() + "') is invalid: " + detail);
        }
        EventKind kind = EventKind.fromValue(request.getEventKind());
        EnergyUnit unit = EnergyUnit.fromValue(request.getUnit());
        ParticipantRole role = request.getRole() != null && !request.getRole().isBlank()
                ? ParticipantRole.fromValue(request.getRole())
                : null;
        return new DecodedEvent(request, kind, unit, role);
    }

    /**
     * 디코딩된 이벤트 (요청 + 검증된 열거값)
     */
    @Getter
    @RequiredArgsConstructor
    private static class DecodedEvent {
        private final EnergyEventRequest request;
        private final EventKind kind;
        private final EnergyUnit unit;
        private final ParticipantRole role;
    }
}
