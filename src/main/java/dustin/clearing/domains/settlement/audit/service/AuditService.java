package dustin.clearing.domains.settlement.audit.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.clearing.config.SettlementProperties;
import dustin.clearing.domains.event.model.entity.UsageEvent;
import dustin.clearing.domains.event.repository.UsageEventRepository;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.domains.participant.service.ParticipantService;
import dustin.clearing.domains.settlement.audit.model.dto.AuditLineView;
import dustin.clearing.domains.settlement.audit.model.dto.AuditPayload;
import dustin.clearing.domains.settlement.engine.AggregationResult;
import dustin.clearing.domains.settlement.engine.EventAggregator;
import dustin.clearing.domains.settlement.engine.ParticipantTotals;
import dustin.clearing.domains.settlement.engine.SettlementWindow;
import dustin.clearing.domains.settlement.ledger.model.entity.SettlementBatch;
import dustin.clearing.domains.settlement.ledger.model.entity.SettlementLine;
import dustin.clearing.domains.settlement.ledger.repository.SettlementBatchRepository;
import dustin.clearing.domains.settlement.ledger.repository.SettlementLineRepository;
import dustin.clearing.domains.settlement.ledger.service.ProofHasher;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 감사 서비스
 * Audit Service
 *
 * 역할:
 * - 저장된 배치의 라인별 증명 해시 재계산 및 비교
 * - (선택) 기간 내 이벤트 합계로 라인별 설명문 생성
 *
 * 읽기 전용:
 * - 해시 불일치는 예외가 아니라 is_verified=false + WARN 로그
 * - 참여자가 더 이상 조회되지 않는 라인은 'Unknown participant'로 표시
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditService {

    private final SettlementProperties properties;
    private final SettlementBatchRepository settlementBatchRepository;
    private final SettlementLineRepository settlementLineRepository;
    private final UsageEventRepository usageEventRepository;
    private final ParticipantService participantService;
    private final EventAggregator eventAggregator;
    private final ProofHasher proofHasher;
    private final ExplanationBuilder explanationBuilder;

    /**
     * 감사 페이로드 조회
     * Get Audit Payload
     *
     * @param batchId 배치 ID
     * @param explain 설명문 포함 여부 (settlement.audit.explanations-enabled=false면 무시)
     * @throws SettlementException BATCH_NOT_FOUND
     */
    @Transactional(readOnly = true)
    public AuditPayload getAuditPayload(Long batchId, boolean explain) {
        // ━━━ 1. 배치 및 라인 조회 ━━━
        SettlementBatch batch = settlementBatchRepository.findById(batchId)
                .orElseThrow(() -> new SettlementException(ErrorCode.BATCH_NOT_FOUND,
                        "Settlement batch not found: " + batchId));
        List<SettlementLine> lines = settlementLineRepository.findByBatchIdOrderByIdAsc(batchId);
        boolean withExplanations = explain && properties.getAudit().isExplanationsEnabled();

        // ━━━ 2. 참여자 및 (설명 시) 이벤트 합계 조회 ━━━
        Set<Long> participantIds = lines.stream()
                .map(SettlementLine::getParticipantId)
                .collect(Collectors.toCollection(HashSet::new));
        List<UsageEvent> events = List.of();
        if (withExplanations) {
            events = usageEventRepository.findInWindow(batch.getWindowStart(), batch.getWindowEnd());
            events.forEach(event -> participantIds.add(event.getParticipantId()));
        }
        Map<Long, Participant> participants = participantService.findAllById(participantIds);
        Map<String, ParticipantTotals> totals = withExplanations
                ? aggregateTotals(events, participants, batch)
                : Map.of();

        // ━━━ 3. 라인별 해시 재계산 ━━━
        List<AuditLineView> views = new ArrayList<>(lines.size());
        boolean allVerified = true;
        for (SettlementLine line : lines) {
            String recomputed = proofHasher.hashLine(
                    batch.getId(), line.getParticipantId(), line.getAmount(), line.getDescription());
            boolean verified = recomputed.equals(line.getProofHash());
            if (!verified) {
                allVerified = false;
                log.warn("[AuditService] 증명 해시 불일치: batchId={}, lineId={}, participantId={}, stored={}, recomputed={}",
                        batchId, line.getId(), line.getParticipantId(), line.getProofHash(), recomputed);
            }

            Participant participant = participants.get(line.getParticipantId());
            AuditLineView.AuditLineViewBuilder view = AuditLineView.builder()
                    .lineId(line.getId())
                    .participantId(line.getParticipantId())
                    .participantName(participant != null ? participant.getName() : ExplanationBuilder.UNKNOWN_PARTICIPANT)
                    .amount(line.getAmount())
                    .description(line.getDescription())
                    .proofHash(line.getProofHash())
                    .verified(verified);
            if (participant != null) {
                view.participantExternalId(participant.getExternalId())
                    .participantRole(participant.getRole().getValue());
            }
            if (withExplanations) {
                view.explanation(participant != null
                        ? explanationBuilder.explain(participant.getName(), participant.getRole(),
                                totals.get(participant.getExternalId()), line.getAmount())
                        : explanationBuilder.explain(null, null, null, line.getAmount()));
            }
            views.add(view.build());
        }

        log.info("[AuditService] 감사 완료: batchId={}, lines={}, allVerified={}, explain={}",
                batchId, views.size(), allVerified, withExplanations);

        return AuditPayload.builder()
                .batchId(batch.getId())
                .useCase(batch.getUseCase())
                .createdAt(batch.getCreatedAt())
                .start(batch.getWindowStart())
                .end(batch.getWindowEnd())
                .codeVersion(batch.getCodeVersion())
                .policyId(batch.getPolicy().getId())
                .allVerified(allVerified)
                .lines(views)
                .build();
    }

    /**
     * 참여자가 조회되지 않는 이벤트는 설명 합계에서 제외
     */
    private Map<String, ParticipantTotals> aggregateTotals(List<UsageEvent> events,
                                                           Map<Long, Participant> participants,
                                                           SettlementBatch batch) {
        List<UsageEvent> resolvable = events.stream()
                .filter(event -> participants.containsKey(event.getParticipantId()))
                .collect(Collectors.toList());
        if (resolvable.size() < events.size()) {
            log.warn("[AuditService] 참여자 없는 이벤트 제외: batchId={}, skipped={}",
                    batch.getId(), events.size() - resolvable.size());
        }
        SettlementWindow window = SettlementWindow.of(batch.getWindowStart(), batch.getWindowEnd());
        AggregationResult aggregation = eventAggregator.aggregate(resolvable, participants, window);
        return aggregation.getTotals();
    }
}
