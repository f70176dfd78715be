package dustin.clearing.domains.settlement.ledger.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.clearing.config.SettlementProperties;
import dustin.clearing.domains.event.model.entity.UsageEvent;
import dustin.clearing.domains.event.repository.UsageEventRepository;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.model.entity.Participant;
import dustin.clearing.domains.participant.service.ParticipantService;
import dustin.clearing.domains.policy.model.SettlementPolicy;
import dustin.clearing.domains.policy.model.entity.PolicyRecord;
import dustin.clearing.domains.policy.service.PolicyLoader;
import dustin.clearing.domains.policy.service.PolicyRecordService;
import dustin.clearing.domains.settlement.engine.AggregationResult;
import dustin.clearing.domains.settlement.engine.BalanceSheet;
import dustin.clearing.domains.settlement.engine.CounterpartyDirectory;
import dustin.clearing.domains.settlement.engine.EvaluationContext;
import dustin.clearing.domains.settlement.engine.EventAggregator;
import dustin.clearing.domains.settlement.engine.NettingEngine;
import dustin.clearing.domains.settlement.engine.NettingParameters;
import dustin.clearing.domains.settlement.engine.NettingResult;
import dustin.clearing.domains.settlement.engine.ParticipantRef;
import dustin.clearing.domains.settlement.engine.PolicyEvaluator;
import dustin.clearing.domains.settlement.engine.SettlementWindow;
import dustin.clearing.domains.settlement.ledger.model.dto.NettingPreviewResponse;
import dustin.clearing.domains.settlement.ledger.model.dto.SettleRequest;
import dustin.clearing.domains.settlement.ledger.model.dto.SettlementResponse;
import dustin.clearing.domains.settlement.ledger.model.entity.SettlementBatch;
import dustin.clearing.domains.settlement.ledger.model.entity.SettlementLine;
import dustin.clearing.domains.settlement.ledger.repository.SettlementBatchRepository;
import dustin.clearing.domains.settlement.ledger.repository.SettlementLineRepository;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 정산 서비스
 * Settlement Service
 *
 * 역할:
 * - 정산 실행: 정책 검증 → 이벤트 조회 → 집계 → 정책 평가 → 상계 → 배치/라인/증명 해시 저장
 * - 상계 미리보기: 같은 파이프라인을 저장 없이 실행
 *
 * 트랜잭션:
 * ========
 * executeSettlement 전체가 하나의 트랜잭션입니다.
 * 어느 단계에서든 예외가 나면 정책 기록, 배치, 합성 상대방, 라인이 모두 롤백되어
 * 일부만 저장된 배치는 외부에 보이지 않습니다.
 *
 * 동시성:
 * ======
 * 같은 기간을 겹쳐 실행하는 것을 막는 잠금은 없습니다.
 * settlement.reject-overlapping-windows=true면 겹치는 기존 배치가 있을 때 거부하지만 검사일 뿐입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettlementService {

    private static final Set<ParticipantRole> COUNTERPARTY_ROLES = EnumSet.of(
            ParticipantRole.LANDLORD, ParticipantRole.OPERATOR,
            ParticipantRole.EXTERNAL_MARKET, ParticipantRole.FEE_COLLECTOR);

    private final SettlementProperties properties;
    private final PolicyLoader policyLoader;
    private final PolicyRecordService policyRecordService;
    private final UsageEventRepository usageEventRepository;
    private final ParticipantService participantService;
    private final EventAggregator eventAggregator;
    private final PolicyEvaluator policyEvaluator;
    private final NettingEngine nettingEngine;
    private final ProofHasher proofHasher;
    private final SettlementBatchRepository settlementBatchRepository;
    private final SettlementLineRepository settlementLineRepository;

    /**
     * 정산 실행
     * Execute Settlement
     *
     * @param request 유스케이스, 정책 파라미터, 기간
     * @return 배치 ID와 최종 순액 (이벤트가 없으면 배치 없이 메시지만)
     * @throws SettlementException 검증 오류, 상대방 해석 실패, 보존 법칙 위반 등 (전체 롤백)
     */
    @Transactional
    public SettlementResponse executeSettlement(SettleRequest request) {
        // ━━━ 1. 정책 검증 및 기간 결정 ━━━
        SettlementPolicy policy = policyLoader.load(request.getUseCase(), request.getParameters());
        SettlementWindow window = resolveWindow(request);
        String useCase = policy.getUseCase().getValue();

        log.info("[SettlementService] 정산 실행 시작: useCase={}, window={}", useCase, window);

        if (properties.isRejectOverlappingWindows()
                && settlementBatchRepository.existsOverlapping(useCase, window.getStart(), window.getEnd())) {
            throw new SettlementException(ErrorCode.OVERLAPPING_WINDOW, String.format(
                    "A settlement batch for use case '%s' already overlaps window %s", useCase, window));
        }

        // ━━━ 2. 계산 (집계 → 평가 → 상계) ━━━
        NettingResult result = compute(policy, window);
        if (result == null) {
            log.info("[SettlementService] 정산 대상 이벤트 없음: useCase={}, window={}", useCase, window);
            return SettlementResponse.builder()
                    .status("empty")
                    .message("No events found to settle.")
                    .useCase(useCase)
                    .start(window.getStart())
                    .end(window.getEnd())
                    .linesWritten(0)
                    .build();
        }

        // ━━━ 3. 정책 기록 및 배치 저장 ━━━
        PolicyRecord policyRecord = policyRecordService.record(policy);
        SettlementBatch batch = settlementBatchRepository.save(SettlementBatch.builder()
                .useCase(useCase)
                .windowStart(window.getStart())
                .windowEnd(window.getEnd())
                .policy(policyRecord)
                .codeVersion(properties.getCodeVersion())
                .participantCount(result.getStats().getParticipantCount())
                .transferCount(result.getStats().getTransferCount())
                .grossVolume(result.getStats().getGrossVolume())
                .netVolume(result.getStats().getNetVolume())
                .build());

        // ━━━ 4. 라인 + 증명 해시 저장 ━━━
        String description = lineDescription(useCase, window);
        int written = 0;
        for (Map.Entry<String, BigDecimal> position : result.getFinalPositions().entrySet()) {
            Long participantId = resolveParticipantId(result.getParticipants().get(position.getKey()));
            BigDecimal amount = position.getValue();
            String proofHash = proofHasher.hashLine(batch.getId(), participantId, amount, description);

            settlementLineRepository.save(SettlementLine.builder()
                    .batch(batch)
                    .participantId(participantId)
                    .amount(amount)
                    .description(description)
                    .proofHash(proofHash)
                    .build());
            written++;
            log.debug("[SettlementService] 정산 라인 저장: batchId={}, participant={}, amount={}",
                    batch.getId(), position.getKey(), amount.toPlainString());
        }

        log.info("[SettlementService] 정산 실행 완료: batchId={}, useCase={}, lines={}, suppressed={}, transfers={}",
                batch.getId(), useCase, written, result.getSuppressedPositions().size(),
                result.getStats().getTransferCount());

        return SettlementResponse.builder()
                .status("success")
                .batchId(batch.getId())
                .message("Settlement executed and proofs generated.")
                .useCase(useCase)
                .start(window.getStart())
                .end(window.getEnd())
                .linesWritten(written)
                .finalNetBalances(result.getFinalPositions())
                .balances(result.getBalances())
                .suppressedPositions(result.getSuppressedPositions())
                .unmatchedResiduals(result.getUnmatchedResiduals())
                .transfers(result.getTransfers())
                .stats(result.getStats())
                .build();
    }

    /**
     * 상계 미리보기 (저장 없음)
     * Netting Preview
     */
    @Transactional(readOnly = true)
    public NettingPreviewResponse previewNetting(SettleRequest request) {
        SettlementPolicy policy = policyLoader.load(request.getUseCase(), request.getParameters());
        SettlementWindow window = resolveWindow(request);
        String useCase = policy.getUseCase().getValue();

        NettingResult result = compute(policy, window);
        if (result == null) {
            return NettingPreviewResponse.builder()
                    .message("No events found in the specified timeframe.")
                    .useCase(useCase)
                    .start(window.getStart())
                    .end(window.getEnd())
                    .build();
        }
        log.info("[SettlementService] 상계 미리보기: useCase={}, window={}, transfers={}",
                useCase, window, result.getStats().getTransferCount());

        return NettingPreviewResponse.builder()
                .useCase(useCase)
                .start(window.getStart())
                .end(window.getEnd())
                .stats(result.getStats())
                .transfers(result.getTransfers())
                .finalBalances(result.getFinalPositions())
                .balances(result.getBalances())
                .suppressedPositions(result.getSuppressedPositions())
                .unmatchedResiduals(result.getUnmatchedResiduals())
                .build();
    }

    /**
     * 집계 → 평가 → 상계 (이벤트가 없으면 null)
     */
    private NettingResult compute(SettlementPolicy policy, SettlementWindow window) {
        List<UsageEvent> events = usageEventRepository.findInWindow(window.getStart(), window.getEnd());
        if (events.isEmpty()) {
            return null;
        }

        Set<Long> participantIds = events.stream().map(UsageEvent::getParticipantId).collect(Collectors.toSet());
        Map<Long, Participant> participants = participantService.findAllById(participantIds);
        CounterpartyDirectory directory = new CounterpartyDirectory(participantService.findByRoles(COUNTERPARTY_ROLES));

        AggregationResult aggregation = eventAggregator.aggregate(events, participants, window);
        EvaluationContext context = new EvaluationContext(
                policy, policyEvaluator.ruleTableFor(policy.getUseCase()), directory);
        BalanceSheet sheet = policyEvaluator.evaluate(aggregation, context);
        return nettingEngine.net(
                sheet, new NettingParameters(policy, properties.getZeroEpsilon()), context.getUnpricedEvents());
    }

    /**
     * 합성 상대방은 라인을 쓸 때 멱등 등록
     */
    private Long resolveParticipantId(ParticipantRef ref) {
        if (!ref.isSynthetic()) {
            return ref.getId();
        }
        return participantService.ensureParticipant(ref.getExternalId(), ref.getName(), ref.getRole()).getId();
    }

    private SettlementWindow resolveWindow(SettleRequest request) {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        LocalDateTime end = request.getEndTime() != null ? request.getEndTime() : now;
        LocalDateTime start = request.getStartTime() != null
                ? request.getStartTime()
                : end.minus(properties.getDefaultLookback());
        return SettlementWindow.of(start, end);
    }

    static String lineDescription(String useCase, SettlementWindow window) {
        return "Net settlement " + useCase + " " + window;
    }
}
