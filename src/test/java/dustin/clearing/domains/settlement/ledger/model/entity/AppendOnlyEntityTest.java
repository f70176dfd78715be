package dustin.clearing.domains.settlement.ledger.model.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import dustin.clearing.domains.event.model.dto.EnergyEventRequest;
import dustin.clearing.domains.event.model.entity.UsageEvent;
import dustin.clearing.domains.event.repository.UsageEventRepository;
import dustin.clearing.domains.event.service.UsageEventService;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.participant.service.ParticipantService;
import dustin.clearing.domains.policy.model.entity.PolicyRecord;
import dustin.clearing.domains.settlement.ledger.model.dto.SettleRequest;
import dustin.clearing.domains.settlement.ledger.repository.SettlementBatchRepository;
import dustin.clearing.domains.settlement.ledger.repository.SettlementLineRepository;
import dustin.clearing.domains.settlement.ledger.service.SettlementService;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

/**
 * 추가 전용 엔티티 테스트
 * 저장된 라인/배치/정책 기록/이벤트를 변경 후 flush하면 거부되고 DB 값은 그대로인지 검증
 *
 * 테스트 트랜잭션 없이 실행 (변경 시도 트랜잭션의 실제 롤백 확인)
 */
@SpringBootTest
@ActiveProfiles("test")
class AppendOnlyEntityTest {

    private static final LocalDateTime START = LocalDateTime.of(2026, 6, 1, 0, 0);

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private UsageEventService usageEventService;

    @Autowired
    private ParticipantService participantService;

    @Autowired
    private SettlementBatchRepository settlementBatchRepository;

    @Autowired
    private SettlementLineRepository settlementLineRepository;

    @Autowired
    private UsageEventRepository usageEventRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @PersistenceContext
    private EntityManager entityManager;

    private Long batchId;

    @BeforeEach
    void setUp() {
        participantService.ensureParticipant("ao-landlord", "Landlord", ParticipantRole.LANDLORD);
        usageEventService.ingest(List.of(
                consumption("ao-tenant-a", "10", "local_pv", 1),
                consumption("ao-tenant-b", "4", "grid", 2)));

        batchId = settlementService.executeSettlement(SettleRequest.builder()
                .useCase("mieterstrom")
                .parameters(Map.of("unclassified_source_treatment", "REJECT", "operator_fee_rate", "0"))
                .startTime(START)
                .endTime(START.plusDays(1))
                .build()).getBatchId();
    }

    @AfterEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM settlement_lines");
        jdbcTemplate.update("DELETE FROM settlement_batches");
        jdbcTemplate.update("DELETE FROM settlement_policies");
        jdbcTemplate.update("DELETE FROM usage_events");
        jdbcTemplate.update("DELETE FROM participants");
    }

    private EnergyEventRequest consumption(String tenant, String kwh, String source, int hour) {
        return EnergyEventRequest.builder()
                .participantId(tenant)
                .role("tenant")
                .eventKind("consumption")
                .quantity(new BigDecimal(kwh))
                .unit("kWh")
                .source(source)
                .timestamp(START.plusHours(hour))
                .build();
    }

    /**
     * 한 트랜잭션에서 변경 후 flush, 발생한 가장 안쪽 예외 반환
     */
    private Throwable mutateAndFlush(Runnable mutation) {
        Throwable thrown = catchThrowable(() -> new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            mutation.run();
            entityManager.flush();
        }));
        assertThat(thrown).as("flush of a modified append-only entity must fail").isNotNull();
        return NestedExceptionUtils.getMostSpecificCause(thrown);
    }

    @Test
    @DisplayName("정산 라인 금액 변경 → UnsupportedOperationException, DB 금액 유지")
    void settlementLineAmountCannotChange() {
        Long lineId = settlementLineRepository.findByBatchIdOrderByIdAsc(batchId).get(0).getId();
        BigDecimal stored = jdbcTemplate.queryForObject(
                "SELECT amount FROM settlement_lines WHERE id = ?", BigDecimal.class, lineId);

        Throwable cause = mutateAndFlush(() -> {
            SettlementLine line = settlementLineRepository.findById(lineId).orElseThrow();
            ReflectionTestUtils.setField(line, "amount", new BigDecimal("999.99"));
        });

        assertThat(cause).isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("append-only");
        assertThat(jdbcTemplate.queryForObject(
                "SELECT amount FROM settlement_lines WHERE id = ?", BigDecimal.class, lineId))
                .isEqualByComparingTo(stored);
    }

    @Test
    @DisplayName("정산 배치 코드 버전 변경 → UnsupportedOperationException, DB 값 유지")
    void settlementBatchCannotChange() {
        Throwable cause = mutateAndFlush(() -> {
            SettlementBatch batch = settlementBatchRepository.findById(batchId).orElseThrow();
            ReflectionTestUtils.setField(batch, "codeVersion", "tampered");
        });

        assertThat(cause).isInstanceOf(UnsupportedOperationException.class);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT code_version FROM settlement_batches WHERE id = ?", String.class, batchId))
                .isEqualTo("test");
    }

    @Test
    @DisplayName("정책 기록 변경 → UnsupportedOperationException")
    void policyRecordCannotChange() {
        Long policyId = jdbcTemplate.queryForObject(
                "SELECT policy_id FROM settlement_batches WHERE id = ?", Long.class, batchId);
        String stored = jdbcTemplate.queryForObject(
                "SELECT parameters_json FROM settlement_policies WHERE id = ?", String.class, policyId);

        Throwable cause = mutateAndFlush(() -> {
            PolicyRecord record = entityManager.find(PolicyRecord.class, policyId);
            ReflectionTestUtils.setField(record, "parametersJson", "{}");
        });

        assertThat(cause).isInstanceOf(UnsupportedOperationException.class);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT parameters_json FROM settlement_policies WHERE id = ?", String.class, policyId))
                .isEqualTo(stored);
    }

    @Test
    @DisplayName("계량 이벤트 수량 변경 → UnsupportedOperationException, DB 수량 유지")
    void usageEventCannotChange() {
        Long eventId = usageEventRepository.findInWindow(START, START.plusDays(1)).get(0).getId();

        Throwable cause = mutateAndFlush(() -> {
            UsageEvent event = usageEventRepository.findById(eventId).orElseThrow();
            ReflectionTestUtils.setField(event, "quantity", new BigDecimal("1000"));
        });

        assertThat(cause).isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("immutable");
        assertThat(jdbcTemplate.queryForObject(
                "SELECT quantity FROM usage_events WHERE id = ?", BigDecimal.class, eventId))
                .isEqualByComparingTo("10");
    }
}
