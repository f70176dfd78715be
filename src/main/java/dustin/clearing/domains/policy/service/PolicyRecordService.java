package dustin.clearing.domains.policy.service;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.clearing.domains.policy.model.SettlementPolicy;
import dustin.clearing.domains.policy.model.entity.PolicyRecord;
import dustin.clearing.domains.policy.repository.PolicyRecordRepository;
import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 정책 기록 서비스
 * Policy Record Service
 *
 * 정산 실행 트랜잭션 안에서 호출되어 정규화 정책을 저장합니다.
 * 호출자의 트랜잭션에 참여하므로 이후 단계가 실패하면 함께 롤백됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PolicyRecordService {

    private final PolicyRecordRepository policyRecordRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public PolicyRecord record(SettlementPolicy policy) {
        String json;
        try {
            json = objectMapper.writeValueAsString(policy.toCanonicalMap());
        } catch (JsonProcessingException e) {
            throw new SettlementException(ErrorCode.INVALID_POLICY,
                    "Policy for use case '" + policy.getUseCase().getValue() + "' could not be serialized", e);
        }
        PolicyRecord saved = policyRecordRepository.save(PolicyRecord.builder()
                .useCase(policy.getUseCase().getValue())
                .parametersJson(json)
                .build());
        log.info("[PolicyRecordService] 정책 기록 저장: policyId={}, useCase={}", saved.getId(), saved.getUseCase());
        return saved;
    }
}
