package dustin.clearing.domains.policy.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.clearing.domains.policy.model.entity.PolicyRecord;

/**
 * 정산 정책 기록 리포지토리
 */
@Repository
public interface PolicyRecordRepository extends JpaRepository<PolicyRecord, Long> {
}
