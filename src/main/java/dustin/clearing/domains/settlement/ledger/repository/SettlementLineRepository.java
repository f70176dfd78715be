package dustin.clearing.domains.settlement.ledger.repository;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import dustin.clearing.domains.settlement.ledger.model.entity.SettlementLine;

/**
 * 정산 라인 리포지토리
 */
@Repository
public interface SettlementLineRepository extends JpaRepository<SettlementLine, Long> {

    List<SettlementLine> findByBatchIdOrderByIdAsc(Long batchId);
}
