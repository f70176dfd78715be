package dustin.clearing.domains.settlement.ledger.repository;

import java.time.LocalDateTime;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.clearing.domains.settlement.ledger.model.entity.SettlementBatch;

/**
 * 정산 배치 리포지토리
 * Settlement Batch Repository
 */
@Repository
public interface SettlementBatchRepository extends JpaRepository<SettlementBatch, Long> {

    /**
     * 같은 유스케이스에서 [start, end)와 겹치는 배치 존재 여부
     * 반열린 구간이므로 끝과 시작이 맞닿은 배치는 겹치지 않음
     */
    @Query("SELECT CASE WHEN COUNT(b) > 0 THEN true ELSE false END FROM SettlementBatch b " +
           "WHERE b.useCase = :useCase AND b.windowStart < :end AND b.windowEnd > :start")
    boolean existsOverlapping(
            @Param("useCase") String useCase,
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);
}
