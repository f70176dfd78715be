package dustin.clearing.domains.event.repository;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import dustin.clearing.domains.event.model.entity.UsageEvent;

/**
 * 계량 이벤트 리포지토리
 * Usage Event Repository
 */
@Repository
public interface UsageEventRepository extends JpaRepository<UsageEvent, Long> {

    /**
     * 정산 기간 [start, end) 이벤트 조회
     *
     * BETWEEN을 쓰지 않음: end 시각 이벤트는 다음 배치에 속해야 인접 배치 간 이중 정산이 없음
     * 정렬: 누적 순서 고정 (timestamp, id)
     */
    @Query("SELECT e FROM UsageEvent e WHERE e.timestamp >= :start AND e.timestamp < :end ORDER BY e.timestamp ASC, e.id ASC")
    List<UsageEvent> findInWindow(
            @Param("start") LocalDateTime start,
            @Param("end") LocalDateTime end);
}
