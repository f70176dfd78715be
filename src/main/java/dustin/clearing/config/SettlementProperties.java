package dustin.clearing.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * 정산 엔진 설정
 * Settlement Engine Configuration
 *
 * 역할:
 * - 정산 실행 시 사용하는 애플리케이션 수준 설정값
 * - 정책(Policy)과 달리 실행마다 바뀌지 않는 값만 둡니다
 *
 * 설정 방법:
 * - application.yml의 settlement.* 항목
 * - 환경변수로 오버라이드 가능 (예: SETTLEMENT_DEFAULT_LOOKBACK=P1D)
 */
@Data
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    /**
     * 0으로 간주하는 허용 오차
     * Zero epsilon
     *
     * 반올림된 순액의 절댓값이 이 값 이하이면 채무자/채권자 어느 쪽에도 속하지 않고
     * 정산 라인도 생성되지 않습니다.
     */
    private BigDecimal zeroEpsilon = new BigDecimal("0.000000001");

    /**
     * 요청에 정산 기간이 없을 때 사용할 기본 조회 기간
     * Default lookback when a request omits the window
     *
     * 기본값: 2일 ([now - 2d, now))
     */
    private Duration defaultLookback = Duration.ofDays(2);

    /**
     * 같은 유스케이스의 기존 배치와 기간이 겹치는 정산 실행을 거부할지 여부
     * Reject runs whose window overlaps an existing batch of the same use case
     *
     * 기본값: false (보정 배치는 같은 기간으로 새로 발행되기 때문)
     * 주의: 검사일 뿐 잠금이 아니므로 동시 실행 직렬화는 호출자 책임입니다.
     */
    private boolean rejectOverlappingWindows = false;

    /**
     * 정산 코드 버전 (배치에 기록되어 재현성 확인에 사용)
     */
    private String codeVersion = "unknown";

    /**
     * 감사 설명문 설정
     */
    private Audit audit = new Audit();

    @Data
    public static class Audit {

        /**
         * explain=true 요청 시 참여자별 설명문 생성 허용 여부
         */
        private boolean explanationsEnabled = true;
    }
}
