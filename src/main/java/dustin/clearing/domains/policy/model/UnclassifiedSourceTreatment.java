package dustin.clearing.domains.policy.model;

/**
 * 분류되지 않은 출처 처리 방식
 * Unclassified Source Treatment
 *
 * 소비 이벤트의 source가 local_pv/battery/grid 어디에도 속하지 않을 때 적용합니다.
 * 기본값이 없으며 정책에 반드시 명시해야 합니다.
 */
public enum UnclassifiedSourceTreatment {

    /**
     * 계통 소비로 간주하여 외부 시장에 grid_purchase_price로 지불
     */
    EXTERNAL_MARKET,

    /**
     * 금액 0으로 처리 (포스팅 없음, 미가격 이벤트로 집계)
     */
    ZERO_PRICED,

    /**
     * 배치 전체 거부
     */
    REJECT
}
