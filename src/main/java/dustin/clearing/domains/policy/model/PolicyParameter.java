package dustin.clearing.domains.policy.model;

import java.util.Optional;

/**
 * 정책 파라미터 정의
 * Policy Parameter Definition
 *
 * 역할:
 * - 인식 가능한 모든 정책 키, 값 타입, 유스케이스별 기본값을 한 곳에 정의
 * - 기본값이 null이면 해당 유스케이스에 적용되지 않는 키
 * - 기본값이 REQUIRED이면 요청에 반드시 포함되어야 하는 키
 *
 * 역할별 최소 지급 기준(min_payout_threshold.&lt;role&gt;)은 키가 동적이므로
 * PolicyLoader에서 별도로 처리합니다.
 */
public enum PolicyParameter {

    // 공통
    ROUNDING_MODE("rounding_mode", ParameterType.ROUNDING_MODE, "HALF_UP", "HALF_UP"),
    UNCLASSIFIED_SOURCE_TREATMENT("unclassified_source_treatment", ParameterType.SOURCE_TREATMENT, ParameterType.REQUIRED, ParameterType.REQUIRED),
    MIN_PAYOUT_THRESHOLD("min_payout_threshold", ParameterType.AMOUNT, "0.00", "0.00"),
    GRID_PURCHASE_PRICE("grid_purchase_price", ParameterType.PRICE, "0.30", "0.30"),
    VPP_SALE_PRICE("vpp_sale_price", ParameterType.PRICE, "0.10", "0.10"),
    BASE_FEE_PER_UNIT("base_fee_per_unit", ParameterType.PRICE, "0.00", "5.00"),

    // mieterstrom
    TENANT_PRICE_PER_KWH("tenant_price_per_kwh", ParameterType.PRICE, null, "0.18"),
    LANDLORD_REVENUE_SHARE("landlord_revenue_share", ParameterType.RATE, null, "0.60"),
    OPERATOR_FEE_RATE("operator_fee_rate", ParameterType.RATE, null, "0.15"),
    GRID_COMPENSATION("grid_compensation", ParameterType.PRICE, null, "0.08"),

    // energy_community
    PROSUMER_SELL_PRICE("prosumer_sell_price", ParameterType.PRICE, "0.15", null),
    CONSUMER_BUY_PRICE("consumer_buy_price", ParameterType.PRICE, "0.12", null),
    COMMUNITY_FEE_RATE("community_fee_rate", ParameterType.RATE, "0.02", null),
    GRID_FEED_PRICE("grid_feed_price", ParameterType.PRICE, "0.08", null);

    /**
     * 역할별 최소 지급 기준 키 접두사
     */
    public static final String ROLE_THRESHOLD_PREFIX = "min_payout_threshold.";

    private final String key;
    private final ParameterType type;
    private final String energyCommunityDefault;
    private final String mieterstromDefault;

    PolicyParameter(String key, ParameterType type, String energyCommunityDefault, String mieterstromDefault) {
        this.key = key;
        this.type = type;
        this.energyCommunityDefault = energyCommunityDefault;
        this.mieterstromDefault = mieterstromDefault;
    }

    public String getKey() {
        return key;
    }

    public ParameterType getType() {
        return type;
    }

    public boolean isNumeric() {
        return type == ParameterType.PRICE || type == ParameterType.RATE || type == ParameterType.AMOUNT;
    }

    public boolean isApplicableTo(UseCase useCase) {
        return rawDefault(useCase) != null;
    }

    public boolean isRequired(UseCase useCase) {
        return ParameterType.REQUIRED.equals(rawDefault(useCase));
    }

    /**
     * 유스케이스 기본값 (필수 키이거나 적용 불가 키면 empty)
     */
    public Optional<String> defaultFor(UseCase useCase) {
        String raw = rawDefault(useCase);
        if (raw == null || ParameterType.REQUIRED.equals(raw)) {
            return Optional.empty();
        }
        return Optional.of(raw);
    }

    public static Optional<PolicyParameter> fromKey(String key) {
        for (PolicyParameter parameter : values()) {
            if (parameter.key.equals(key)) {
                return Optional.of(parameter);
            }
        }
        return Optional.empty();
    }

    private String rawDefault(UseCase useCase) {
        return useCase == UseCase.MIETERSTROM ? mieterstromDefault : energyCommunityDefault;
    }

    /**
     * 파라미터 값 타입
     */
    public enum ParameterType {
        /** EUR 단가, 0 이상 */
        PRICE,
        /** 비율, [0, 1] */
        RATE,
        /** EUR 금액, 0 이상 */
        AMOUNT,
        /** HALF_UP | HALF_EVEN */
        ROUNDING_MODE,
        /** EXTERNAL_MARKET | ZERO_PRICED | REJECT */
        SOURCE_TREATMENT;

        static final String REQUIRED = "<required>";
    }
}
