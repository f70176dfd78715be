package dustin.clearing.domains.policy.model.dto;

import java.util.List;
import java.util.Map;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 유스케이스 카탈로그 응답 DTO
 * Use Case Catalog Entry
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "유스케이스와 기본 정책")
public class UseCaseResponse {

    @Schema(description = "유스케이스 식별자", example = "mieterstrom")
    private String useCase;

    @Schema(description = "표시 제목", example = "Tenant electricity")
    private String title;

    /**
     * 기본값이 있는 모든 파라미터 (키 정렬)
     */
    @Schema(description = "기본 정책 파라미터")
    private Map<String, Object> defaultPolicy;

    /**
     * 기본값이 없어 요청에 반드시 포함해야 하는 키
     */
    @Schema(description = "필수 파라미터", example = "[\"unclassified_source_treatment\"]")
    private List<String> requiredParameters;
}
