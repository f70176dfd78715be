package dustin.clearing.domains.policy.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import dustin.clearing.domains.policy.model.PolicyParameter;
import dustin.clearing.domains.policy.model.UseCase;
import dustin.clearing.domains.policy.model.dto.UseCaseResponse;

/**
 * 유스케이스 카탈로그
 * Use Case Catalog
 *
 * 각 유스케이스의 제목과 기본 정책을 제공합니다.
 * 기본값은 PolicyParameter 정의를 그대로 사용하므로 PolicyLoader가 적용하는 값과 항상 같습니다.
 */
@Component
public class UseCaseCatalog {

    public List<UseCaseResponse> listUseCases() {
        List<UseCaseResponse> result = new ArrayList<>();
        for (UseCase useCase : UseCase.values()) {
            result.add(describe(useCase));
        }
        return result;
    }

    public UseCaseResponse describe(UseCase useCase) {
        List<String> required = new ArrayList<>();
        for (PolicyParameter parameter : PolicyParameter.values()) {
            if (parameter.isRequired(useCase)) {
                required.add(parameter.getKey());
            }
        }
        return UseCaseResponse.builder()
                .useCase(useCase.getValue())
                .title(useCase.getTitle())
                .defaultPolicy(defaultPolicy(useCase))
                .requiredParameters(required)
                .build();
    }

    /**
     * 기본 정책 (use_case 포함, 키 정렬)
     */
    public Map<String, Object> defaultPolicy(UseCase useCase) {
        Map<String, Object> policy = new TreeMap<>();
        policy.put("use_case", useCase.getValue());
        for (PolicyParameter parameter : PolicyParameter.values()) {
            parameter.defaultFor(useCase).ifPresent(value ->
                    policy.put(parameter.getKey(), parameter.isNumeric() ? new BigDecimal(value) : value));
        }
        return policy;
    }
}
