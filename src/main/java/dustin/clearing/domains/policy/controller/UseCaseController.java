package dustin.clearing.domains.policy.controller;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.clearing.domains.policy.model.dto.UseCaseResponse;
import dustin.clearing.domains.policy.service.UseCaseCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 유스케이스 카탈로그 컨트롤러
 * Use Case Catalog Controller
 *
 * API 엔드포인트:
 * - GET /api/v1/use-cases - 유스케이스 목록과 기본 정책
 */
@RestController
@RequestMapping("/api/v1/use-cases")
@RequiredArgsConstructor
@Tag(name = "Use Cases", description = "정산 유스케이스 및 기본 정책 API")
public class UseCaseController {

    private final UseCaseCatalog useCaseCatalog;

    @Operation(summary = "유스케이스 목록 조회", description = "지원하는 유스케이스의 제목, 기본 정책, 필수 파라미터를 반환합니다.")
    @GetMapping
    public ResponseEntity<List<UseCaseResponse>> listUseCases() {
        return ResponseEntity.ok(useCaseCatalog.listUseCases());
    }
}
