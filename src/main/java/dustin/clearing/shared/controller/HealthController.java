package dustin.clearing.shared.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.clearing.config.SettlementProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * 헬스 체크
 * Liveness endpoint
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "헬스 체크")
public class HealthController {

    private final SettlementProperties properties;

    @Operation(summary = "헬스 체크")
    @GetMapping("/api/v1/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "code_version", properties.getCodeVersion()));
    }
}
