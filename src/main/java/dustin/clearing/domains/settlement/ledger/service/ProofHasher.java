package dustin.clearing.domains.settlement.ledger.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

import dustin.clearing.shared.exception.ErrorCode;
import dustin.clearing.shared.exception.SettlementException;

/**
 * 정산 라인 증명 해시
 * Proof Hasher
 *
 * 정규화 규칙:
 * - 키 사전순 정렬, 공백 없는 JSON
 * - amount는 scale 2 plain decimal (지수 표기 없음)
 * - SHA-256(UTF-8) → 소문자 16진수 64자
 *
 * 해시는 웹 직렬화 설정(snake_case 등)과 무관해야 하므로 전용 매퍼를 사용합니다.
 */
@Component
public class ProofHasher {

    private static final String ALGORITHM = "SHA-256";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    /**
     * 정산 라인 해시
     */
    public String hashLine(Long batchId, Long participantId, BigDecimal amount, String description) {
        Map<String, Object> payload = new TreeMap<>();
        payload.put("amount", amount.setScale(2, RoundingMode.HALF_UP));
        payload.put("batch_id", batchId);
        payload.put("description", description);
        payload.put("participant_id", participantId);
        return hash(payload);
    }

    /**
     * 임의 맵 해시 (입력 맵의 순서와 무관)
     */
    public String hash(Map<String, ?> payload) {
        return sha256Hex(canonicalJson(payload));
    }

    public String canonicalJson(Map<String, ?> payload) {
        try {
            return canonicalMapper.writeValueAsString(new TreeMap<>(payload));
        } catch (JsonProcessingException e) {
            throw new SettlementException(ErrorCode.HASH_FAILURE, "Proof payload could not be serialized: " + payload, e);
        }
    }

    private String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new SettlementException(ErrorCode.HASH_FAILURE, ALGORITHM + " is not available", e);
        }
    }
}
