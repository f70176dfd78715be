package dustin.clearing.domains.participant.model.entity;

import dustin.clearing.domains.participant.model.ParticipantRole;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * 역할 ↔ DB 문자열 변환 (소문자 값 그대로 저장)
 */
@Converter
public class ParticipantRoleConverter implements AttributeConverter<ParticipantRole, String> {

    @Override
    public String convertToDatabaseColumn(ParticipantRole role) {
        return role != null ? role.getValue() : null;
    }

    @Override
    public ParticipantRole convertToEntityAttribute(String value) {
        return value != null ? ParticipantRole.fromValue(value) : null;
    }
}
