package io.github.chirino.social.persistence.entity;

import io.github.chirino.social.model.HushMemberStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class HushMemberStatusConverter implements AttributeConverter<HushMemberStatus, String> {

    @Override
    public String convertToDatabaseColumn(HushMemberStatus attribute) {
        return attribute == null ? null : attribute.toValue();
    }

    @Override
    public HushMemberStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : HushMemberStatus.fromString(dbData);
    }
}
