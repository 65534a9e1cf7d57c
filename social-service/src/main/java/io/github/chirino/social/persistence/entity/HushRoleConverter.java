package io.github.chirino.social.persistence.entity;

import io.github.chirino.social.model.HushRole;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class HushRoleConverter implements AttributeConverter<HushRole, String> {

    @Override
    public String convertToDatabaseColumn(HushRole attribute) {
        return attribute == null ? null : attribute.toValue();
    }

    @Override
    public HushRole convertToEntityAttribute(String dbData) {
        return dbData == null ? null : HushRole.fromString(dbData);
    }
}
