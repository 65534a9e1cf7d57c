package io.github.chirino.social.persistence.entity;

import io.github.chirino.social.model.TouchStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class TouchStatusConverter implements AttributeConverter<TouchStatus, String> {

    @Override
    public String convertToDatabaseColumn(TouchStatus attribute) {
        return attribute == null ? null : attribute.toValue();
    }

    @Override
    public TouchStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : TouchStatus.fromString(dbData);
    }
}
