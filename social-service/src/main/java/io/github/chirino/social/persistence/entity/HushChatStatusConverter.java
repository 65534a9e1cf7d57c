package io.github.chirino.social.persistence.entity;

import io.github.chirino.social.model.HushChatStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class HushChatStatusConverter implements AttributeConverter<HushChatStatus, String> {

    @Override
    public String convertToDatabaseColumn(HushChatStatus attribute) {
        return attribute == null ? null : attribute.toValue();
    }

    @Override
    public HushChatStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : HushChatStatus.fromString(dbData);
    }
}
