package com.pressroom.core.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link ContentStatus} as its lower-case value.
 */
@Converter(autoApply = true)
public class ContentStatusConverter implements AttributeConverter<ContentStatus, String> {

    @Override
    public String convertToDatabaseColumn(ContentStatus status) {
        return status == null ? null : status.getValue();
    }

    @Override
    public ContentStatus convertToEntityAttribute(String value) {
        return value == null ? null : ContentStatus.fromValue(value);
    }
}
