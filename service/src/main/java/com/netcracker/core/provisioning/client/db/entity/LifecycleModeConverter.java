package com.netcracker.core.provisioning.client.db.entity;

import com.netcracker.core.provisioning.model.LifecycleMode;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class LifecycleModeConverter implements AttributeConverter<LifecycleMode, String> {

    @Override
    public String convertToDatabaseColumn(LifecycleMode attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public LifecycleMode convertToEntityAttribute(String dbData) {
        return dbData == null ? null : LifecycleMode.fromValue(dbData);
    }
}
