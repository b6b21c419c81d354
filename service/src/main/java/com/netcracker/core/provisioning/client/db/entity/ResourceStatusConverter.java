package com.netcracker.core.provisioning.client.db.entity;

import com.netcracker.core.provisioning.model.ResourceStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ResourceStatusConverter implements AttributeConverter<ResourceStatus, String> {

    @Override
    public String convertToDatabaseColumn(ResourceStatus attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public ResourceStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ResourceStatus.fromValue(dbData);
    }
}
