package com.netcracker.core.provisioning.client.db.entity;

import com.netcracker.core.provisioning.model.JobType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class JobTypeConverter implements AttributeConverter<JobType, String> {

    @Override
    public String convertToDatabaseColumn(JobType attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public JobType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : JobType.fromValue(dbData);
    }
}
