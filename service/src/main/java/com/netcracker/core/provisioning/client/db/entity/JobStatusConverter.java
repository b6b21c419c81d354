package com.netcracker.core.provisioning.client.db.entity;

import com.netcracker.core.provisioning.model.JobStatus;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class JobStatusConverter implements AttributeConverter<JobStatus, String> {

    @Override
    public String convertToDatabaseColumn(JobStatus attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public JobStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : JobStatus.fromValue(dbData);
    }
}
