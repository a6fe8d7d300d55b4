package com.certchaperone.backend.modules.transfer.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class OwnershipClaimStatusConverter implements AttributeConverter<OwnershipClaimStatus, String> {

    @Override
    public String convertToDatabaseColumn(OwnershipClaimStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public OwnershipClaimStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : OwnershipClaimStatus.fromCode(dbData);
    }
}
