package com.certchaperone.backend.modules.marketplace.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ListingStatusConverter implements AttributeConverter<ListingStatus, String> {

    @Override
    public String convertToDatabaseColumn(ListingStatus attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public ListingStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : ListingStatus.fromCode(dbData);
    }
}
