package com.flagship.retainer_settlement.invoice;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class InvoiceTypeConverter implements AttributeConverter<InvoiceType, String> {

    @Override
    public String convertToDatabaseColumn(InvoiceType attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public InvoiceType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : InvoiceType.fromValue(dbData);
    }
}
