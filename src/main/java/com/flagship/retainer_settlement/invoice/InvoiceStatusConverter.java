package com.flagship.retainer_settlement.invoice;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores statuses in the lower-case form the invoices table has always used.
 */
@Converter
public class InvoiceStatusConverter implements AttributeConverter<InvoiceStatus, String> {

    @Override
    public String convertToDatabaseColumn(InvoiceStatus attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public InvoiceStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : InvoiceStatus.fromValue(dbData);
    }
}
