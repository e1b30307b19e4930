package com.cronq.schedule;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class ScheduleExpressionConverter implements AttributeConverter<ScheduleExpression, String> {

    @Override
    public String convertToDatabaseColumn(ScheduleExpression attribute) {
        return attribute == null ? null : attribute.toColumnValue();
    }

    @Override
    public ScheduleExpression convertToEntityAttribute(String dbData) {
        return ScheduleExpression.parse(dbData);
    }
}
