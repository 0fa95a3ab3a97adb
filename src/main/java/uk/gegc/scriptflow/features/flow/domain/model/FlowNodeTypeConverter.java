package uk.gegc.scriptflow.features.flow.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class FlowNodeTypeConverter implements AttributeConverter<FlowNodeType, String> {

    @Override
    public String convertToDatabaseColumn(FlowNodeType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public FlowNodeType convertToEntityAttribute(String dbData) {
        return dbData != null ? FlowNodeType.fromValue(dbData) : null;
    }
}
