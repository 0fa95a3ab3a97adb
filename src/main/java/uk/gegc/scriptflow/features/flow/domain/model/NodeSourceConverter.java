package uk.gegc.scriptflow.features.flow.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class NodeSourceConverter implements AttributeConverter<NodeSource, String> {

    @Override
    public String convertToDatabaseColumn(NodeSource attribute) {
        return attribute != null ? attribute.getValue() : NodeSource.MANUAL.getValue();
    }

    @Override
    public NodeSource convertToEntityAttribute(String dbData) {
        return NodeSource.fromValue(dbData);
    }
}
