package uk.gegc.scriptflow.features.screenplay.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ElementTypeConverter implements AttributeConverter<ElementType, String> {

    @Override
    public String convertToDatabaseColumn(ElementType attribute) {
        return attribute != null ? attribute.getValue() : null;
    }

    @Override
    public ElementType convertToEntityAttribute(String dbData) {
        return dbData != null ? ElementType.fromValue(dbData) : null;
    }
}
