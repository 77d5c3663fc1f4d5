package com.tapelibrary.inventory.entity;

import com.tapelibrary.inventory.domain.SlotCategory;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class SlotCategoryConverter implements AttributeConverter<SlotCategory, String> {

    @Override
    public String convertToDatabaseColumn(SlotCategory category) {
        return category == null ? null : category.label();
    }

    @Override
    public SlotCategory convertToEntityAttribute(String label) {
        return label == null ? null : SlotCategory.fromLabel(label);
    }
}
