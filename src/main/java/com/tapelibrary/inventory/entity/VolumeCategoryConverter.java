package com.tapelibrary.inventory.entity;

import com.tapelibrary.inventory.domain.VolumeCategory;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link VolumeCategory} by label. Allocation sorts on the stored text, which is
 * why the label and not the ordinal or the enum name is persisted.
 */
@Converter
public class VolumeCategoryConverter implements AttributeConverter<VolumeCategory, String> {

    @Override
    public String convertToDatabaseColumn(VolumeCategory category) {
        return category == null ? null : category.label();
    }

    @Override
    public VolumeCategory convertToEntityAttribute(String label) {
        return label == null ? null : VolumeCategory.fromLabel(label);
    }
}
