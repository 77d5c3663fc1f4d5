package com.tapelibrary.inventory.entity;

import com.tapelibrary.inventory.domain.VolumeFlags;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class VolumeFlagsConverter implements AttributeConverter<VolumeFlags, Integer> {

    @Override
    public Integer convertToDatabaseColumn(VolumeFlags flags) {
        return flags == null ? 0 : flags.bits();
    }

    @Override
    public VolumeFlags convertToEntityAttribute(Integer bits) {
        return bits == null ? VolumeFlags.none() : VolumeFlags.of(bits);
    }
}
