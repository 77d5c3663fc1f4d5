package com.tapelibrary.inventory.mapper;

import com.tapelibrary.inventory.dto.response.PathResponse;
import com.tapelibrary.inventory.entity.PathEntry;

public final class PathMapper {

    private PathMapper() {}

    public static PathResponse toResponse(PathEntry entry) {
        return new PathResponse(entry.getPath(), VolumeMapper.toResponse(entry.getVolume()));
    }
}
