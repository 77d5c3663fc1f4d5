package com.tapelibrary.inventory.mapper;

import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.SlotCategory;
import com.tapelibrary.inventory.dto.request.LocationRequest;
import com.tapelibrary.inventory.dto.response.LocationResponse;
import com.tapelibrary.inventory.dto.response.VolumeResponse;
import com.tapelibrary.inventory.entity.Volume;

public final class VolumeMapper {

    private VolumeMapper() {}

    public static VolumeResponse toResponse(Volume volume) {
        return new VolumeResponse(
            volume.getSerial(),
            volume.getLocation().map(VolumeMapper::toLocationResponse).orElse(null),
            volume.getHome().map(VolumeMapper::toLocationResponse).orElse(null),
            volume.getCategory().label(),
            volume.getFlags().labels(),
            volume.getCreatedAt(),
            volume.getUpdatedAt()
        );
    }

    public static LocationResponse toLocationResponse(Location location) {
        return new LocationResponse(location.addr(), location.category().label());
    }

    /** Returns {@code null} for a {@code null} request, meaning "no location given". */
    public static Location toLocation(LocationRequest request) {
        if (request == null) {
            return null;
        }
        return new Location(request.addr(), SlotCategory.fromLabel(request.category()));
    }
}
