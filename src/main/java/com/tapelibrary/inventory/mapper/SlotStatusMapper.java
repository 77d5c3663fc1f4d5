package com.tapelibrary.inventory.mapper;

import com.tapelibrary.inventory.changer.SlotStatus;
import com.tapelibrary.inventory.dto.response.SlotStatusResponse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SlotStatusMapper {

    private SlotStatusMapper() {}

    public static SlotStatusResponse toResponse(SlotStatus status) {
        Map<String, List<SlotStatusResponse.SlotResponse>> slots = new LinkedHashMap<>();
        status.slots().forEach((category, list) -> slots.put(
            category.label(),
            list.stream()
                .map(slot -> new SlotStatusResponse.SlotResponse(slot.addr(), slot.serial()))
                .toList()
        ));
        return new SlotStatusResponse(slots);
    }
}
