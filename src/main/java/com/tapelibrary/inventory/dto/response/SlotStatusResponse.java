package com.tapelibrary.inventory.dto.response;

import java.util.List;
import java.util.Map;

public record SlotStatusResponse(Map<String, List<SlotResponse>> slots) {

    public record SlotResponse(int addr, String serial) {}
}
