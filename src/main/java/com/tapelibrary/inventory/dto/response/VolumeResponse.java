package com.tapelibrary.inventory.dto.response;

import java.time.Instant;
import java.util.List;

public record VolumeResponse(
    String serial,
    LocationResponse location,
    LocationResponse home,
    String category,
    List<String> flags,
    Instant createdAt,
    Instant updatedAt
) {}
