package com.tapelibrary.inventory.dto.request;

/**
 * Partial update; null fields are left as they are. Transit and mount flags are owned by
 * the move protocol and cannot be set here.
 */
public record UpdateVolumeRequest(
    String category,
    Boolean needsCleaning,
    Boolean formatted
) {}
