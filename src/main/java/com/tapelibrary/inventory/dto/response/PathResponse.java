package com.tapelibrary.inventory.dto.response;

public record PathResponse(String path, VolumeResponse volume) {}
