package com.tapelibrary.inventory.dto.response;

public record LoadedResponse(int addr, boolean loaded, String serial) {}
