package com.tapelibrary.inventory.dto.response;

public record LocationResponse(int addr, String category) {}
