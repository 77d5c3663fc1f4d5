package com.tapelibrary.inventory.dto.response;

public record AllocResponse(String serial) {}
