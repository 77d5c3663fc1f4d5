package com.tapelibrary.inventory.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record LocationRequest(

    @NotNull(message = "Slot address is required")
    @PositiveOrZero(message = "Slot address must not be negative")
    Integer addr,

    @NotBlank(message = "Slot category is required")
    String category
) {}
