package com.tapelibrary.inventory.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

public record RegisterVolumeRequest(

    @NotBlank(message = "Serial is required")
    @Pattern(regexp = "[A-Z0-9]{1,32}", message = "Serial must be 1 to 32 upper-case letters or digits")
    String serial,

    @NotNull(message = "Location is required")
    @Valid
    LocationRequest location,

    /** {@code unknown} or {@code scratch}; defaults to {@code scratch}. */
    String category
) {}
