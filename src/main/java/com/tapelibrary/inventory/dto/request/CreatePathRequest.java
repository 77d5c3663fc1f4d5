package com.tapelibrary.inventory.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreatePathRequest(

    @NotBlank(message = "Path is required")
    @Size(max = 1024, message = "Path must not exceed 1024 characters")
    String path,

    @NotBlank(message = "Serial is required")
    String serial
) {}
