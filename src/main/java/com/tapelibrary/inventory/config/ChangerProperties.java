package com.tapelibrary.inventory.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

/**
 * Selects the changer implementation ({@code tapelib.changer.type}) and passes its
 * options ({@code tapelib.changer.options.*}) to the matching factory, which validates them.
 */
@Validated
@ConfigurationProperties("tapelib.changer")
public record ChangerProperties(
    @NotBlank @DefaultValue("fake") String type,
    Map<String, String> options
) {

    public ChangerProperties {
        options = options == null ? Map.of() : Map.copyOf(options);
    }
}
