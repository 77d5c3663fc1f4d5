package com.tapelibrary.inventory.service;

import com.tapelibrary.inventory.config.InventoryProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Wipes the inventory once at startup when {@code tapelib.inventory.reset-on-startup} is set,
 * e.g. before the first audit of a freshly installed library.
 */
@Component
@RequiredArgsConstructor
public class InventoryBootstrap implements ApplicationRunner {

    private final InventoryProperties properties;
    private final InventoryService inventoryService;

    @Override
    public void run(ApplicationArguments args) {
        if (properties.resetOnStartup()) {
            inventoryService.reset();
        }
    }
}
