package com.tapelibrary.inventory.changer;

import java.util.Map;

/**
 * Builds one kind of {@link Changer}. The factory owns validation of its options:
 * missing or unknown keys are rejected here, once, before the device is touched.
 */
public interface ChangerFactory {

    /** Name used to select this implementation in configuration, e.g. {@code fake}. */
    String name();

    /**
     * @throws ChangerConfigurationException if the options are incomplete or invalid
     */
    Changer create(Map<String, String> options);
}
