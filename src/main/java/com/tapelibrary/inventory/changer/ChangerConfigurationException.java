package com.tapelibrary.inventory.changer;

/**
 * Startup-time failure to select or construct a changer. Never retried.
 */
public class ChangerConfigurationException extends RuntimeException {

    public ChangerConfigurationException(String message) {
        super(message);
    }
}
