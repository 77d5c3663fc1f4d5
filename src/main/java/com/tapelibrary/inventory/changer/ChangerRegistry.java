package com.tapelibrary.inventory.changer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Name to factory lookup for the available changer implementations. Built once at
 * startup from an explicit list of factories and handed to whoever selects the changer.
 */
public class ChangerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChangerRegistry.class);

    private final Map<String, ChangerFactory> factories = new TreeMap<>();

    public ChangerRegistry(Collection<? extends ChangerFactory> factories) {
        for (ChangerFactory factory : factories) {
            ChangerFactory previous = this.factories.putIfAbsent(factory.name(), factory);
            if (previous != null) {
                throw new ChangerConfigurationException(
                    "Changer implementation '" + factory.name() + "' is registered twice");
            }
        }
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(factories.keySet());
    }

    public Changer create(String name, Map<String, String> options) {
        ChangerFactory factory = factories.get(name);
        if (factory == null) {
            throw new ChangerConfigurationException(
                "Unknown changer implementation '" + name + "'; available: " + names());
        }
        log.info("Creating changer '{}'", name);
        return factory.create(options == null ? Map.of() : options);
    }
}
