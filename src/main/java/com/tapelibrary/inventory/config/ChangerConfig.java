package com.tapelibrary.inventory.config;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.changer.ChangerFactory;
import com.tapelibrary.inventory.changer.ChangerRegistry;
import com.tapelibrary.inventory.changer.fake.FakeChangerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class ChangerConfig {

    @Bean
    public FakeChangerFactory fakeChangerFactory() {
        return new FakeChangerFactory();
    }

    @Bean
    public ChangerRegistry changerRegistry(List<ChangerFactory> factories) {
        return new ChangerRegistry(factories);
    }

    @Bean
    public Changer changer(ChangerRegistry registry, ChangerProperties properties) {
        return registry.create(properties.type(), properties.options());
    }
}
