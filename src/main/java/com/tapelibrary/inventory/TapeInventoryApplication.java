package com.tapelibrary.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TapeInventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(TapeInventoryApplication.class, args);
    }
}
