package com.tapelibrary.inventory.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI tapeInventoryOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Tape Inventory API")
                .description("Inventory of a robotic tape library: volume lifecycle, "
                    + "load, unload and transfer through the media changer, allocation and audit.")
                .version("1.0.0"));
    }
}
