package com.chronofill.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI chronofillOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Chronofill Backfill API")
                        .description("Operator endpoints for chunked historical backfills")
                        .version("1.0"));
    }
}
