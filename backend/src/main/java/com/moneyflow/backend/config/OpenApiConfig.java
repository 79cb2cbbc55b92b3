package com.moneyflow.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI moneyFlowOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Money Flow Monitor API")
                        .description("Market data ingest, evaluation cycles, alerts, signals and risk scores")
                        .version("1.0"));
    }
}
