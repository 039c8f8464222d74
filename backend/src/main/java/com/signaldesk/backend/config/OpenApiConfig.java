package com.signaldesk.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI signalDeskOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Signal Desk API")
                        .description("Signal scoring and human approval of trade signals")
                        .version("1.0"));
    }
}
