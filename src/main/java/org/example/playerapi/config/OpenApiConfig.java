package org.example.playerapi.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    static final String BEARER_SCHEME = "Bearer";

    @Bean
    public OpenAPI playerApiOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Player Management API")
                        .description("A REST API for managing players with JWT authentication")
                        .version("1.0.0"))
                .components(new Components().addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                        .type(SecurityScheme.Type.HTTP)
                        .scheme("bearer")
                        .bearerFormat("JWT")
                        .description("Enter the JWT token in the format: Bearer <token>")))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME));
    }
}
