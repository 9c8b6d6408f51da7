package ru.tigran.employeeinsights.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 3.0 configuration for Swagger UI documentation.
 * Configures JWT Bearer token authentication and API metadata.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .components(new Components()
                        .addSecuritySchemes("bearer-jwt",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Token from POST /api/v1/auth/login, field 'access_token'.")
                        )
                )
                .info(new Info()
                        .title("Employee Insights Engine API")
                        .description("Ingestion of classified employee feedback and sentiment aggregates by keyword and city. "
                                + "Import and refresh endpoints need the ADMIN role.")
                        .version("1.0.0")
                );
    }
}
