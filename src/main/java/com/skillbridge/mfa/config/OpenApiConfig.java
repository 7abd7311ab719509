package com.skillbridge.mfa.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI skillbridgeMfaOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("SkillBridge MFA API")
                        .description("""
                                Second-factor step-up for SkillBridge logins.
                                
                                ## Flow
                                1. `POST /auth/login` with the identity provider's ID token
                                2. If `mfaRequired` is true, `POST /auth/login/mfa` with the returned `mfaToken`
                                   and a TOTP code or a recovery code
                                
                                Enrollment and management endpoints under `/mfa` require a Bearer access token.
                                """)
                        .version("1.0.0"))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")));
    }
}
