package com.openrangelabs.donpetre.credentials.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Configuration for OpenAPI 3 / Swagger documentation.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME = "basicAuth";

    @Value("${server.port:8080}")
    private String serverPort;

    /**
     * Configures the OpenAPI specification for the credential vault.
     *
     * @return configured OpenAPI instance
     */
    @Bean
    public OpenAPI credentialVaultOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local development server")))
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("basic")
                                .description("HTTP basic credentials of an ADMIN user")));
    }

    private Info apiInfo() {
        return new Info()
                .title("DonPetre Credential Vault API")
                .description("""
                # DonPetre Credential Vault

                Validates and stores API keys for AI providers (OpenAI, Anthropic, Google and custom).

                ## Key Features

                * **Format validation**: per-provider rules, sanitization and entropy checks
                * **Live validation**: optional probe of the provider's API with the key
                * **Encrypted storage**: AES-256-GCM under a passphrase-derived session key
                * **Lifecycle**: rotation with rollback, revocation, expiry and usage tracking

                ## Security

                Storage must be initialized with the passphrase before any key operation.
                Key material is never returned in API responses; only masked keys are shown.
                """)
                .version("1.0.0")
                .contact(new Contact()
                        .name("OpenRange Labs Development Team")
                        .email("dev@openrangelabs.com")
                        .url("https://openrangelabs.com"))
                .license(new License()
                        .name("Proprietary")
                        .url("https://openrangelabs.com/license"));
    }
}
