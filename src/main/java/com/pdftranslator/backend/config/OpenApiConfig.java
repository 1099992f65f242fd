package com.pdftranslator.backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.pdftranslator.backend.security.AdminTokenAuthenticationFilter;

@Configuration
public class OpenApiConfig {

    public static final String ADMIN_SCHEME_NAME = "admin-token";

    @Bean
    public OpenAPI translatorOpenAPI(TranslatorProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("PDF Layout Translator API")
                        .description("Asynchronous TR/EN translation of PDF documents with layout preservation.")
                        .version(properties.getVersion())
                )
                // Only /v1/admin/** uses the scheme; job and credit routes are open.
                .components(new Components()
                        .addSecuritySchemes(ADMIN_SCHEME_NAME,
                                new SecurityScheme()
                                        .name(AdminTokenAuthenticationFilter.HEADER)
                                        .type(SecurityScheme.Type.APIKEY)
                                        .in(SecurityScheme.In.HEADER)
                        )
                );
    }
}
