package com.forrestgump.contactapi.infrastructure.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

@Configuration
public class WebConfig implements WebFluxConfigurer {

    private final ContactProperties contactProperties;

    public WebConfig(ContactProperties contactProperties) {
        this.contactProperties = contactProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/contact")
                .allowedOrigins(contactProperties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("POST", "OPTIONS")
                .allowedHeaders("Content-Type", "X-Correlation-Id")
                .exposedHeaders("X-Correlation-Id", "Retry-After");
    }
}
