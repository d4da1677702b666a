package com.taskengine.api.security;

import com.taskengine.engine.config.EngineProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Protects the trigger and admin endpoints with the shared secret.
 */
@Configuration
public class WebConfiguration implements WebMvcConfigurer {

    private final EngineProperties properties;

    public WebConfiguration(EngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new CronSecretInterceptor(properties))
            .addPathPatterns("/api/cron/**", "/api/v1/**");
    }
}
