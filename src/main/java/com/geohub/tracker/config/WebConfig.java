package com.geohub.tracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Static asset serving for the map UI.
 *
 * Endpoints:
 * - /geo/assets/**: files from {@code geohub.assets.location} (default
 *   {@code file:assets/}), then from {@code classpath:/static/geo/}
 *
 * Missing files yield 404.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Value("${geohub.assets.location:file:assets/}")
    private String assetsLocation;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = assetsLocation.endsWith("/") ? assetsLocation : assetsLocation + "/";
        registry.addResourceHandler("/geo/assets/**")
                .addResourceLocations(location, "classpath:/static/geo/");
    }
}
