package com.hotel.booking.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the booking API.
 * -@Configuration: Marks this class as a Spring configuration class.
 * --WithoutIT: CORS settings won't be applied, and browsers will block
 * ---cross-origin requests from the booking front end.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(
                        "http://localhost:5173",
                        "http://127.0.0.1:5173")
                .allowedMethods("GET", "POST", "PATCH", "OPTIONS", "HEAD")
                .allowedHeaders("*")
                // Rate-limit headers must be readable by the browser
                .exposedHeaders("Retry-After", "X-RateLimit-Limit", "X-RateLimit-Remaining", "X-RateLimit-Reset")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
