package com.linlay.citygeo.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(
            @Value("${geo.cors.path-pattern:/api/**}") String pathPattern,
            @Value("${geo.cors.allowed-origin-patterns:http://localhost:*}") List<String> allowedOriginPatterns,
            @Value("${geo.cors.allowed-methods:GET,OPTIONS}") List<String> allowedMethods,
            @Value("${geo.cors.max-age-seconds:3600}") long maxAgeSeconds
    ) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(compact(allowedOriginPatterns));
        configuration.setAllowedMethods(compact(allowedMethods));
        configuration.addAllowedHeader(CorsConfiguration.ALL);
        configuration.setMaxAge(maxAgeSeconds);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(pathPattern, configuration);
        return new CorsWebFilter(source);
    }

    private List<String> compact(List<String> input) {
        List<String> output = new ArrayList<>();
        if (input == null) {
            return output;
        }
        for (String item : input) {
            if (item == null) {
                continue;
            }
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                output.add(trimmed);
            }
        }
        return output;
    }
}
