package uk.gegc.assessment.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi sessionsGroup() {
        return GroupedOpenApi.builder()
                .group("sessions")
                .displayName("Assessment Sessions")
                .pathsToMatch("/api/v1/assessments/*/sessions", "/api/v1/sessions/**")
                .build();
    }

    @Bean
    public GroupedOpenApi analyticsGroup() {
        return GroupedOpenApi.builder()
                .group("analytics")
                .displayName("Assessment Analytics")
                .pathsToMatch("/api/v1/analytics/**")
                .build();
    }
}
