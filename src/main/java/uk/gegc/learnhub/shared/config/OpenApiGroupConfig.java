package uk.gegc.learnhub.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi progressGroup() {
        return GroupedOpenApi.builder()
                .group("progress")
                .displayName("Lesson Progress")
                .pathsToMatch("/api/v1/lessons/**")
                .build();
    }

    @Bean
    public GroupedOpenApi enrollmentsGroup() {
        return GroupedOpenApi.builder()
                .group("enrollments")
                .displayName("Enrollments & Certificates")
                .pathsToMatch("/api/v1/enrollments/**")
                .build();
    }

    @Bean
    public GroupedOpenApi analyticsGroup() {
        return GroupedOpenApi.builder()
                .group("analytics")
                .displayName("Learning Analytics")
                .pathsToMatch("/api/v1/progress/**", "/api/v1/courses/*/enrollment-stats")
                .build();
    }
}
