package uk.gegc.scriptflow.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi flowSyncGroup() {
        return GroupedOpenApi.builder()
                .group("flow-sync")
                .displayName("Screenplay Flow Sync")
                .pathsToMatch("/api/v1/screenplays/**")
                .build();
    }
}
