package com.z254.sentinel.guardian.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for GUARDIAN.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8095}")
    private int serverPort;

    @Bean
    public OpenAPI guardianOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("GUARDIAN Health Monitoring API")
                        .description("""
                                GUARDIAN watches the health of a development workspace.

                                ## Features

                                - **Verification**: Ground-truth checks before any issue is reported
                                - **Tickets**: Deduplicated, grouped ticket files per agent
                                - **Auto-Remediation**: Scenario-based fixes for known failures
                                - **Prediction**: Metric correlation and degradation alerts
                                - **Learning**: Enhancement suggestions from recurring issues
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")))
                .tags(List.of(
                        new Tag()
                                .name("Guardian")
                                .description("Health cycles, history, analysis and telemetry")));
    }
}
