package com.freightoptimization.tracking.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI trackingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Freight Tracking Service API")
                        .description("""
                                Real-time position tracking for the freight optimization platform.

                                This API provides endpoints for:
                                - **Positions**: Ingest position reports, read current positions and history
                                - **Trajectories**: Simplified travel paths for map display
                                - **ETA**: Arrival estimates and remaining distance to a destination
                                - **Loads**: Comprehensive load tracking and route visualization
                                - **Partitions**: Inspect and maintain the monthly position history partitions

                                **Real-time Updates**: Live positions are published over STOMP at `/ws` on `/topic/positions/{ENTITY_TYPE}_{entityId}`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Freight Platform Team")
                                .email("platform@freightoptimization.com")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")));
    }
}
