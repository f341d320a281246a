package com.geohub.tracker.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration for API documentation.
 *
 * Accessible at:
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI geoHubOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("GeoHub Tracker API")
                        .description("Location tracking: log GPS points, read them back as GeoJSON or GPX, " +
                                "or wait for the next one.\n\n" +
                                "## Sessions\n\n" +
                                "A session is a client name plus an optional secret (both ASCII alphanumeric). " +
                                "Points logged with a secret are only visible to readers presenting the same secret.\n\n" +
                                "## Live updates\n\n" +
                                "`GET /geo/{client}/retrieve/live` blocks until the next point of the session " +
                                "is logged or the timeout (default 30s) passes. On timeout the response carries " +
                                "`error: \"No new rows\"` and the unchanged `last` cursor; just ask again.\n\n" +
                                "Backfill history first with `GET /geo/{client}/retrieve/last`.")
                        .version("1.0.0")
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
