package com.clapgrow.fleet.session.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI sessionWorkerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Session Worker API")
                        .description("Session Worker API Documentation. " +
                                "This service pairs, restores, supervises and disconnects chat sessions for many numbers " +
                                "and routes their inbound events to the command layer.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("ClapGrow")
                                .email("support@clapgrow.com"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0.html")))
                .servers(List.of(
                        new Server().url("http://localhost:8083").description("Local Development Server")
                ));
    }
}
