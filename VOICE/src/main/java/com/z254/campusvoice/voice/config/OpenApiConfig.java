package com.z254.campusvoice.voice.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for VOICE service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8000}")
    private int serverPort;

    @Bean
    public OpenAPI voiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("CampusVoice Complaint Service API")
                        .description("""
                                VOICE is the complaint service of the CampusVoice platform.

                                ## Features

                                - **Complaint intake**: AI classification and routing to the responsible authority
                                - **Voting**: One vote per student per complaint; voting twice removes the vote
                                - **Priority**: Scores recomputed from votes on every change
                                - **Status workflow**: Authority updates with a full audit trail

                                ## Live feed

                                Connect to `/api/v1/ws/votes/{complaintId}` for vote and status events.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("CampusVoice Team")
                                .email("studentaffairs@srec.ac.in"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Complaints")
                                .description("Complaint submission and querying"),
                        new Tag()
                                .name("Votes")
                                .description("Voting and vote statistics"),
                        new Tag()
                                .name("Status")
                                .description("Authority status updates"),
                        new Tag()
                                .name("Realtime")
                                .description("Live feed statistics"),
                        new Tag()
                                .name("Stats")
                                .description("Platform statistics")
                ));
    }
}
