package com.ospicorp.livewhen.config;

import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.time.Clock;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  private static final String DOCS_URL = "https://docs.livewhen.dev";

  @Bean
  OpenAPI apiInfo(Clock clock) {
    return new OpenAPI()
        .info(new Info()
            .title("LiveWhen API")
            .version("v1")
            .description("Live-time predictions for streamers built from a year of activity. "
                + "Hours, days and the `week` parameter are interpreted in " + clock.getZone()
                + "; weeks start on Sunday."))
        .servers(List.of(new Server().url("/")))
        .tags(List.of(
            tag("Streamers", "Heatmaps, statistics, activity samples and rankings"),
            tag("Programmes", "Predicted weekly programmes, global and per user"),
            tag("Custom programmes", "User-curated streamer lists that drive the programme view"),
            tag("Calendar", "Programmes laid out as a 24x7 grid")))
        .externalDocs(new ExternalDocumentation()
            .description("Error codes and problem types")
            .url(DOCS_URL + "/problems"));
  }

  private static Tag tag(String name, String description) {
    return new Tag().name(name).description(description);
  }
}
