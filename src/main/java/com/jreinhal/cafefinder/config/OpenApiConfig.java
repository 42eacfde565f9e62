package com.jreinhal.cafefinder.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI metadata; Swagger UI is served at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:cafefinder}")
    private String appName;

    @Value("${cafefinder.search.answer-synthesis:true}")
    private boolean answerSynthesis;

    @Bean
    public OpenAPI cafeFinderOpenAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(List.of(new Server().url("/").description("Current Server")))
                .tags(List.of(
                        new Tag().name("Search").description("Full search with intent-aware ranking and direct answers"),
                        new Tag().name("Quick Search").description("Autocomplete over people, FAQs and resources"),
                        new Tag().name("Index").description("Index status and rebuild")));
    }

    private Info apiInfo() {
        return new Info()
                .title("Café Finder Search API")
                .description("""
                        **%s** answers free-text questions about people, tools, FAQs, resources,
                        discussions, Love of Product sessions, market signals and competitors.

                        ## Pipeline
                        - Sanitize, tokenize and synonym-expand the query
                        - Extract entities and classify intent
                        - Fuzzy-search every index, rerank by intent and entities
                        - Synthesize a direct answer when confident

                        ## Answer synthesis: `%s`
                        """.formatted(appName, answerSynthesis ? "enabled" : "disabled"))
                .version("1.0.0");
    }
}
