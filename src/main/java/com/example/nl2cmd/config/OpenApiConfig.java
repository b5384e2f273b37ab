package com.example.nl2cmd.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.License;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info = @Info(
        title = "NL2CMD API",
        version = "v1",
        description = "Natural-language to shell command resolution, problem diagnosis and suggestions."
    ),
    servers = {
        @Server(url = "/", description = "Default server")
    }
)
public class OpenApiConfig {

  @Bean
  public OpenAPI baseOpenAPI() {
    return new OpenAPI()
        .info(new io.swagger.v3.oas.models.info.Info()
            .title("NL2CMD API")
            .version("v1")
            .description("Swagger UI for exploring the command resolution endpoints.")
            .license(new License().name("Apache 2.0")));
  }

  @Bean
  public GroupedOpenApi commandsApi() {
    return GroupedOpenApi.builder()
        .group("commands")
        .packagesToScan("com.example.nl2cmd.controller")
        .pathsToMatch("/v1/**")
        .build();
  }
}
