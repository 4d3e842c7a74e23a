package forensic.damages.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Forensic Damages API",
            version = "1.0.0",
            description =
                "Economic damages for personal-injury and wrongful-death litigation\n\n"
                    + "## Method\n"
                    + "- Tinari algebraic method (adjusted income factor)\n"
                    + "- Past loss nominal, future loss discounted at mid-year\n\n"
                    + "## Features\n"
                    + "- Earnings loss with alternative retirement-age scenarios\n"
                    + "- Household services and life care plan valuation\n"
                    + "- Year-by-year schedules"),
    servers = {@Server(url = "http://localhost:8080", description = "Local Development")})
public class OpenApiConfig {}
