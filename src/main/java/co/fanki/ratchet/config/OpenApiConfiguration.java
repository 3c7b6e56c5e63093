package co.fanki.ratchet.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for Ratchet.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Describes the reference extraction API.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Ratchet API")
                        .description("""
                                Ratchet finds which autoloaded constants a Ruby
                                file or snippet references, and which project
                                files define them.

                                ## Endpoints
                                - `POST /api/references/snippet` - references of a snippet
                                - `POST /api/references/file` - references of a project file
                                - `GET /api/references/graph` - file dependency graph
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
