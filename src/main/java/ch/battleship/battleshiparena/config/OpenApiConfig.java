package ch.battleship.battleshiparena.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI / Swagger documentation of the arena endpoints.
 *
 * <p>Controllers reference the tags declared here, so Swagger UI groups battles, the ship catalogue
 * and the development helpers separately.
 */
@Configuration
public class OpenApiConfig {

    public static final String TAG_BATTLES = "Battles";
    public static final String TAG_CATALOGUE = "Catalogue";
    public static final String TAG_DEV = "Development";

    @Bean
    public OpenAPI battleshipArenaOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Battleship Arena API")
                        .description("Bot-versus-bot Battleship simulation. Live move events are published on "
                                + "STOMP topic /topic/battles/{battleId}/events (endpoint /ws).")
                        .version("v1.0.0"))
                .tags(List.of(
                        new Tag().name(TAG_BATTLES).description("Run single battles and batches"),
                        new Tag().name(TAG_CATALOGUE).description("Ship types and footprints"),
                        new Tag().name(TAG_DEV).description("Helpers available in the dev and test profiles")
                ));
    }
}
