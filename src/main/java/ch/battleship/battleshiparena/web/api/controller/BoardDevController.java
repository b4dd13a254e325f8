package ch.battleship.battleshiparena.web.api.controller;

import ch.battleship.battleshiparena.config.OpenApiConfig;
import ch.battleship.battleshiparena.domain.BattleConfiguration;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.service.BattleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

@Profile({"dev", "test"})
@RestController
@Tag(name = OpenApiConfig.TAG_DEV)
@RequestMapping("/api/dev/boards")
public class BoardDevController {

    private final BattleService battleService;

    public BoardDevController(BattleService battleService) {
        this.battleService = battleService;
    }

    @Operation(summary = "Get ASCII view of a randomly placed board")
    @GetMapping(
            value = "/random",
            produces = MediaType.TEXT_PLAIN_VALUE
    )
    public ResponseEntity<String> getRandomBoardAscii(@RequestParam(required = false) Integer rows,
                                                      @RequestParam(required = false) Integer cols,
                                                      @RequestParam(required = false) String shipCounts,
                                                      @RequestParam(required = false) String contender,
                                                      @RequestParam(required = false) Long seed) {
        long s = seed != null ? seed : ThreadLocalRandom.current().nextLong();
        try {
            ShipCountRequest counts = shipCounts != null ? ShipCountRequest.parse(shipCounts) : null;
            BattleConfiguration config = battleService.resolveConfiguration(rows, cols, counts, new Random(s));
            String ascii = battleService.randomBoard(config, contender, s).render(true);
            return ResponseEntity.ok(ascii);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.unprocessableEntity().build();
        }
    }
}
