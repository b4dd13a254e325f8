package ch.battleship.battleshiparena.web.api.controller;

import ch.battleship.battleshiparena.config.OpenApiConfig;
import ch.battleship.battleshiparena.domain.BatchStatistics;
import ch.battleship.battleshiparena.domain.BattleConfiguration;
import ch.battleship.battleshiparena.domain.BattleResult;
import ch.battleship.battleshiparena.domain.ShipCountRequest;
import ch.battleship.battleshiparena.domain.enums.Side;
import ch.battleship.battleshiparena.service.BattleService;
import ch.battleship.battleshiparena.web.api.dto.BatchRequest;
import ch.battleship.battleshiparena.web.api.dto.BatchResultDto;
import ch.battleship.battleshiparena.web.api.dto.BattleRequest;
import ch.battleship.battleshiparena.web.api.dto.BattleResultDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

@RestController
@Tag(name = OpenApiConfig.TAG_BATTLES)
@RequestMapping("/api/battles")
public class BattleController {

    private final BattleService battleService;

    public BattleController(BattleService battleService) {
        this.battleService = battleService;
    }

    @Operation(summary = "Run a single bot-versus-bot battle")
    @PostMapping
    public ResponseEntity<BattleResultDto> runBattle(@RequestBody(required = false) BattleRequest request) {
        BattleRequest r = request != null ? request : new BattleRequest(null, null, null, null, null, null, null);
        long seed = seedOf(r.seed());
        try {
            BattleConfiguration config = battleService.resolveConfiguration(
                    r.rows(), r.cols(), shipCountsOf(r.shipCounts()), new Random(seed));
            Side start = r.startingPlayer() != null ? Side.fromNumber(r.startingPlayer()) : Side.PLAYER_ONE;

            BattleResult result = battleService.runBattle(config, r.playerOne(), r.playerTwo(), start, seed);
            return ResponseEntity.ok(BattleResultDto.from(result, config, seed));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.unprocessableEntity().build();
        }
    }

    @Operation(summary = "Run a batch of battles with alternating starting player and return statistics")
    @PostMapping("/batch")
    public ResponseEntity<BatchResultDto> runBatch(@RequestBody(required = false) BatchRequest request) {
        BatchRequest r = request != null ? request : new BatchRequest(null, null, null, null, null, null, null);
        long seed = seedOf(r.seed());
        try {
            BattleConfiguration config = battleService.resolveConfiguration(
                    r.rows(), r.cols(), shipCountsOf(r.shipCounts()), new Random(seed));

            BatchStatistics stats = battleService.runBatch(r.count(), config, r.playerOne(), r.playerTwo(), seed);
            return ResponseEntity.ok(BatchResultDto.from(stats, config.shipCounts().toArray(), seed));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.unprocessableEntity().build();
        }
    }

    private static ShipCountRequest shipCountsOf(List<Integer> counts) {
        return counts == null ? null : ShipCountRequest.fromList(counts);
    }

    private static long seedOf(Long seed) {
        return seed != null ? seed : ThreadLocalRandom.current().nextLong();
    }
}
