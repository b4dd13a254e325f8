package ch.battleship.battleshiparena.web.api.controller;

import ch.battleship.battleshiparena.config.OpenApiConfig;
import ch.battleship.battleshiparena.domain.enums.ShipType;
import ch.battleship.battleshiparena.web.api.dto.ShipTypeDto;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@Tag(name = OpenApiConfig.TAG_CATALOGUE)
@RequestMapping("/api/ships")
public class ShipCatalogController {

    @Operation(summary = "List all ship types with their footprints")
    @GetMapping
    public List<ShipTypeDto> listShipTypes() {
        return Arrays.stream(ShipType.values())
                .map(ShipTypeDto::from)
                .toList();
    }
}
