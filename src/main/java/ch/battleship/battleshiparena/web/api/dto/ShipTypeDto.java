package ch.battleship.battleshiparena.web.api.dto;

import ch.battleship.battleshiparena.domain.ShapeCatalog;
import ch.battleship.battleshiparena.domain.ShapeDefinition;
import ch.battleship.battleshiparena.domain.enums.ShipType;

import java.util.List;

/**
 * Catalogue entry of a ship type.
 *
 * @param id ship id as used in ship count lists
 * @param name type name
 * @param size number of tiles
 * @param family footprint family
 * @param variants base footprints as lists of {@code [dx, dy]} offsets, before rotation
 */
public record ShipTypeDto(
        int id,
        String name,
        int size,
        String family,
        List<List<int[]>> variants
) {
    public static ShipTypeDto from(ShipType type) {
        return new ShipTypeDto(
                type.getId(),
                type.name(),
                type.getSize(),
                type.getFamily().name(),
                ShapeCatalog.variants(type).stream()
                        .map(ShipTypeDto::offsetsOf)
                        .toList()
        );
    }

    private static List<int[]> offsetsOf(ShapeDefinition shape) {
        return shape.offsets().stream()
                .map(c -> new int[]{c.getX(), c.getY()})
                .toList();
    }
}
