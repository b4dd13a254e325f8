package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.Rotation;
import ch.battleship.battleshiparena.domain.enums.ShipType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Fixed table of ship footprints.
 *
 * <p>Every {@link ShipType} has at least one {@link ShapeDefinition}. The L and Z ships come in
 * several geometric variants (mirror images included) from which placement picks one at random.
 */
public final class ShapeCatalog {

    private static final Map<ShipType, List<ShapeDefinition>> VARIANTS = buildVariants();

    private ShapeCatalog() {
        // utility class
    }

    public static List<ShapeDefinition> variants(ShipType type) {
        return VARIANTS.get(type);
    }

    /**
     * Picks one variant uniformly at random; types with a single variant always return it.
     *
     * @param type ship type to place
     * @param random random source of the calling battle
     * @return chosen footprint
     */
    public static ShapeDefinition randomVariant(ShipType type, Random random) {
        List<ShapeDefinition> variants = variants(type);
        if (variants.size() == 1) {
            return variants.get(0);
        }
        return variants.get(random.nextInt(variants.size()));
    }

    /**
     * Checks whether a normalized cell set is a rotation of one of the variants of {@code type}.
     *
     * @param type candidate ship type
     * @param normalizedCells cells shifted to start at {@code (0,0)}
     * @return {@code true} if the footprint matches
     */
    public static boolean matches(ShipType type, Set<Coordinate> normalizedCells) {
        if (normalizedCells.size() != type.getSize()) {
            return false;
        }
        for (ShapeDefinition variant : variants(type)) {
            for (Rotation rotation : Rotation.values()) {
                if (variant.normalized(rotation).equals(normalizedCells)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static Map<ShipType, List<ShapeDefinition>> buildVariants() {
        Map<ShipType, List<ShapeDefinition>> map = new EnumMap<>(ShipType.class);

        map.put(ShipType.DESTROYER, List.of(straight(ShipType.DESTROYER)));
        map.put(ShipType.CRUISER, List.of(straight(ShipType.CRUISER)));
        map.put(ShipType.BATTLESHIP, List.of(straight(ShipType.BATTLESHIP)));

        //  ***
        //   *
        map.put(ShipType.T_CRUISER, List.of(shape(ShipType.T_CRUISER, 0, 0, 1, 0, 2, 0, 1, 1)));

        map.put(ShipType.L_CRUISER, List.of(
                shape(ShipType.L_CRUISER, 0, 0, 0, 1, 0, 2, 1, 2),
                shape(ShipType.L_CRUISER, 0, 0, 1, 0, 2, 0, 2, 1),
                shape(ShipType.L_CRUISER, 0, 0, 1, 0, 2, 0, 0, 1),
                shape(ShipType.L_CRUISER, 0, 0, 0, 1, 1, 1, 2, 1)
        ));

        map.put(ShipType.Z_CRUISER, List.of(
                shape(ShipType.Z_CRUISER, 0, 0, 1, 0, 1, 1, 2, 1),
                shape(ShipType.Z_CRUISER, 0, 1, 1, 1, 1, 0, 2, 0)
        ));

        //  **
        // ****
        map.put(ShipType.CARRIER, List.of(shape(ShipType.CARRIER, 1, 0, 2, 0, 0, 1, 1, 1, 2, 1, 3, 1)));

        return Collections.unmodifiableMap(map);
    }

    private static ShapeDefinition straight(ShipType type) {
        List<Coordinate> offsets = new ArrayList<>();
        for (int i = 0; i < type.getSize(); i++) {
            offsets.add(new Coordinate(i, 0));
        }
        return new ShapeDefinition(type, offsets);
    }

    private static ShapeDefinition shape(ShipType type, int... xy) {
        List<Coordinate> offsets = new ArrayList<>();
        for (int i = 0; i < xy.length; i += 2) {
            offsets.add(new Coordinate(xy[i], xy[i + 1]));
        }
        return new ShapeDefinition(type, offsets);
    }
}
