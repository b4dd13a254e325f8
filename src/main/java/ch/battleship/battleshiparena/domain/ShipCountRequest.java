package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.ShipType;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

/**
 * Number of ships of each type a side has to place (and its opponent has to sink).
 *
 * <p>Textual form: seven comma-separated counts for ship ids 1..7, e.g. {@code "1,1,1,0,1,0,1"}.
 */
public final class ShipCountRequest {

    private final Map<ShipType, Integer> counts;

    private ShipCountRequest(Map<ShipType, Integer> counts) {
        EnumMap<ShipType, Integer> copy = new EnumMap<>(ShipType.class);
        for (ShipType type : ShipType.values()) {
            int count = counts.getOrDefault(type, 0);
            if (count < 0) {
                throw new IllegalArgumentException("Ship count for " + type + " must not be negative: " + count);
            }
            copy.put(type, count);
        }
        this.counts = Collections.unmodifiableMap(copy);
    }

    public static ShipCountRequest of(Map<ShipType, Integer> counts) {
        return new ShipCountRequest(counts);
    }

    /**
     * Creates a request from seven counts, one per ship id in ascending order.
     *
     * @param countsById counts for ids 1..7
     * @return request
     * @throws IllegalArgumentException if not exactly seven counts are given
     */
    public static ShipCountRequest ofCounts(int... countsById) {
        ShipType[] types = ShipType.values();
        if (countsById.length != types.length) {
            throw new IllegalArgumentException(
                    "Expected " + types.length + " ship counts but got " + countsById.length);
        }
        Map<ShipType, Integer> map = new EnumMap<>(ShipType.class);
        for (int i = 0; i < types.length; i++) {
            map.put(types[i], countsById[i]);
        }
        return new ShipCountRequest(map);
    }

    /**
     * Creates a request from a list of seven counts, as received in JSON request bodies.
     *
     * @param countsById counts for ids 1..7
     * @return request
     * @throws IllegalArgumentException if the list does not hold exactly seven non-null counts
     */
    public static ShipCountRequest fromList(List<Integer> countsById) {
        if (countsById == null || countsById.contains(null)) {
            throw new IllegalArgumentException("Ship count list must contain seven numbers: " + countsById);
        }
        return ofCounts(countsById.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Parses the comma-separated form, e.g. {@code "1,0,2,0,0,0,1"}.
     *
     * @param definition seven comma-separated non-negative integers
     * @return request
     * @throws IllegalArgumentException if the definition is malformed
     */
    public static ShipCountRequest parse(String definition) {
        if (definition == null || definition.isBlank()) {
            throw new IllegalArgumentException("Ship count list must not be empty");
        }
        String[] parts = definition.split(",");
        int[] values = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Integer.parseInt(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid ship count list: " + definition, e);
            }
        }
        return ofCounts(values);
    }

    /**
     * Generates a random fleet that covers at least {@code fillRatio} of the board.
     *
     * <p>Ship ids are drawn uniformly until the tile total reaches
     * {@code floor(rows * cols * fillRatio)}.
     *
     * @param rows board rows
     * @param cols board columns
     * @param fillRatio fraction of the board that should be covered by ship tiles
     * @param random random source
     * @return generated request
     */
    public static ShipCountRequest random(int rows, int cols, double fillRatio, Random random) {
        int target = (int) ((long) rows * cols * fillRatio);
        ShipType[] types = ShipType.values();
        Map<ShipType, Integer> map = new EnumMap<>(ShipType.class);
        int totalTiles = 0;
        while (totalTiles < target) {
            ShipType type = types[random.nextInt(types.length)];
            map.merge(type, 1, Integer::sum);
            totalTiles += type.getSize();
        }
        return new ShipCountRequest(map);
    }

    public int countOf(ShipType type) {
        return counts.get(type);
    }

    public int totalShips() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Number of board cells the fleet covers. Computed as {@code long} since client-supplied counts
     * may exceed any board that fits an {@code int}.
     */
    public long totalTiles() {
        return counts.entrySet().stream()
                .mapToLong(e -> (long) e.getKey().getSize() * e.getValue())
                .sum();
    }

    /**
     * Returns a mutable copy of the counts, e.g. as a starting point for remaining-ship bookkeeping.
     */
    public Map<ShipType, Integer> toMap() {
        return new EnumMap<>(counts);
    }

    /**
     * Counts for ids 1..7 in ascending id order.
     */
    public int[] toArray() {
        return Arrays.stream(ShipType.values()).mapToInt(counts::get).toArray();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShipCountRequest other)) return false;
        return counts.equals(other.counts);
    }

    @Override
    public int hashCode() {
        return counts.hashCode();
    }

    @Override
    public String toString() {
        return Arrays.stream(toArray()).mapToObj(String::valueOf).collect(Collectors.joining(","));
    }
}
