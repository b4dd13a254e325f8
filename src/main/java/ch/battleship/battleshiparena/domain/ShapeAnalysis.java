package ch.battleship.battleshiparena.domain;

import ch.battleship.battleshiparena.domain.enums.ShapeFamily;

/**
 * Result of classifying a cluster of hit cells.
 *
 * @param size number of cells in the cluster
 * @param family best guess of the footprint family
 */
public record ShapeAnalysis(int size, ShapeFamily family) {
}
