package ai.tumblestone.board;

import java.util.List;

/**
 * Immutable copy of the mutable state of a {@link Board}.
 * <p>
 * Two snapshots are equal exactly when the boards they were taken from are
 * indistinguishable to the solver.
 *
 * @param turn the turn counter
 * @param wildColors the remaining wild-color mask
 * @param removableCount the number of directly removable tiles
 * @param tiles the unmaterialized tiles in row-major order
 */
public record BoardSnapshot(int turn, int wildColors, int removableCount, List<Tile> tiles) {
    public BoardSnapshot {
        tiles = List.copyOf(tiles);
    }
}
