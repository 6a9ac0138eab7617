package ai.tumblestone.board;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to reverse a single {@link Board#remove(Point, int)}.
 * <p>
 * Removals must be handed back to {@link Board#undo(Removal)} in exact reverse
 * order of application; {@code turn} is the board turn after the removal and is
 * checked on undo.
 *
 * @param point the position of the removed tile
 * @param tile the tile that occupied {@code point} before removal
 * @param clearedWildColor the color bit taken from the wild mask, or {@code 0}
 * @param survivors positions of survivors cleared by the row cascade
 * @param turn the board turn immediately after the removal
 */
public record Removal(Point point, Tile tile, int clearedWildColor, List<Point> survivors, int turn) {
    public Removal {
        Objects.requireNonNull(point, "point");
        Objects.requireNonNull(tile, "tile");
        survivors = List.copyOf(survivors);
    }
}
