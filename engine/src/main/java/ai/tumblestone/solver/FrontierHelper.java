package ai.tumblestone.solver;

import ai.tumblestone.board.Board;
import ai.tumblestone.board.Point;
import ai.tumblestone.board.Tile;
import java.util.ArrayList;
import java.util.List;

/**
 * Computes the frontier of a board: the stones that may be physically taken next.
 * <p>
 * Each column is scanned from the bottom row upward. Empty cells, survivors and open
 * toggles are looked through; the first stone met ends the scan of that column
 * whether or not it passes the filters, and a closed toggle ends it with no candidate.
 * <p>
 * The answer is ordered by column, left to right. That order is the solver's
 * enumeration order and so decides which solution is found first.
 */
public final class FrontierHelper {
    /** The color filter that accepts every color. */
    public static final int ANY_COLOR = 0;

    private FrontierHelper() {
    }

    /**
     * Returns the positions of every stone that passes the given filters.
     *
     * @param board the board to inspect
     * @param color the active color filter, or {@link #ANY_COLOR}
     * @param allowWild true if a wild stone may be taken
     * @return frontier positions in column order
     */
    public static List<Point> listFrontier(Board board, int color, boolean allowWild) {
        List<Point> frontier = new ArrayList<>();
        for (int column = 0; column < board.width(); column++) {
            for (int row = board.height() - 1; row >= 0; row--) {
                Point point = new Point(column, row);
                Tile tile = board.materializedTileAt(point);
                boolean blocked = switch (tile.kind()) {
                    case EMPTY, SURVIVOR -> false;
                    case ORDINARY -> {
                        if (color == ANY_COLOR || tile.color() == color) {
                            frontier.add(point);
                        }
                        yield true;
                    }
                    case WILD -> {
                        if (allowWild && (color == ANY_COLOR || (color & board.wildColors()) != 0)) {
                            frontier.add(point);
                        }
                        yield true;
                    }
                    case TOGGLE -> !((Tile.Toggle) tile).isOpen();
                };
                if (blocked) {
                    break;
                }
            }
        }
        return frontier;
    }
}
