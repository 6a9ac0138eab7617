package ai.tumblestone.solver;

import ai.tumblestone.board.Board;
import ai.tumblestone.board.Point;
import ai.tumblestone.board.Removal;
import ai.tumblestone.board.Tile;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Exhaustive depth-first solver for Tumblestone boards.
 * <p>
 * Stones are taken in triplets. The first stone of a triplet may be any frontier
 * stone; the next two must match its color, and at most one of the three may be a
 * wild stone. A wild stone is committed to a color when it is taken, so a wild that
 * opens a triplet is tried once per color still in the board's wild mask.
 * <p>
 * <strong>State restoration:</strong> the search mutates the caller's board in place and
 * undoes every removal before returning, in strict reverse order. When {@link #solve}
 * returns, the board is exactly as it was passed in, whatever the outcome.
 * <p>
 * The solver does not look for the shortest solution. It answers the first one found
 * in frontier order, or reports that none exists. The color-lock flag is not enforced.
 */
@Component
public class TripletSolver {
    private static final Logger log = LoggerFactory.getLogger(TripletSolver.class);

    /** Stones per triplet. */
    private static final int TRIPLET = 3;

    /**
     * Searches for a sequence of moves that clears {@code board}.
     *
     * @param board the board to solve; restored to its initial state before returning
     * @return the solution, or an unsolvable result
     */
    public SolveResult solve(Board board) {
        long startNanos = System.nanoTime();
        if (board.removableCount() % TRIPLET != 0) {
            if (log.isDebugEnabled()) {
                log.debug("{} removable stones cannot be grouped in triplets; no solution",
                        board.removableCount());
            }
            return SolveResult.unsolvable(0, System.nanoTime() - startNanos);
        }

        Search search = new Search(board);
        boolean found = search.solveRecursively(FrontierHelper.ANY_COLOR, true);
        long durationNanos = System.nanoTime() - startNanos;

        if (found && search.moves.size() % TRIPLET != 0) {
            log.warn("Search finished with {} moves, which is not a whole number of triplets; rejecting",
                    search.moves.size());
            found = false;
        }
        if (log.isDebugEnabled()) {
            log.debug("Search {} after {} nodes in {} ms", found ? "succeeded" : "exhausted",
                    search.nodesVisited, durationNanos / 1_000_000);
        }
        return found
                ? SolveResult.solved(search.moves, search.nodesVisited, durationNanos)
                : SolveResult.unsolvable(search.nodesVisited, durationNanos);
    }

    /**
     * Per-call search state, so that the solver itself stays stateless.
     */
    private static final class Search {
        private final Board board;

        /** Moves played so far on the current branch. */
        private final List<Point> moves = new ArrayList<>();

        private long nodesVisited;

        Search(Board board) {
            this.board = board;
        }

        /**
         * Solves the board from the current position. {@code color} is the active color
         * filter and {@code allowWild} is true iff a wild stone may be taken.
         *
         * @return true if the moves recorded so far, extended by this call, clear the board
         */
        boolean solveRecursively(int color, boolean allowWild) {
            nodesVisited++;
            // Callers undo their own removals, including on success.
            if (board.isSolved()) {
                return true;
            }
            for (Point point : FrontierHelper.listFrontier(board, color, allowWild)) {
                Tile tile = board.materializedTileAt(point);
                if (tile.kind() == Tile.Kind.WILD && color == FrontierHelper.ANY_COLOR) {
                    int remaining = board.wildColors();
                    while (remaining != 0) {
                        int claim = Integer.lowestOneBit(remaining);
                        remaining &= ~claim;
                        if (tryMove(point, tile, claim, allowWild)) {
                            return true;
                        }
                    }
                } else if (tryMove(point, tile, color, allowWild)) {
                    return true;
                }
            }
            return false;
        }

        /**
         * Takes the stone at {@code point} asserting {@code color}, recurses, and undoes the move.
         * The move stays recorded only if the recursion succeeded.
         */
        private boolean tryMove(Point point, Tile tile, int color, boolean allowWild) {
            moves.add(point);
            Removal removal = board.remove(point, color);

            int nextColor;
            boolean nextAllowWild;
            if (moves.size() % TRIPLET == 0) {
                nextColor = FrontierHelper.ANY_COLOR;
                nextAllowWild = true;
            } else {
                switch (tile.kind()) {
                    case ORDINARY -> {
                        nextColor = tile.color();
                        nextAllowWild = allowWild;
                    }
                    case WILD -> {
                        nextColor = removal.clearedWildColor();
                        nextAllowWild = false;
                    }
                    default -> throw new IllegalStateException("Frontier yielded unremovable tile " + tile);
                }
            }

            boolean solved = solveRecursively(nextColor, nextAllowWild);
            board.undo(removal);
            if (!solved) {
                moves.remove(moves.size() - 1);
            }
            return solved;
        }
    }
}
