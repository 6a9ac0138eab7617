package ai.tumblestone.solver;

import ai.tumblestone.board.Point;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a single {@link TripletSolver#solve} call.
 * <p>
 * An unsolvable board is a normal outcome, not an error: {@code solved} is false and
 * {@code moves} is empty.
 *
 * @param solved true if {@code moves} clears the board
 * @param moves the positions to take, in order; grouped in triplets
 * @param nodesVisited the number of search states entered
 * @param durationNanos wall-clock time spent searching
 */
public record SolveResult(boolean solved, List<Point> moves, long nodesVisited, long durationNanos) {
    public SolveResult {
        moves = List.copyOf(moves);
    }

    static SolveResult solved(List<Point> moves, long nodesVisited, long durationNanos) {
        return new SolveResult(true, moves, nodesVisited, durationNanos);
    }

    static SolveResult unsolvable(long nodesVisited, long durationNanos) {
        return new SolveResult(false, Collections.emptyList(), nodesVisited, durationNanos);
    }
}
