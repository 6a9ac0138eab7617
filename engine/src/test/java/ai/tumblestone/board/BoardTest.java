package ai.tumblestone.board;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.tumblestone.helpers.BoardBuilder;
import ai.tumblestone.helpers.BoardFactory;
import ai.tumblestone.solver.FrontierHelper;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Mutation and undo behavior of {@link Board}.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>randomRemovalsUndoExactly</b> - any stack of removals undone in reverse restores the board</li>
 *   <li><b>removableCountMatchesScan</b> - incremental count agrees with a full scan after every step</li>
 *   <li><b>wildColorsTrackWildTiles</b> - wild mask bit count equals remaining wild tiles</li>
 *   <li><b>survivorCascade</b> - survivors vanish with the last removable stone of their row</li>
 * </ul>
 */
class BoardTest {

    @Test
    void constructionCountsRemovableTiles() {
        Board board = BoardFactory.everyKind().build();
        assertEquals(4, board.width());
        assertEquals(4, board.height());
        assertEquals(0, board.turn());
        assertEquals(12, board.removableCount());
        assertEquals(1, Integer.bitCount(board.wildColors()));
    }

    @Test
    void constructionRejectsInconsistentBoards() {
        List<Tile> tiles = List.of(Tile.WILD, new Tile.Ordinary('R', 1));
        assertThrows(IllegalArgumentException.class, () -> new Board(2, 0, false, tiles));
        assertThrows(IllegalArgumentException.class, () -> new Board(2, 0b11, false, tiles));
        assertThrows(IllegalArgumentException.class, () -> new Board(3, 0b1, false, tiles));
        assertThrows(IllegalArgumentException.class, () -> new Board(0, 0b1, false, tiles));
    }

    @Test
    void removeEmptiesTileAndAdvancesTurn() {
        Board board = BoardBuilder.newBoard().row("A A A").build();
        int color = board.tileAt(new Point(0, 0)).color();

        Removal removal = board.remove(new Point(1, 0), color);

        assertEquals(Tile.Kind.EMPTY, board.tileAt(new Point(1, 0)).kind());
        assertEquals(1, board.turn());
        assertEquals(2, board.removableCount());
        assertEquals(1, removal.turn());
        assertEquals(0, removal.clearedWildColor());
        assertTrue(removal.survivors().isEmpty());
    }

    @Test
    void randomRemovalsUndoExactly() {
        Random random = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            Board board = BoardFactory.everyKind().build();
            BoardSnapshot initial = board.snapshot();
            Deque<Removal> removals = new ArrayDeque<>();
            Deque<BoardSnapshot> history = new ArrayDeque<>();

            while (true) {
                List<Point> frontier = FrontierHelper.listFrontier(board, FrontierHelper.ANY_COLOR, true);
                if (frontier.isEmpty()) {
                    break;
                }
                history.push(board.snapshot());
                removals.push(board.remove(frontier.get(random.nextInt(frontier.size())), 0));
                assertInvariants(board);
            }
            assertNotEquals(initial, board.snapshot());

            while (!removals.isEmpty()) {
                board.undo(removals.pop());
                assertEquals(history.pop(), board.snapshot());
                assertInvariants(board);
            }
            assertEquals(initial, board.snapshot());
        }
    }

    @Test
    void removableCountMatchesScan() {
        Board board = BoardFactory.everyKind().build();
        Deque<Removal> removals = new ArrayDeque<>();
        List<Point> frontier;
        while (!(frontier = FrontierHelper.listFrontier(board, FrontierHelper.ANY_COLOR, true)).isEmpty()) {
            removals.push(board.remove(frontier.get(frontier.size() - 1), 0));
            assertEquals(scanRemovable(board), board.removableCount());
        }
        while (!removals.isEmpty()) {
            board.undo(removals.pop());
            assertEquals(scanRemovable(board), board.removableCount());
        }
    }

    @Test
    void wildColorsTrackWildTiles() {
        Board board = BoardFactory.twoWilds().build();
        assertEquals(2, countWilds(board));
        assertEquals(0b11, board.wildColors());

        Removal first = board.remove(new Point(1, 1), board.tileAt(new Point(2, 0)).color());
        assertEquals(1, countWilds(board));
        assertEquals(0b01, board.wildColors());

        Removal second = board.remove(new Point(1, 0), 0);
        assertEquals(0, countWilds(board));
        assertEquals(0, board.wildColors());
        assertEquals(0b01, second.clearedWildColor());

        board.undo(second);
        assertEquals(0b01, board.wildColors());
        board.undo(first);
        assertEquals(0b11, board.wildColors());
        assertEquals(2, countWilds(board));
    }

    @Test
    void wildRejectsUnavailableColor() {
        Board board = BoardFactory.twoWilds().build();
        board.remove(new Point(1, 1), 0b10);
        assertThrows(IllegalArgumentException.class, () -> board.remove(new Point(1, 0), 0b10));
        assertThrows(IllegalArgumentException.class, () -> board.remove(new Point(1, 0), 0b11));
    }

    @Test
    void survivorCascade() {
        Board board = BoardBuilder.newBoard().row("A # A").build();
        int color = board.tileAt(new Point(0, 0)).color();
        BoardSnapshot initial = board.snapshot();

        Removal first = board.remove(new Point(0, 0), color);
        assertTrue(first.survivors().isEmpty());
        assertEquals(Tile.Kind.SURVIVOR, board.tileAt(new Point(1, 0)).kind());

        Removal second = board.remove(new Point(2, 0), color);
        assertEquals(List.of(new Point(1, 0)), second.survivors());
        assertEquals(Tile.Kind.EMPTY, board.tileAt(new Point(1, 0)).kind());
        assertEquals(0, board.removableCount());
        assertEquals(2, board.turn());

        board.undo(second);
        assertEquals(Tile.Kind.SURVIVOR, board.tileAt(new Point(1, 0)).kind());
        assertEquals(Tile.Kind.ORDINARY, board.tileAt(new Point(2, 0)).kind());
        board.undo(first);
        assertEquals(initial, board.snapshot());
    }

    @Test
    void survivorOutlivesRemovableNeighbours() {
        Board board = BoardBuilder.newBoard()
                .row("A # B")
                .row("A A B")
                .build();
        board.remove(new Point(0, 1), 0);
        board.remove(new Point(0, 0), 0);
        assertEquals(Tile.Kind.SURVIVOR, board.tileAt(new Point(1, 0)).kind());
        board.remove(new Point(2, 1), 0);
        board.remove(new Point(2, 0), 0);
        assertEquals(Tile.Kind.EMPTY, board.tileAt(new Point(1, 0)).kind());
    }

    @Test
    void removingUnremovableTileFailsLoudly() {
        Board board = BoardFactory.everyKind().build();
        assertThrows(IllegalStateException.class, () -> board.remove(new Point(2, 0), 0));
        assertThrows(IllegalStateException.class, () -> board.remove(new Point(0, 2), 0));
        assertThrows(IllegalStateException.class, () -> board.remove(new Point(1, 2), 0));
        assertThrows(IndexOutOfBoundsException.class, () -> board.remove(new Point(4, 0), 0));
    }

    @Test
    void assertingWrongColorFailsLoudly() {
        Board board = BoardBuilder.newBoard().row("A B").build();
        int b = board.tileAt(new Point(1, 0)).color();
        assertThrows(IllegalArgumentException.class, () -> board.remove(new Point(0, 0), b));
    }

    @Test
    void undoOutOfOrderFailsLoudly() {
        Board board = BoardBuilder.newBoard().row("A A A").build();
        Removal first = board.remove(new Point(0, 0), 0);
        board.remove(new Point(1, 0), 0);
        assertThrows(IllegalStateException.class, () -> board.undo(first));
    }

    @Test
    void forceRemoveAdvancesWithoutColorBookkeeping() {
        Board board = BoardBuilder.newBoard().wild("A").row("A # *").build();
        board.forceRemove(new Point(2, 0));
        assertEquals(1, board.turn());
        assertEquals(1, board.removableCount());
        assertEquals(1, Integer.bitCount(board.wildColors()));

        board.forceRemove(new Point(0, 0));
        assertEquals(Tile.Kind.EMPTY, board.tileAt(new Point(1, 0)).kind());
        assertTrue(board.isSolved());
        assertThrows(IllegalStateException.class, () -> board.forceRemove(new Point(1, 0)));
    }

    @Test
    void materializedTileFollowsTurn() {
        Board board = BoardBuilder.newBoard().row("A A X").build();
        Point toggle = new Point(2, 0);
        assertEquals('X', board.materializedTileAt(toggle).glyph());
        board.remove(new Point(0, 0), 0);
        assertEquals('O', board.materializedTileAt(toggle).glyph());
        assertEquals(new Tile.Toggle(1), board.tileAt(toggle));
    }

    private static void assertInvariants(Board board) {
        assertEquals(scanRemovable(board), board.removableCount());
        assertEquals(countWilds(board), Integer.bitCount(board.wildColors()));
    }

    private static int scanRemovable(Board board) {
        int count = 0;
        for (int y = 0; y < board.height(); y++) {
            for (int x = 0; x < board.width(); x++) {
                if (board.materializedTileAt(new Point(x, y)).isRemovable()) {
                    count++;
                }
            }
        }
        return count;
    }

    private static int countWilds(Board board) {
        int count = 0;
        for (int y = 0; y < board.height(); y++) {
            for (int x = 0; x < board.width(); x++) {
                if (board.tileAt(new Point(x, y)).kind() == Tile.Kind.WILD) {
                    count++;
                }
            }
        }
        return count;
    }
}
