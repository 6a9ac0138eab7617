package ai.tumblestone.board;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Complete model of a Tumblestone board during a particular turn.
 * <p>
 * The board is a flat grid of {@link Tile tiles} indexed {@code row * width + column}
 * together with the state that the tiles share:
 * <ul>
 *   <li><strong>Turn:</strong> the number of stones removed so far. Combined with a
 *       toggle's initial phase it decides whether that toggle is open.</li>
 *   <li><strong>Wild colors:</strong> the bitwise OR of colors still claimable by
 *       {@link Tile.Wild wild stones}. Each wild stone spends one bit when it is
 *       committed, so the bit count always equals the number of wild stones left.</li>
 *   <li><strong>Color lock:</strong> carried as metadata for display; the solver does not
 *       enforce it.</li>
 *   <li><strong>Removable count:</strong> maintained incrementally so that
 *       {@link #isSolved()} is O(1).</li>
 * </ul>
 * <p>
 * <strong>Mutation:</strong> the board is mutated in place. {@link #remove(Point, int)}
 * answers a {@link Removal} that {@link #undo(Removal)} reverses exactly; removals
 * must be undone in strict reverse order. {@link #forceRemove(Point)} is the
 * irreversible variant used to step through a solution that has already been found.
 * <p>
 * Contract violations (removing an unremovable tile, asserting the wrong color,
 * undoing out of order) are programming errors and throw unchecked exceptions.
 */
public class Board {
    /** Number of stones removed so far. */
    private int turn;

    /** Colors still claimable by wild stones. */
    private int wildColors;

    /** Whether two same-colored triplets may not be played back to back. */
    private final boolean colorLocked;

    /** Row stride: the number of tiles in each row. */
    private final int width;

    /** Number of rows. */
    private final int height;

    /** The physical board in row-major order. */
    private final Tile[] grid;

    /** Number of tiles whose variant is directly removable. */
    private int removableCount;

    /** ANSI 256-color overrides for ordinary glyphs, as declared by the board file. */
    private final Map<Character, Integer> glyphColors;

    /**
     * Constructs a board with no display overrides.
     *
     * @see #Board(int, int, boolean, List, Map)
     */
    public Board(int width, int wildColors, boolean colorLocked, List<Tile> tiles) {
        this(width, wildColors, colorLocked, tiles, Collections.emptyMap());
    }

    /**
     * Constructs a board on turn zero.
     *
     * @param width the number of tiles per row; must be positive
     * @param wildColors the wild-color mask; its bit count must equal the number of wild tiles
     * @param colorLocked the color-lock flag
     * @param tiles all tiles in row-major order; the size must be a positive multiple of {@code width}
     * @param glyphColors ANSI 256-color indices keyed by ordinary glyph
     * @throws IllegalArgumentException if the tiles do not form a consistent board
     */
    public Board(int width, int wildColors, boolean colorLocked, List<Tile> tiles, Map<Character, Integer> glyphColors) {
        Objects.requireNonNull(tiles, "tiles");
        if (width <= 0) {
            throw new IllegalArgumentException("Board width must be positive: " + width);
        }
        if (tiles.isEmpty() || tiles.size() % width != 0) {
            throw new IllegalArgumentException(
                    "Board of " + tiles.size() + " tiles is not a whole number of rows of width " + width);
        }
        int wilds = 0;
        int removable = 0;
        for (Tile tile : tiles) {
            Objects.requireNonNull(tile, "tile");
            if (tile.kind() == Tile.Kind.WILD) {
                wilds++;
            }
            if (tile.isRemovable()) {
                removable++;
            }
        }
        if (Integer.bitCount(wildColors) != wilds) {
            throw new IllegalArgumentException("Board has " + wilds + " wild tiles but "
                    + Integer.bitCount(wildColors) + " wild colors");
        }
        this.turn = 0;
        this.wildColors = wildColors;
        this.colorLocked = colorLocked;
        this.width = width;
        this.height = tiles.size() / width;
        this.grid = tiles.toArray(new Tile[0]);
        this.removableCount = removable;
        this.glyphColors = Map.copyOf(glyphColors);
    }

    public int turn() {
        return turn;
    }

    public int wildColors() {
        return wildColors;
    }

    public boolean isColorLocked() {
        return colorLocked;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Returns the display color override for an ordinary glyph, or null if none was declared.
     */
    public Integer glyphColor(char glyph) {
        return glyphColors.get(glyph);
    }

    /**
     * Returns the number of tiles that can currently be removed directly.
     */
    public int removableCount() {
        return removableCount;
    }

    /**
     * Returns true once every removable tile is gone.
     */
    public boolean isSolved() {
        return removableCount == 0;
    }

    /**
     * Returns true if {@code point} lies on the board.
     */
    public boolean contains(Point point) {
        return point.x() >= 0 && point.x() < width && point.y() >= 0 && point.y() < height;
    }

    /**
     * Returns the stored tile at {@code point}, without resolving turn-dependent state.
     */
    public Tile tileAt(Point point) {
        return grid[indexOf(point)];
    }

    /**
     * Returns the tile at {@code point} as it behaves on the current turn.
     */
    public Tile materializedTileAt(Point point) {
        return tileAt(point).forTurn(turn);
    }

    /**
     * Removes the tile at {@code point} and answers how to reverse the removal.
     * <p>
     * The tile becomes {@link Tile#EMPTY}, the turn advances and the removable count
     * drops by one. A wild tile spends {@code assertedColor} from the wild mask; with
     * no asserted color it commits to the lowest color still available. If the row is
     * left without removable tiles, its survivors are cleared as well.
     *
     * @param point the position of the tile to remove
     * @param assertedColor {@code 0}, or the color the removal is made for
     * @return the record to pass to {@link #undo(Removal)}
     * @throws IllegalStateException if the tile is not removable
     * @throws IllegalArgumentException if {@code assertedColor} does not fit the tile
     */
    public Removal remove(Point point, int assertedColor) {
        int index = indexOf(point);
        Tile tile = grid[index].forTurn(turn);
        if (!tile.isRemovable()) {
            throw new IllegalStateException("Tile " + tile + " at " + point + " is not removable");
        }
        int claimed = 0;
        switch (tile.kind()) {
            case ORDINARY -> {
                if (assertedColor != 0 && assertedColor != tile.color()) {
                    throw new IllegalArgumentException("Asserted color " + assertedColor
                            + " does not match " + tile + " at " + point);
                }
            }
            case WILD -> {
                claimed = assertedColor != 0 ? assertedColor : Integer.lowestOneBit(wildColors);
                if (Integer.bitCount(claimed) != 1 || (wildColors & claimed) == 0) {
                    throw new IllegalArgumentException("Color " + assertedColor
                            + " is not available to the wild tile at " + point);
                }
                wildColors &= ~claimed;
            }
            default -> throw new IllegalStateException("Unexpected removable tile " + tile);
        }
        Tile prior = grid[index];
        grid[index] = Tile.EMPTY;
        turn++;
        removableCount--;
        List<Point> survivors = cascadeSurvivors(point.y());
        return new Removal(point, prior, claimed, survivors, turn);
    }

    /**
     * Reverses the most recent {@link #remove(Point, int)}.
     * <p>
     * Survivors cleared by the cascade come back first, then the removed tile, its
     * wild color, the removable count and the turn.
     *
     * @param removal the record answered by the matching removal
     * @throws IllegalStateException if {@code removal} is not the most recent removal
     */
    public void undo(Removal removal) {
        int index = indexOf(removal.point());
        if (removal.turn() != turn || grid[index].kind() != Tile.Kind.EMPTY) {
            throw new IllegalStateException("Removal at " + removal.point() + " on turn " + removal.turn()
                    + " is not the latest removal (turn " + turn + ")");
        }
        for (Point survivor : removal.survivors()) {
            grid[indexOf(survivor)] = Tile.SURVIVOR;
        }
        grid[index] = removal.tile();
        wildColors |= removal.clearedWildColor();
        removableCount++;
        turn--;
    }

    /**
     * Removes the tile at {@code point} without recording how to undo it.
     * <p>
     * Used only to step through a solution that has already been found: the turn
     * advances and survivors cascade, but no wild color is spent.
     *
     * @throws IllegalStateException if the tile is not removable
     */
    public void forceRemove(Point point) {
        int index = indexOf(point);
        Tile tile = grid[index].forTurn(turn);
        if (!tile.isRemovable()) {
            throw new IllegalStateException("Tile " + tile + " at " + point + " is not removable");
        }
        grid[index] = Tile.EMPTY;
        turn++;
        removableCount--;
        cascadeSurvivors(point.y());
    }

    /**
     * Captures the current mutable state for later comparison.
     */
    public BoardSnapshot snapshot() {
        return new BoardSnapshot(turn, wildColors, removableCount, Arrays.asList(grid));
    }

    /**
     * Clears every survivor in {@code row} if nothing removable remains there.
     *
     * @return the positions of the cleared survivors
     */
    private List<Point> cascadeSurvivors(int row) {
        int start = row * width;
        for (int column = 0; column < width; column++) {
            if (grid[start + column].isRemovable()) {
                return Collections.emptyList();
            }
        }
        List<Point> cleared = new ArrayList<>();
        for (int column = 0; column < width; column++) {
            if (grid[start + column].kind() == Tile.Kind.SURVIVOR) {
                grid[start + column] = Tile.EMPTY;
                cleared.add(new Point(column, row));
            }
        }
        return cleared;
    }

    private int indexOf(Point point) {
        if (!contains(point)) {
            throw new IndexOutOfBoundsException("Point " + point + " is outside a "
                    + width + "x" + height + " board");
        }
        return point.y() * width + point.x();
    }

    /**
     * Returns the board rendered without ANSI colors.
     */
    @Override
    public String toString() {
        return new BoardFormatter(this, false).format(null);
    }
}
