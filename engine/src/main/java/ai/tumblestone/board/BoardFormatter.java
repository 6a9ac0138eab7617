package ai.tumblestone.board;

import java.util.regex.Pattern;

/**
 * Handles formatting and rendering of a Tumblestone board for console display.
 * <p>
 * Produces a boxed grid with column and row indices, a header carrying the turn
 * number (and the color-lock flag when set), and an optional highlighted cell with a
 * matching {@code Next: (x, y)} footer. Glyphs are colored with ANSI 256-color
 * escapes: ordinary stones use the override declared in the board file, otherwise a
 * default palette keyed by color index.
 * <p>
 * All tiles are materialized for the board's current turn before rendering, so
 * toggles show as {@code O} when open and {@code X} when closed.
 */
public class BoardFormatter {
    /** ANSI escape to reset text formatting. */
    private static final String ANSI_RESET = "\u001B[0m";

    /** Matches any ANSI SGR escape; used for visible-length calculations. */
    private static final Pattern ANSI_PATTERN = Pattern.compile("\u001B\\[[0-9;]*m");

    /** Default 256-color indices for ordinary stones, by color bit index. */
    private static final int[] DEFAULT_PALETTE = {9, 10, 12, 11, 13, 14, 208, 129, 46, 196, 33, 226};

    /** Color of wild stones. */
    private static final int WILD_COLOR = 15;

    /** Color of toggles and survivors. */
    private static final int FIXTURE_COLOR = 244;

    /** Color of the highlight brackets. */
    private static final int HIGHLIGHT_COLOR = 15;

    /** Reference to the board being formatted. */
    private final Board board;

    /** Whether ANSI escapes are emitted. */
    private final boolean ansi;

    /**
     * Constructs a formatter for the given board.
     *
     * @param board the board to format; must not be null
     * @param ansi true to color glyphs with ANSI escapes
     */
    public BoardFormatter(Board board, boolean ansi) {
        this.board = board;
        this.ansi = ansi;
    }

    /**
     * Renders the complete board as a multi-line string.
     *
     * @param highlight the cell to bracket and announce as the next move, or null
     * @return the formatted board
     */
    public String format(Point highlight) {
        StringBuilder sb = new StringBuilder();
        sb.append("Turn ").append(board.turn());
        if (board.isColorLocked()) {
            sb.append("  (color lock)");
        }
        sb.append('\n');

        String indent = " ".repeat(rowLabelWidth() + 1);
        sb.append(indent);
        for (int column = 0; column < board.width(); column++) {
            sb.append(' ').append(center(Integer.toString(column), 3));
        }
        sb.append('\n');

        String border = indent + "+" + "---+".repeat(board.width());
        sb.append(border).append('\n');
        for (int row = 0; row < board.height(); row++) {
            sb.append(padLeft(Integer.toString(row), rowLabelWidth())).append(" |");
            for (int column = 0; column < board.width(); column++) {
                Point point = new Point(column, row);
                sb.append(cell(point, point.equals(highlight))).append('|');
            }
            sb.append('\n');
        }
        sb.append(border).append('\n');

        if (highlight != null) {
            sb.append("Next: ").append(highlight).append('\n');
        }
        return sb.toString();
    }

    /**
     * Returns the number of visible characters in {@code value}, ignoring ANSI escapes.
     */
    public static int visibleLength(String value) {
        return stripAnsi(value).length();
    }

    /**
     * Removes all ANSI escapes from {@code value}.
     */
    public static String stripAnsi(String value) {
        return ANSI_PATTERN.matcher(value).replaceAll("");
    }

    /**
     * Renders a single three-character cell.
     */
    private String cell(Point point, boolean highlighted) {
        Tile tile = board.materializedTileAt(point);
        String glyph = colorize(Character.toString(tile.glyph()), colorOf(tile));
        if (highlighted) {
            return colorize("[", HIGHLIGHT_COLOR) + glyph + colorize("]", HIGHLIGHT_COLOR);
        }
        return " " + glyph + " ";
    }

    /**
     * Returns the 256-color index used to display {@code tile}, or -1 for none.
     */
    private int colorOf(Tile tile) {
        return switch (tile.kind()) {
            case EMPTY -> -1;
            case ORDINARY -> {
                Integer override = board.glyphColor(tile.glyph());
                if (override != null) {
                    yield override;
                }
                int index = Integer.numberOfTrailingZeros(tile.color());
                yield DEFAULT_PALETTE[index % DEFAULT_PALETTE.length];
            }
            case WILD -> WILD_COLOR;
            case SURVIVOR, TOGGLE -> FIXTURE_COLOR;
        };
    }

    private String colorize(String value, int color) {
        if (!ansi || color < 0) {
            return value;
        }
        return "\u001B[38;5;" + color + "m" + value + ANSI_RESET;
    }

    private int rowLabelWidth() {
        return Integer.toString(Math.max(0, board.height() - 1)).length();
    }

    private static String padLeft(String value, int width) {
        int padding = width - visibleLength(value);
        return padding > 0 ? " ".repeat(padding) + value : value;
    }

    /**
     * Centres {@code value} within {@code width} characters, extra space going right.
     */
    private static String center(String value, int width) {
        int padding = width - visibleLength(value);
        if (padding <= 0) {
            return value;
        }
        int left = padding / 2;
        return " ".repeat(left) + value + " ".repeat(padding - left);
    }
}
