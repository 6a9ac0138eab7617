package ai.tumblestone.board;

/**
 * Raised when a board file cannot be turned into a valid {@link Board}.
 * <p>
 * Each failure carries a {@link Kind} so callers can distinguish malformed syntax
 * from semantically inconsistent boards, and the 1-based line number of the
 * offending line where one exists.
 */
public class BoardParseException extends Exception {

    /** The category of parse failure. */
    public enum Kind {
        /** A legend line is not of the form {@code key: value}. */
        MALFORMED_LEGEND,
        /** A required legend property is absent. */
        MISSING_PROPERTY,
        /** A legend key is not recognised. */
        UNKNOWN_PROPERTY,
        /** A legend value cannot be interpreted for its key. */
        INVALID_PROPERTY,
        /** The board uses more than 32 distinct colors. */
        TOO_MANY_COLORS,
        /** The number of wild tiles differs from the number of wild colors. */
        WILD_COUNT_MISMATCH,
        /** The tiles do not fill a whole number of rows. */
        INCOMPLETE_GRID,
        /** The grid section is missing or holds no tiles. */
        EMPTY_GRID
    }

    private final Kind kind;

    /** 1-based line number, or 0 when the failure concerns the board as a whole. */
    private final int line;

    public BoardParseException(Kind kind, int line, String message) {
        super(line > 0 ? "line " + line + ": " + message : message);
        this.kind = kind;
        this.line = line;
    }

    public Kind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }
}
