package ai.tumblestone.board;

/**
 * A board coordinate. {@code x} is the column and {@code y} the row; the origin
 * {@code (0, 0)} is the uppermost leftmost cell.
 */
public record Point(int x, int y) {

    /**
     * Returns the coordinate in the {@code (x, y)} form used by hints.
     */
    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
