package ai.tumblestone.board;

/**
 * A single cell of a Tumblestone board.
 * <p>
 * Tiles form a closed set of variants, one record per kind. Every variant is
 * immutable; state that depends on the board's turn (only the phase of a
 * {@link Toggle}) is resolved by {@link #forTurn(int)} rather than stored on
 * the board.
 * <p>
 * <strong>Variants:</strong>
 * <ul>
 *   <li>{@link Empty}: no stone, never removable.</li>
 *   <li>{@link Ordinary}: a colored stone, removable.</li>
 *   <li>{@link Survivor}: never removable directly; cleared by the row cascade.</li>
 *   <li>{@link Wild}: removable, stands for any color still in the board's wild mask.</li>
 *   <li>{@link Toggle}: never removable; alternately open and closed as turns pass.</li>
 * </ul>
 * Callers dispatch on {@link #kind()} with a {@code switch}, so adding a kind is
 * a compile-time checked change everywhere tiles are interpreted.
 */
public sealed interface Tile permits Tile.Empty, Tile.Ordinary, Tile.Survivor, Tile.Wild, Tile.Toggle {

    /** The shared empty tile. */
    Tile EMPTY = new Empty();

    /** The shared survivor tile. */
    Tile SURVIVOR = new Survivor();

    /** The shared wild tile. */
    Tile WILD = new Wild();

    /** Discriminator for exhaustive dispatch over tile variants. */
    enum Kind {
        EMPTY,
        ORDINARY,
        SURVIVOR,
        WILD,
        TOGGLE
    }

    /**
     * Returns the variant of this tile.
     */
    Kind kind();

    /**
     * Returns true if a player may remove this tile directly.
     */
    boolean isRemovable();

    /**
     * Returns this tile as it behaves on the given turn.
     *
     * @param turn the board's current turn
     * @return a tile with its turn-dependent state resolved
     */
    Tile forTurn(int turn);

    /**
     * Returns the single character that represents this tile on screen.
     * <p>
     * For toggles, materialize with {@link #forTurn(int)} first.
     */
    char glyph();

    /**
     * Returns the color bit of this tile, or {@code 0} if it has none.
     */
    default int color() {
        return 0;
    }

    /** The absence of a stone. */
    record Empty() implements Tile {
        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }

        @Override
        public boolean isRemovable() {
            return false;
        }

        @Override
        public Tile forTurn(int turn) {
            return this;
        }

        @Override
        public char glyph() {
            return ' ';
        }
    }

    /**
     * An ordinary colored stone.
     *
     * @param rep the character that represents this stone in board files and on screen
     * @param color a mask with exactly one bit set; the bit identifies the color
     */
    record Ordinary(char rep, int color) implements Tile {
        public Ordinary {
            if (Integer.bitCount(color) != 1) {
                throw new IllegalArgumentException("Ordinary tile color must have exactly one bit set: " + color);
            }
        }

        @Override
        public Kind kind() {
            return Kind.ORDINARY;
        }

        @Override
        public boolean isRemovable() {
            return true;
        }

        @Override
        public Tile forTurn(int turn) {
            return this;
        }

        @Override
        public char glyph() {
            return rep;
        }
    }

    /** A stone that vanishes once its row holds nothing removable. */
    record Survivor() implements Tile {
        @Override
        public Kind kind() {
            return Kind.SURVIVOR;
        }

        @Override
        public boolean isRemovable() {
            return false;
        }

        @Override
        public Tile forTurn(int turn) {
            return this;
        }

        @Override
        public char glyph() {
            return '#';
        }
    }

    /**
     * A stone that may stand for any color of the board's wild mask. The color
     * space lives on the {@link Board}, not on the stone.
     */
    record Wild() implements Tile {
        @Override
        public Kind kind() {
            return Kind.WILD;
        }

        @Override
        public boolean isRemovable() {
            return true;
        }

        @Override
        public Tile forTurn(int turn) {
            return this;
        }

        @Override
        public char glyph() {
            return '*';
        }
    }

    /**
     * An obstruction that opens and closes on alternate turns.
     *
     * @param phase {@code 0} if open on even turns, {@code 1} if closed on even turns
     */
    record Toggle(int phase) implements Tile {
        public Toggle {
            phase &= 1;
        }

        /**
         * Returns true if stones above this toggle are reachable.
         * <p>
         * Only meaningful on a materialized toggle.
         */
        public boolean isOpen() {
            return phase == 0;
        }

        @Override
        public Kind kind() {
            return Kind.TOGGLE;
        }

        @Override
        public boolean isRemovable() {
            return false;
        }

        @Override
        public Tile forTurn(int turn) {
            return new Toggle(phase + turn);
        }

        @Override
        public char glyph() {
            return isOpen() ? 'O' : 'X';
        }
    }
}
