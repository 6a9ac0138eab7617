package ai.tumblestone.helpers;

import ai.tumblestone.board.Board;

/**
 * Canonical boards shared across tests.
 *
 * <p>Tests that need unusual layouts should use {@link BoardBuilder} directly.
 */
public final class BoardFactory {

    private BoardFactory() {
    }

    /**
     * One of every tile kind, solvable in four triplets.
     *
     * <pre>
     * B G # B
     * R G * B
     * O . B X
     * R G R B
     * </pre>
     */
    public static BoardBuilder everyKind() {
        return BoardBuilder.newBoard()
                .wild("B")
                .row("B G # B")
                .row("R G * B")
                .row("O . B X")
                .row("R G R B");
    }

    /**
     * Six stones in which the single {@code B} can never complete a triplet.
     */
    public static Board isolatedColor() {
        return BoardBuilder.newBoard()
                .row("A A B")
                .row("A C C")
                .build();
    }

    /**
     * Two wilds sharing two wild colors.
     *
     * <pre>
     * R * G
     * R * G
     * </pre>
     */
    public static BoardBuilder twoWilds() {
        return BoardBuilder.newBoard()
                .wild("RG")
                .row("R * G")
                .row("R * G");
    }
}
