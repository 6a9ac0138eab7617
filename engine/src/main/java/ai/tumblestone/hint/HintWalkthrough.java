package ai.tumblestone.hint;

import ai.tumblestone.board.Board;
import ai.tumblestone.board.BoardFormatter;
import ai.tumblestone.board.Point;
import ai.tumblestone.config.SolverProperties;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Steps a user through a solution one hint at a time.
 * <p>
 * For every move the board is printed with the move highlighted, then the move is
 * applied with {@link Board#forceRemove(Point)}. In interactive mode the walkthrough
 * then blocks until the user presses Enter; closing the input ends the walkthrough
 * early. The cleared board is printed once every move has been shown.
 */
@Component
public class HintWalkthrough {
    private static final Logger log = LoggerFactory.getLogger(HintWalkthrough.class);

    /** Prompt printed between hints. */
    static final String PROMPT_PLAIN = "Press [Enter] for next hint.";

    private final Scanner scanner;
    private final PrintStream out;
    private final SolverProperties properties;

    @Autowired
    public HintWalkthrough(SolverProperties properties) {
        this(properties, System.in, System.out);
    }

    public HintWalkthrough(SolverProperties properties, InputStream in, PrintStream out) {
        this.properties = properties;
        this.scanner = new Scanner(in);
        this.out = out;
    }

    /**
     * Presents {@code moves} on {@code board}, consuming the board in the process.
     *
     * @param board the board the moves were computed for, on the turn they start from
     * @param moves the solution to present
     * @return the number of moves applied; less than {@code moves.size()} if input closed early
     */
    public int walk(Board board, List<Point> moves) {
        BoardFormatter formatter = new BoardFormatter(board, properties.isAnsi());
        int applied = 0;
        for (Point move : moves) {
            out.println(formatter.format(move));
            board.forceRemove(move);
            applied++;
            if (log.isDebugEnabled()) {
                log.debug("Hint {}/{}: took {}", applied, moves.size(), move);
            }
            if (properties.isInteractive()) {
                out.println(prompt());
                if (!scanner.hasNextLine()) {
                    if (log.isDebugEnabled()) {
                        log.debug("Input closed after {} of {} hints", applied, moves.size());
                    }
                    return applied;
                }
                scanner.nextLine();
            }
        }
        out.println(formatter.format(null));
        return applied;
    }

    private String prompt() {
        if (!properties.isAnsi()) {
            return PROMPT_PLAIN;
        }
        return "Press \u001B[38;5;15m[Enter]\u001B[0m for next hint.";
    }
}
