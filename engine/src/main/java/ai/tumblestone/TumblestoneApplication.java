package ai.tumblestone;

import ai.tumblestone.board.Board;
import ai.tumblestone.board.BoardFormatter;
import ai.tumblestone.board.BoardParseException;
import ai.tumblestone.board.BoardParser;
import ai.tumblestone.config.SolverProperties;
import ai.tumblestone.hint.HintWalkthrough;
import ai.tumblestone.solver.SolveResult;
import ai.tumblestone.solver.TripletSolver;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point: loads a board file, solves it and walks the user through
 * the solution.
 * <p>
 * Usage: {@code tumblestone <board-file>}. Missing arguments, missing files, unreadable
 * files and malformed boards each end the process with their own {@link ExitStatus}.
 */
@SpringBootApplication
public class TumblestoneApplication implements CommandLineRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(TumblestoneApplication.class);

    static final String USAGE = "Usage: tumblestone <board-file>";
    static final String NO_SOLUTION = "No solution exists.";

    private final TripletSolver solver;
    private final HintWalkthrough walkthrough;
    private final SolverProperties properties;
    private final PrintStream out;
    private final PrintStream err;

    private ExitStatus status = ExitStatus.OK;

    @Autowired
    public TumblestoneApplication(TripletSolver solver, HintWalkthrough walkthrough, SolverProperties properties) {
        this(solver, walkthrough, properties, System.out, System.err);
    }

    public TumblestoneApplication(
            TripletSolver solver,
            HintWalkthrough walkthrough,
            SolverProperties properties,
            PrintStream out,
            PrintStream err) {
        this.solver = solver;
        this.walkthrough = walkthrough;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(TumblestoneApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public void run(String... args) {
        status = execute(args);
    }

    @Override
    public int getExitCode() {
        return status.getCode();
    }

    /**
     * Loads, solves and presents the board named by the first non-option argument.
     *
     * @param args command-line arguments; Spring-style {@code --key=value} options are skipped
     * @return the outcome to report as the process exit code
     */
    public ExitStatus execute(String... args) {
        String file = null;
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                file = arg;
                break;
            }
        }
        if (file == null) {
            err.println(USAGE);
            return ExitStatus.USAGE;
        }

        Board board;
        try {
            String contents = Files.readString(Path.of(file), StandardCharsets.UTF_8);
            board = BoardParser.parse(contents);
        } catch (NoSuchFileException e) {
            err.println("Board file not found: " + file);
            return ExitStatus.FILE_NOT_FOUND;
        } catch (BoardParseException e) {
            err.println("Could not parse " + file + " (" + e.getKind() + "): " + e.getMessage());
            return ExitStatus.PARSE_ERROR;
        } catch (IOException e) {
            log.error("Failed to read board file {}", file, e);
            err.println("Could not read " + file + ": " + e.getMessage());
            return ExitStatus.IO_ERROR;
        }

        if (log.isDebugEnabled()) {
            log.debug("Loaded {}x{} board from {} with {} removable stones", board.width(), board.height(),
                    file, board.removableCount());
        }
        SolveResult result = solver.solve(board);
        if (log.isInfoEnabled()) {
            log.info("{} {} after visiting {} nodes", file, result.solved()
                    ? "solved in " + result.moves().size() + " moves" : "has no solution", result.nodesVisited());
        }
        if (!result.solved()) {
            out.println(new BoardFormatter(board, properties.isAnsi()).format(null));
            out.println(properties.isAnsi() ? "\u001B[38;5;11m" + NO_SOLUTION + "\u001B[0m" : NO_SOLUTION);
            return ExitStatus.OK;
        }
        walkthrough.walk(board, result.moves());
        return ExitStatus.OK;
    }
}
